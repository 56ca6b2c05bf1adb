package com.dinoventures.economy.model.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class ExchangeRateRequest {

    @NotNull(message = "base_currency_id is required")
    private Long baseCurrencyId;

    @NotNull(message = "quote_currency_id is required")
    private Long quoteCurrencyId;

    @NotNull(message = "rate is required")
    @DecimalMin(value = "0", inclusive = false, message = "rate must be greater than zero")
    @Digits(integer = 26, fraction = 12, message = "rate allows at most 26 integer digits and 12 decimal places")
    private BigDecimal rate;
}
