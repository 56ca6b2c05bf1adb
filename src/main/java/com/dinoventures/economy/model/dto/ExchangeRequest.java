package com.dinoventures.economy.model.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ExchangeRequest {

    @NotBlank(message = "user_id is required")
    private String userId;

    @NotNull(message = "from_currency_id is required")
    private Long fromCurrencyId;

    @NotNull(message = "to_currency_id is required")
    private Long toCurrencyId;

    @NotNull(message = "amount is required")
    @Min(value = 1, message = "amount must be at least 1")
    private Long amount;
}
