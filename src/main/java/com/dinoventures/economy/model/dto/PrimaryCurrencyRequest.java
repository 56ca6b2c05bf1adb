package com.dinoventures.economy.model.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PrimaryCurrencyRequest {

    @NotNull(message = "currency_id is required")
    private Long currencyId;
}
