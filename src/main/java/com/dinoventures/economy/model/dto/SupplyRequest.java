package com.dinoventures.economy.model.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Body of mint and burn: one user, one currency, one amount.
 */
@Data
public class SupplyRequest {

    @NotBlank(message = "user_id is required")
    private String userId;

    @NotNull(message = "currency_id is required")
    private Long currencyId;

    @NotNull(message = "amount is required")
    @Min(value = 1, message = "amount must be at least 1")
    private Long amount;
}
