package com.dinoventures.economy.model.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class IssueNoteRequest {

    @NotBlank(message = "issuer_user_id is required")
    private String issuerUserId;

    @NotBlank(message = "recipient_user_id is required")
    private String recipientUserId;

    @NotNull(message = "currency_id is required")
    private Long currencyId;

    @NotNull(message = "amount is required")
    @Min(value = 1, message = "amount must be at least 1")
    private Long amount;
}
