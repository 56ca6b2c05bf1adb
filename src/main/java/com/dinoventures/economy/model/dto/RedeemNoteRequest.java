package com.dinoventures.economy.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RedeemNoteRequest {

    @NotBlank(message = "user_id is required")
    private String userId;

    @NotBlank(message = "token is required")
    private String token;
}
