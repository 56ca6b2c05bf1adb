package com.dinoventures.economy.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateCurrencyRequest {

    @NotBlank(message = "name is required")
    @Size(max = 64, message = "name must be at most 64 characters")
    private String name;
}
