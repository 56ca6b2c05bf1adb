package com.dinoventures.economy.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MembershipRequest {

    @NotBlank(message = "guild_id is required")
    private String guildId;
}
