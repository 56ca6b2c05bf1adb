package com.dinoventures.economy.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class MembershipResponse {
    private Long groupId;
    private String guildId;
    private boolean changed;
}
