package com.dinoventures.economy.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * A federation of guilds sharing currencies. {@code ownerGuildId} is null for the
 * global group.
 */
@Data
@Builder
public class EconomyGroup {
    private Long id;
    private GroupKind kind;
    private String name;
    private Long ownerGuildId;
    private OffsetDateTime createdAt;
}
