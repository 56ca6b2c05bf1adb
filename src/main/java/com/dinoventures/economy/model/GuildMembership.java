package com.dinoventures.economy.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Denormalized view of a guild's membership joined with the group it points at.
 */
@Data
@Builder
public class GuildMembership {
    private Long guildId;
    private Long groupId;
    private GroupKind groupKind;
    private String groupName;
    private OffsetDateTime joinedAt;
}
