package com.dinoventures.economy.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Internal identity bound 1:1 to a chat-platform user id. Holds no balance itself;
 * balances live in {@link Wallet} rows.
 */
@Data
@Builder
public class Account {
    private Long id;
    private String externalId;
    private OffsetDateTime createdAt;
}
