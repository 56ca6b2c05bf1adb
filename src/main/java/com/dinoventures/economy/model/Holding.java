package com.dinoventures.economy.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * One wallet balance together with the owning account's creation time, as read for
 * leaderboard aggregation.
 */
@Value
@Builder
public class Holding {
    long accountId;
    String externalId;
    OffsetDateTime accountCreatedAt;
    long currencyId;
    long balance;
}
