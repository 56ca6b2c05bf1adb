package com.dinoventures.economy.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of one economic action. {@code eventId} is assigned at creation and
 * is the natural key the sink uses to ignore re-delivered events.
 *
 * Exchange events also carry the credited side in {@code counterCurrencyId} and
 * {@code counterAmount}; both are null for every other kind.
 */
@Value
@Builder
public class AuditEvent {
    UUID eventId;
    AuditEventKind kind;
    Long actorAccountId;
    Long counterpartAccountId;
    Long currencyId;
    long amount;
    Long counterCurrencyId;
    Long counterAmount;
    Instant occurredAt;

    public static AuditEvent of(AuditEventKind kind, long actorAccountId, Long counterpartAccountId,
                                long currencyId, long amount) {
        return AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .kind(kind)
                .actorAccountId(actorAccountId)
                .counterpartAccountId(counterpartAccountId)
                .currencyId(currencyId)
                .amount(amount)
                .occurredAt(Instant.now())
                .build();
    }

    public static AuditEvent exchange(long accountId, long fromCurrencyId, long debited,
                                      long toCurrencyId, long credited) {
        return AuditEvent.builder()
                .eventId(UUID.randomUUID())
                .kind(AuditEventKind.EXCHANGE)
                .actorAccountId(accountId)
                .currencyId(fromCurrencyId)
                .amount(debited)
                .counterCurrencyId(toCurrencyId)
                .counterAmount(credited)
                .occurredAt(Instant.now())
                .build();
    }
}
