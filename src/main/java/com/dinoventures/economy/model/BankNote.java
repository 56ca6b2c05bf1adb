package com.dinoventures.economy.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Server-side record of an issued note. Only {@code consumed} (and {@code consumedAt})
 * ever change, and only once: Issued to Consumed.
 */
@Data
@Builder
public class BankNote {
    private UUID id;
    private Long currencyId;
    private long amount;
    private Long issuerAccountId;
    private Long recipientAccountId;
    private String recipientExternalId;
    private boolean consumed;
    private OffsetDateTime issuedAt;
    private OffsetDateTime consumedAt;
}
