package com.dinoventures.economy.model;

import lombok.Value;

import java.util.UUID;

/**
 * Payload carried by a bank-note token: what it is worth and who may redeem it.
 */
@Value
public class NoteClaims {
    UUID noteId;
    long currencyId;
    long amount;
    String recipientExternalId;
}
