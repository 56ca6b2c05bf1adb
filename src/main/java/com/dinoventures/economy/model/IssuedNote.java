package com.dinoventures.economy.model;

import lombok.Value;

import java.util.UUID;

@Value
public class IssuedNote {
    UUID noteId;
    long currencyId;
    long amount;
    String recipientExternalId;
    String token;
}
