package com.dinoventures.economy.model;

import lombok.Value;

import java.util.UUID;

@Value
public class RedeemedNote {
    UUID noteId;
    long accountId;
    long issuerAccountId;
    long currencyId;
    long credited;
}
