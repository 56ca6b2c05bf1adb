package com.dinoventures.economy.model;

public enum AuditEventKind {
    MINT,
    BURN,
    EXCHANGE,
    TRANSFER,
    NOTE_ISSUE,
    NOTE_REDEEM
}
