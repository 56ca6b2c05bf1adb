package com.dinoventures.economy.exception;

/**
 * Stable failure codes surfaced to callers. The platform layer uses them to pick a
 * user-facing message; the REST layer maps them to status codes.
 */
public enum ErrorCode {
    /** Sender and receiver are the same account. */
    SELF_TRANSFER,

    /** Wallet balance is below the requested amount. */
    INSUFFICIENT_BALANCE,

    /** Currency does not exist, or does not belong to the group in scope. */
    CURRENCY_NOT_FOUND,

    /** No directional rate is configured between the two currencies. */
    RATE_NOT_FOUND,

    /** Token failed signature verification or could not be parsed. */
    INVALID_SIGNATURE,

    /** Token is bound to a different recipient than the redeemer. */
    RECIPIENT_MISMATCH,

    /** Note has already been redeemed. */
    ALREADY_CONSUMED,

    /** Durable storage failed mid-operation; nothing was applied. Safe to retry. */
    STORAGE_UNAVAILABLE,

    ACCOUNT_NOT_FOUND,

    GROUP_NOT_FOUND,

    BANK_NOTE_NOT_FOUND,

    /** A currency with the same display name already exists in the group. */
    DUPLICATE_CURRENCY
}
