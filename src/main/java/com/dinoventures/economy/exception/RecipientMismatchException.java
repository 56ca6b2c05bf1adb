package com.dinoventures.economy.exception;

public class RecipientMismatchException extends EconomyException {
    public RecipientMismatchException(String redeemerExternalId) {
        super(ErrorCode.RECIPIENT_MISMATCH, "Bank note is not addressed to user " + redeemerExternalId);
    }
}
