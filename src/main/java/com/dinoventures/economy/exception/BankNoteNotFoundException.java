package com.dinoventures.economy.exception;

import java.util.UUID;

public class BankNoteNotFoundException extends EconomyException {
    public BankNoteNotFoundException(UUID id) {
        super(ErrorCode.BANK_NOTE_NOT_FOUND, "Bank note not found: id=" + id);
    }
}
