package com.dinoventures.economy.exception;

import java.util.UUID;

public class AlreadyConsumedException extends EconomyException {
    public AlreadyConsumedException(UUID noteId) {
        super(ErrorCode.ALREADY_CONSUMED, "Bank note already redeemed: id=" + noteId);
    }
}
