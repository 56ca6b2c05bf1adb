package com.dinoventures.economy.exception;

public class DuplicateCurrencyException extends EconomyException {
    public DuplicateCurrencyException(long groupId, String name) {
        super(ErrorCode.DUPLICATE_CURRENCY, "Currency '" + name + "' already exists in group " + groupId);
    }
}
