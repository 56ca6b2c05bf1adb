package com.dinoventures.economy.exception;

public class CurrencyNotFoundException extends EconomyException {
    public CurrencyNotFoundException(long currencyId) {
        super(ErrorCode.CURRENCY_NOT_FOUND, "Currency not found: id=" + currencyId);
    }

    public CurrencyNotFoundException(long currencyId, long groupId) {
        super(ErrorCode.CURRENCY_NOT_FOUND, "Currency not found in group " + groupId + ": id=" + currencyId);
    }

    public static CurrencyNotFoundException noPrimary(long groupId) {
        return new CurrencyNotFoundException("Group " + groupId + " has no primary currency");
    }

    private CurrencyNotFoundException(String message) {
        super(ErrorCode.CURRENCY_NOT_FOUND, message);
    }
}
