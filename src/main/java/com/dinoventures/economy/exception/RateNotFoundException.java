package com.dinoventures.economy.exception;

public class RateNotFoundException extends EconomyException {
    public RateNotFoundException(long baseCurrencyId, long quoteCurrencyId) {
        super(ErrorCode.RATE_NOT_FOUND, String.format(
            "No exchange rate configured from currency %d to currency %d", baseCurrencyId, quoteCurrencyId
        ));
    }
}
