package com.dinoventures.economy.exception;

public class InsufficientBalanceException extends EconomyException {
    public InsufficientBalanceException(long accountId, long currencyId, long available, long requested) {
        super(ErrorCode.INSUFFICIENT_BALANCE, String.format(
            "Insufficient balance for account %d (currency %d): available=%d, requested=%d",
            accountId, currencyId, available, requested
        ));
    }
}
