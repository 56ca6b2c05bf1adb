package com.dinoventures.economy.exception;

public class AccountNotFoundException extends EconomyException {
    public AccountNotFoundException(long id) {
        super(ErrorCode.ACCOUNT_NOT_FOUND, "Account not found: id=" + id);
    }
}
