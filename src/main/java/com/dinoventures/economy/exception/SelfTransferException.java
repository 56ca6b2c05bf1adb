package com.dinoventures.economy.exception;

public class SelfTransferException extends EconomyException {
    public SelfTransferException(long accountId) {
        super(ErrorCode.SELF_TRANSFER, "Cannot transfer to the same account: id=" + accountId);
    }
}
