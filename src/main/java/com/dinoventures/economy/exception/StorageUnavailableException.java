package com.dinoventures.economy.exception;

public class StorageUnavailableException extends EconomyException {
    public StorageUnavailableException(Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE, "Storage unavailable, operation was not applied", cause);
    }
}
