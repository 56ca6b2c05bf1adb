package com.dinoventures.economy.exception;

public class InvalidSignatureException extends EconomyException {
    public InvalidSignatureException(String message, Throwable cause) {
        super(ErrorCode.INVALID_SIGNATURE, message, cause);
    }
}
