package com.dinoventures.economy.exception;

import lombok.Getter;

/**
 * Base type for every failure the economy core reports to its callers. All of them
 * leave wallet and note state exactly as it was before the call.
 */
@Getter
public abstract class EconomyException extends RuntimeException {

    private final ErrorCode code;

    protected EconomyException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected EconomyException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
