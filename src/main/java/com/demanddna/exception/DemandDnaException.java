package com.demanddna.exception;

import lombok.Getter;

@Getter
public abstract class DemandDnaException extends RuntimeException {
    private final String errorCode;
    protected DemandDnaException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected DemandDnaException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
