package com.demanddna.exception;

public class InvalidEventException extends DemandDnaException {
    public InvalidEventException(String message) {
        super("INVALID_EVENT", message);
    }
}
