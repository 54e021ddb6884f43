package com.demanddna.exception;

public class InvalidGoalException extends DemandDnaException {
    public InvalidGoalException(String message) {
        super("INVALID_GOAL", message);
    }
}
