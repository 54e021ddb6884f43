package com.demanddna.exception;

import java.time.LocalDate;

public class InvalidTrialWindowException extends DemandDnaException {
    public InvalidTrialWindowException(LocalDate start, LocalDate end) {
        super("INVALID_TRIAL_WINDOW", "Trial window start " + start + " is after its end " + end + ".");
    }
}
