package com.demanddna.exception;

import java.time.LocalDate;

public class NoSignificantShockException extends DemandDnaException {
    public NoSignificantShockException(LocalDate start, LocalDate end) {
        super("NO_SIGNIFICANT_SHOCK",
              "No significant shock detected above the organic floor between " + start + " and " + end + ".");
    }
}
