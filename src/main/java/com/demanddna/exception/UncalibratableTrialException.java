package com.demanddna.exception;

import java.time.LocalDate;

public class UncalibratableTrialException extends DemandDnaException {
    public UncalibratableTrialException(LocalDate start, LocalDate end, int projectionYear) {
        super("UNCALIBRATABLE_TRIAL",
              "Trial window " + start + ".." + end + " cannot anchor projection year " + projectionYear
                  + ": no overlapping days or zero pre-trial traffic index. Widen the trial period.");
    }
}
