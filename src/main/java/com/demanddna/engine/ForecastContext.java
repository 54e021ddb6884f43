package com.demanddna.engine;

/**
 * Everything a pipeline run needs besides the DNA and the event log.
 */
public record ForecastContext(int projectionYear, TrialObservation trial) {

    public static ForecastContext forTrial(TrialObservation trial) {
        return new ForecastContext(trial.start().getYear(), trial);
    }
}
