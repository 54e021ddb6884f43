package com.demanddna.service;

import com.demanddna.engine.ForecastContext;
import com.demanddna.engine.Granularity;
import com.demanddna.engine.TrialObservation;

import java.util.List;

/**
 * Explicit per-session parameters threaded through weighting, calibration, projection and
 * attribution. Entity names are already normalised.
 */
public record ScenarioContext(
    List<String> entities,
    TrialObservation trial,
    int projectionYear,
    Granularity resolution
) {

    public ScenarioContext {
        entities = List.copyOf(entities);
    }

    public ForecastContext forecastContext() {
        return new ForecastContext(projectionYear, trial);
    }
}
