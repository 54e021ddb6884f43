package com.demanddna.engine;

import java.util.Optional;

/**
 * Anchors the unitless pre-trial layer to absolute volumes using the adjusted trial totals.
 * Returns empty when the trial window does not overlap the frame or the pre-trial traffic
 * indices over it sum to zero.
 */
public class Calibrator {

    public Optional<CalibrationConstants> calibrate(YearFrame frame, TrialObservation trial) {
        int[] rows = frame.rowsBetween(trial.start(), trial.end());
        if (rows.length == 0) {
            return Optional.empty();
        }
        double trafficSum = Stats.sum(frame.column(Layer.PRE_TRIAL, IndexKind.TRAFFIC), rows);
        if (trafficSum == 0) {
            return Optional.empty();
        }

        MetricValues adjusted = trial.adjusted();
        double baseSessions = adjusted.sessions() / trafficSum;
        double trialCr = adjusted.sessions() > 0 ? adjusted.conversions() / adjusted.sessions() : 0.0;
        double trialAov = adjusted.conversions() > 0 ? adjusted.revenue() / adjusted.conversions() : 0.0;

        double crMean = Stats.mean(frame.column(Layer.PRE_TRIAL, IndexKind.CONVERSION_RATE), rows);
        double aovMean = Stats.mean(frame.column(Layer.PRE_TRIAL, IndexKind.ORDER_VALUE), rows);
        double baseCr = crMean > 0 ? trialCr / crMean : trialCr;
        double baseAov = aovMean > 0 ? trialAov / aovMean : trialAov;

        return Optional.of(new CalibrationConstants(baseSessions, baseCr, baseAov));
    }
}
