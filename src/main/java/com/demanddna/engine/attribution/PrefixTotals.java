package com.demanddna.engine.attribution;

import com.demanddna.engine.MetricValues;

/**
 * Target-window totals of one event-log prefix. {@code calibrated} is false when the prefix
 * left the trial window uncalibratable, in which case both totals are zero.
 */
public record PrefixTotals(int length, MetricValues simulated, MetricValues baseline, boolean calibrated) {

    public static PrefixTotals uncalibrated(int length) {
        return new PrefixTotals(length, MetricValues.ZERO, MetricValues.ZERO, false);
    }
}
