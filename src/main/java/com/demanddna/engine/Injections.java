package com.demanddna.engine;

import java.util.Arrays;

/**
 * Per-row re-injected volumes: {@code absolute} is added as-is, {@code relative} is a fraction
 * of the row's baseline.
 */
public record Injections(MetricValues[] absolute, MetricValues[] relative) {

    static Injections none(int size) {
        MetricValues[] absolute = new MetricValues[size];
        MetricValues[] relative = new MetricValues[size];
        Arrays.fill(absolute, MetricValues.ZERO);
        Arrays.fill(relative, MetricValues.ZERO);
        return new Injections(absolute, relative);
    }
}
