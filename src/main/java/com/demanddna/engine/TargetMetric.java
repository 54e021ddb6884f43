package com.demanddna.engine;

/**
 * Metric a goal is expressed in. Ratio targets are tracked through the revenue volume.
 */
public enum TargetMetric {
    SESSIONS(Metric.SESSIONS),
    CONVERSIONS(Metric.CONVERSIONS),
    REVENUE(Metric.REVENUE),
    CONVERSION_RATE(Metric.REVENUE),
    ORDER_VALUE(Metric.REVENUE);

    private final Metric volumeMetric;

    TargetMetric(Metric volumeMetric) {
        this.volumeMetric = volumeMetric;
    }

    public Metric volumeMetric() {
        return volumeMetric;
    }

    public boolean isRatio() {
        return this == CONVERSION_RATE || this == ORDER_VALUE;
    }
}
