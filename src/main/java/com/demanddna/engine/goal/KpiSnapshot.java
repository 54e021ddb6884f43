package com.demanddna.engine.goal;

import com.demanddna.engine.MetricValues;

public record KpiSnapshot(double sessions, double conversions, double revenue, double conversionRate, double orderValue) {

    public static final KpiSnapshot ZERO = new KpiSnapshot(0, 0, 0, 0, 0);

    /**
     * Ratios derived from the volumes, zero where the denominator is not positive.
     */
    public static KpiSnapshot of(MetricValues volumes) {
        return new KpiSnapshot(volumes.sessions(), volumes.conversions(), volumes.revenue(),
            ratio(volumes.conversions(), volumes.sessions()),
            ratio(volumes.revenue(), volumes.conversions()));
    }

    static double ratio(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0.0;
    }
}
