package com.demanddna.engine;

import java.time.LocalDate;

public record ProjectionRow(
    LocalDate date,
    int month,
    int week,
    int dayOfYear,
    double shockMultiplier,
    MetricValues baseline,
    MetricValues simulation,
    MetricValues baselineMin,
    MetricValues baselineMax,
    MetricValues simulationMin,
    MetricValues simulationMax
) {
}
