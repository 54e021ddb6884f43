package com.demanddna.engine.goal;

import com.demanddna.engine.MetricValues;

import java.time.LocalDate;

/**
 * One period of the target window. Gaps are {@code value - needed}; negative means behind.
 */
public record GoalPeriod(
    int period,
    LocalDate firstDate,
    MetricValues baseline,
    MetricValues simulation,
    MetricValues needed,
    MetricValues baselineGap,
    MetricValues simulationGap
) {
}
