package com.demanddna.engine.attribution;

import com.demanddna.engine.Metric;
import com.demanddna.engine.TargetMetric;

import java.util.List;

/**
 * Per-event marginal contributions to the gap between the organic projection and what the
 * target needs. Contributions telescope: their sum equals {@code fullLog - organic}.
 */
public record AttributionReport(
    TargetMetric targetMetric,
    Metric attributedMetric,
    double organic,
    double needed,
    double fullLog,
    double gap,
    List<AttributionRow> rows,
    boolean targetWindowEmpty
) {

    public static AttributionReport emptyWindow(TargetMetric targetMetric) {
        return new AttributionReport(targetMetric, targetMetric.volumeMetric(), 0.0, 0.0, 0.0, 0.0, List.of(), true);
    }

    public double totalContribution() {
        return rows.stream().mapToDouble(AttributionRow::contribution).sum();
    }
}
