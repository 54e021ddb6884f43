package com.demanddna.engine;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Actual totals observed over a recent date range. {@code adjustmentPercent} strips (positive)
 * or restores (negative) a known lift in the observed values before calibration.
 */
public record TrialObservation(
    LocalDate start,
    LocalDate end,
    MetricValues observed,
    MetricValues adjustmentPercent
) {

    public TrialObservation(LocalDate start, LocalDate end, MetricValues observed) {
        this(start, end, observed, MetricValues.ZERO);
    }

    public MetricValues adjusted() {
        MetricValues pct = adjustmentPercent != null ? adjustmentPercent : MetricValues.ZERO;
        return new MetricValues(
            adjust(observed.sessions(), pct.sessions()),
            adjust(observed.conversions(), pct.conversions()),
            adjust(observed.revenue(), pct.revenue()));
    }

    public List<LocalDate> days() {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            days.add(day);
        }
        return days;
    }

    private static double adjust(double raw, double pct) {
        double factor = 1 + pct / 100.0;
        return factor != 0 ? raw / factor : raw;
    }
}
