package com.demanddna.engine;

import java.time.LocalDate;
import java.util.List;

/**
 * Daily baseline and simulated series for one projection year, with the frame they were
 * derived from.
 */
public record ProjectionResult(
    int year,
    CalibrationConstants constants,
    double margin,
    List<ProjectionRow> rows,
    YearFrame frame
) {

    public enum Series {
        BASELINE,
        SIMULATION
    }

    public MetricValues totals(Series series, LocalDate start, LocalDate end) {
        MetricValues total = MetricValues.ZERO;
        for (int row : frame.rowsBetween(start, end)) {
            ProjectionRow r = rows.get(row);
            total = total.plus(series == Series.BASELINE ? r.baseline() : r.simulation());
        }
        return total;
    }

    public double total(Series series, Metric metric, LocalDate start, LocalDate end) {
        return totals(series, start, end).get(metric);
    }

    public MetricValues yearTotals(Series series) {
        return totals(series, LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }
}
