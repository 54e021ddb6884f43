package com.demanddna.engine.goal;

import com.demanddna.engine.Granularity;
import com.demanddna.engine.ProfilePoint;
import com.demanddna.engine.TargetMetric;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Actual volumes of one historical year, summed from the monthly profile rows.
 */
public record YearlyKpi(int year, double sessions, double conversions, double revenue) {

    @JsonProperty
    public double conversionRate() {
        return KpiSnapshot.ratio(conversions, sessions);
    }

    @JsonProperty
    public double orderValue() {
        return KpiSnapshot.ratio(revenue, conversions);
    }

    public double value(TargetMetric metric) {
        return switch (metric) {
            case SESSIONS -> sessions;
            case CONVERSIONS -> conversions;
            case REVENUE -> revenue;
            case CONVERSION_RATE -> conversionRate();
            case ORDER_VALUE -> orderValue();
        };
    }

    /** Target for {@code metric} at {@code growthPercent} over this year's actual. */
    public double grown(TargetMetric metric, double growthPercent) {
        return value(metric) * (1.0 + growthPercent / 100.0);
    }

    /**
     * One entry per year label, ascending. Overall and non-monthly rows are ignored.
     */
    public static List<YearlyKpi> fromMonthly(List<ProfilePoint> rows) {
        Map<Integer, double[]> sums = new TreeMap<>();
        for (ProfilePoint row : rows) {
            if (row.isOverall() || row.granularity() != Granularity.MONTHLY) {
                continue;
            }
            double[] acc = sums.computeIfAbsent(Integer.parseInt(row.yearLabel()), y -> new double[3]);
            acc[0] += row.sessions();
            acc[1] += row.conversions();
            acc[2] += row.revenue();
        }
        List<YearlyKpi> out = new ArrayList<>(sums.size());
        sums.forEach((year, acc) -> out.add(new YearlyKpi(year, acc[0], acc[1], acc[2])));
        return out;
    }
}
