package com.demanddna.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Blends the all-time monthly profile with the similarity-weighted per-year profiles:
 * {@code pure_m = overallWeight * overallMedian_m + (1 - overallWeight) * sum(w_y * yearMedian_y,m)}.
 * Medians are taken across the selected entities. A year without a value for a month
 * contributes the overall median; a month absent from the overall rows uses the neutral 1.0.
 */
public class DnaBlender {

    private final double overallWeight;

    public DnaBlender(double overallWeight) {
        this.overallWeight = overallWeight;
    }

    public double getOverallWeight() {
        return overallWeight;
    }

    public PureDna blend(List<ProfilePoint> monthlyRows, Map<String, Double> weights) {
        Map<Integer, List<IndexValues>> overallRows = new TreeMap<>();
        Map<String, Map<Integer, List<IndexValues>>> yearRows = new HashMap<>();
        for (ProfilePoint row : monthlyRows) {
            if (row.granularity() != Granularity.MONTHLY) {
                continue;
            }
            if (row.isOverall()) {
                overallRows.computeIfAbsent(row.period(), k -> new ArrayList<>()).add(row.indices());
            } else {
                yearRows.computeIfAbsent(row.yearLabel(), k -> new TreeMap<>())
                    .computeIfAbsent(row.period(), k -> new ArrayList<>())
                    .add(row.indices());
            }
        }

        Map<Integer, IndexValues> overall = medians(overallRows);
        Map<String, Map<Integer, IndexValues>> perYear = new HashMap<>();
        yearRows.forEach((year, rows) -> perYear.put(year, medians(rows)));

        double historicalWeight = 1.0 - overallWeight;
        Map<Integer, IndexValues> months = new TreeMap<>();
        for (int month = 1; month <= 12; month++) {
            IndexValues base = overall.getOrDefault(month, IndexValues.NEUTRAL);
            double[] blended = new double[IndexKind.values().length];
            for (IndexKind kind : IndexKind.values()) {
                double value = overallWeight * base.get(kind);
                for (Map.Entry<String, Double> weight : weights.entrySet()) {
                    IndexValues year = perYear.getOrDefault(weight.getKey(), Map.of()).getOrDefault(month, base);
                    value += historicalWeight * weight.getValue() * year.get(kind);
                }
                blended[kind.ordinal()] = value;
            }
            months.put(month, new IndexValues(blended[0], blended[1], blended[2]));
        }
        return new PureDna(months);
    }

    private static Map<Integer, IndexValues> medians(Map<Integer, List<IndexValues>> rowsByPeriod) {
        Map<Integer, IndexValues> medians = new TreeMap<>();
        rowsByPeriod.forEach((period, rows) -> medians.put(period, new IndexValues(
            median(rows, IndexKind.TRAFFIC),
            median(rows, IndexKind.CONVERSION_RATE),
            median(rows, IndexKind.ORDER_VALUE))));
        return medians;
    }

    private static double median(List<IndexValues> rows, IndexKind kind) {
        return Stats.median(rows.stream().mapToDouble(v -> v.get(kind)).toArray());
    }
}
