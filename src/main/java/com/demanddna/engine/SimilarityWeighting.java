package com.demanddna.engine;

import java.time.LocalDate;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Scores each historical year by how closely its volumes over the trial days match the
 * observed trial totals.
 *
 * <pre>
 *   err_y = (|dSessions|/max(obs,1) + |dConversions|/max(obs,1) + |dRevenue|/max(obs,1)) / 3
 *   w_y   = 1 / (err_y + 0.01)
 *   norm  = w_y / sum(w)
 * </pre>
 *
 * Only daily-granularity rows whose day-of-year falls in the trial window count. The
 * {@code Overall} pseudo-year and the projection year itself are excluded. Linear in the
 * number of rows.
 */
public class SimilarityWeighting {

    private static final double ERROR_FLOOR = 0.01;

    public Map<String, Double> weights(List<ProfilePoint> dailyRows, int projectionYear, TrialObservation trial) {
        Set<Integer> trialDays = new HashSet<>();
        for (LocalDate day : trial.days()) {
            trialDays.add(day.getDayOfYear());
        }
        String projectionLabel = String.valueOf(projectionYear);

        Map<String, double[]> yearTotals = new TreeMap<>();
        for (ProfilePoint row : dailyRows) {
            if (row.granularity() != Granularity.DAILY
                    || row.isOverall()
                    || projectionLabel.equals(row.yearLabel())
                    || !trialDays.contains(row.period())) {
                continue;
            }
            double[] totals = yearTotals.computeIfAbsent(row.yearLabel(), k -> new double[3]);
            totals[0] += row.sessions();
            totals[1] += row.conversions();
            totals[2] += row.revenue();
        }

        MetricValues observed = trial.observed();
        Map<String, Double> raw = new LinkedHashMap<>();
        double total = 0.0;
        for (Map.Entry<String, double[]> entry : yearTotals.entrySet()) {
            double[] sums = entry.getValue();
            double err = (relativeError(observed.sessions(), sums[0])
                + relativeError(observed.conversions(), sums[1])
                + relativeError(observed.revenue(), sums[2])) / 3.0;
            double weight = 1.0 / (err + ERROR_FLOOR);
            raw.put(entry.getKey(), weight);
            total += weight;
        }
        if (total <= 0) {
            return Collections.emptyMap();
        }

        Map<String, Double> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            normalized.put(entry.getKey(), entry.getValue() / total);
        }
        return normalized;
    }

    private static double relativeError(double observed, double historical) {
        return Math.abs(observed - historical) / Math.max(observed, 1.0);
    }
}
