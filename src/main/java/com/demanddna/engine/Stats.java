package com.demanddna.engine;

import java.util.Arrays;

final class Stats {

    private Stats() {
    }

    static double mean(double[] column, int[] rows) {
        if (rows.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int row : rows) {
            sum += column[row];
        }
        return sum / rows.length;
    }

    static double sum(double[] column, int[] rows) {
        double sum = 0.0;
        for (int row : rows) {
            sum += column[row];
        }
        return sum;
    }

    static double median(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int size = sorted.length;
        if (size % 2 == 0) {
            return (sorted[size / 2 - 1] + sorted[size / 2]) / 2.0;
        }
        return sorted[size / 2];
    }

    /**
     * Percentile (0-100) with linear interpolation between the closest order statistics.
     */
    static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        if (percentile <= 0) return sorted[0];
        if (percentile >= 100) return sorted[sorted.length - 1];

        double idx = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(idx);
        int upper = (int) Math.ceil(idx);
        if (lower == upper) {
            return sorted[lower];
        }
        double weight = idx - lower;
        return sorted[lower] + weight * (sorted[upper] - sorted[lower]);
    }
}
