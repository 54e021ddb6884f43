package com.demanddna.engine;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Canonical monthly seasonality profile (month 1-12 to blended indices).
 */
public record PureDna(Map<Integer, IndexValues> months) {

    public PureDna {
        months = Collections.unmodifiableMap(new TreeMap<>(months));
    }

    public static PureDna neutral() {
        Map<Integer, IndexValues> months = new TreeMap<>();
        for (int month = 1; month <= 12; month++) {
            months.put(month, IndexValues.NEUTRAL);
        }
        return new PureDna(months);
    }

    public IndexValues forMonth(int month) {
        return months.getOrDefault(month, IndexValues.NEUTRAL);
    }
}
