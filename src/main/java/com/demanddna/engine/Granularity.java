package com.demanddna.engine;

import java.time.LocalDate;
import java.time.temporal.WeekFields;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Period resolution of profiles and structural events. Weeks are ISO weeks of the
 * week-based year, so the last days of December can belong to week 1.
 */
public enum Granularity {
    MONTHLY,
    WEEKLY,
    DAILY;

    public int periodOf(LocalDate date) {
        return switch (this) {
            case MONTHLY -> date.getMonthValue();
            case WEEKLY -> date.get(WeekFields.ISO.weekOfWeekBasedYear());
            case DAILY -> date.getDayOfYear();
        };
    }

    /**
     * Sorted unique period indices covered by the inclusive date range; empty when start is after end.
     */
    public List<Integer> periodsBetween(LocalDate start, LocalDate end) {
        TreeSet<Integer> periods = new TreeSet<>();
        for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
            periods.add(periodOf(day));
        }
        return new ArrayList<>(periods);
    }
}
