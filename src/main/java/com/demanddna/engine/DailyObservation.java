package com.demanddna.engine;

import java.time.LocalDate;

public record DailyObservation(LocalDate date, double sessions, double conversions, double revenue) {

    public MetricValues values() {
        return new MetricValues(sessions, conversions, revenue);
    }
}
