package com.demanddna.engine;

/**
 * One historical profile row as the engine sees it: raw volumes for the period plus the
 * normalized indices. {@code yearLabel} is a four digit year or {@link #OVERALL}.
 */
public record ProfilePoint(
    String entity,
    String yearLabel,
    Granularity granularity,
    int period,
    double sessions,
    double conversions,
    double revenue,
    double trafficIndex,
    double conversionRateIndex,
    double orderValueIndex
) {
    public static final String OVERALL = "Overall";

    public boolean isOverall() {
        return OVERALL.equalsIgnoreCase(yearLabel);
    }

    public IndexValues indices() {
        return new IndexValues(trafficIndex, conversionRateIndex, orderValueIndex);
    }
}
