package com.demanddna.engine;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Separates event-driven demand from organic demand in a historical window. The organic
 * floor of each metric is a low percentile of its daily totals inside the window; anything
 * above it is excess.
 */
public class SignatureExtractor {

    private final int contextDays;
    private final double floorPercentile;

    public SignatureExtractor(int contextDays, double floorPercentile) {
        this.contextDays = contextDays;
        this.floorPercentile = floorPercentile;
    }

    public LocalDate contextStart(LocalDate windowStart) {
        return windowStart.minusDays(contextDays);
    }

    public LocalDate contextEnd(LocalDate windowEnd) {
        return windowEnd.plusDays(contextDays);
    }

    /**
     * Sums observations per calendar day, ordered by date.
     */
    public List<DailyObservation> aggregateByDay(List<DailyObservation> observations) {
        Map<LocalDate, MetricValues> byDay = new TreeMap<>();
        for (DailyObservation observation : observations) {
            byDay.merge(observation.date(), observation.values(), MetricValues::plus);
        }
        List<DailyObservation> aggregated = new ArrayList<>(byDay.size());
        byDay.forEach((date, v) -> aggregated.add(new DailyObservation(date, v.sessions(), v.conversions(), v.revenue())));
        return aggregated;
    }

    /**
     * @param observations raw per-entity rows covering at least the context range
     */
    public SignatureExtraction extract(String name, LocalDate start, LocalDate end, List<DailyObservation> observations) {
        LocalDate contextStart = contextStart(start);
        LocalDate contextEnd = contextEnd(end);
        List<DailyObservation> context = new ArrayList<>();
        List<DailyObservation> window = new ArrayList<>();
        for (DailyObservation day : aggregateByDay(observations)) {
            if (day.date().isBefore(contextStart) || day.date().isAfter(contextEnd)) {
                continue;
            }
            context.add(day);
            if (!day.date().isBefore(start) && !day.date().isAfter(end)) {
                window.add(day);
            }
        }
        if (window.isEmpty()) {
            return new SignatureExtraction(contextStart, contextEnd, context, MetricValues.ZERO, Optional.empty());
        }

        MetricValues floor = new MetricValues(
            Stats.percentile(column(window, Metric.SESSIONS), floorPercentile),
            Stats.percentile(column(window, Metric.CONVERSIONS), floorPercentile),
            Stats.percentile(column(window, Metric.REVENUE), floorPercentile));

        List<SignatureDay> days = new ArrayList<>(window.size());
        MetricValues totalExcess = MetricValues.ZERO;
        for (DailyObservation day : window) {
            MetricValues excess = new MetricValues(
                Math.max(0.0, day.sessions() - floor.sessions()),
                Math.max(0.0, day.conversions() - floor.conversions()),
                Math.max(0.0, day.revenue() - floor.revenue()));
            MetricValues relative = new MetricValues(
                fraction(excess.sessions(), floor.sessions()),
                fraction(excess.conversions(), floor.conversions()),
                fraction(excess.revenue(), floor.revenue()));
            days.add(new SignatureDay(day.date(), excess, relative));
            totalExcess = totalExcess.plus(excess);
        }

        if (totalExcess.sessions() <= 0) {
            return new SignatureExtraction(contextStart, contextEnd, context, floor, Optional.empty());
        }

        double organicCr = floor.sessions() > 0 ? floor.conversions() / floor.sessions() : 0.0;
        double eventCr = totalExcess.conversions() / totalExcess.sessions();
        int duration = (int) ChronoUnit.DAYS.between(start, end) + 1;
        ShockSignature signature = new ShockSignature(name, start, end, duration, floor, totalExcess,
            organicCr, eventCr, eventCr - organicCr, days);
        return new SignatureExtraction(contextStart, contextEnd, context, floor, Optional.of(signature));
    }

    private static double[] column(List<DailyObservation> days, Metric metric) {
        return days.stream().mapToDouble(d -> d.values().get(metric)).toArray();
    }

    private static double fraction(double excess, double floor) {
        return floor > 0 ? excess / floor : 0.0;
    }
}
