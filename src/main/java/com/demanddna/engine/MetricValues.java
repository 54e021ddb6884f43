package com.demanddna.engine;

public record MetricValues(double sessions, double conversions, double revenue) {

    public static final MetricValues ZERO = new MetricValues(0.0, 0.0, 0.0);

    public double get(Metric metric) {
        return switch (metric) {
            case SESSIONS -> sessions;
            case CONVERSIONS -> conversions;
            case REVENUE -> revenue;
        };
    }

    public MetricValues plus(MetricValues other) {
        return new MetricValues(sessions + other.sessions, conversions + other.conversions, revenue + other.revenue);
    }

    public MetricValues minus(MetricValues other) {
        return new MetricValues(sessions - other.sessions, conversions - other.conversions, revenue - other.revenue);
    }

    public MetricValues scaled(double factor) {
        return new MetricValues(sessions * factor, conversions * factor, revenue * factor);
    }
}
