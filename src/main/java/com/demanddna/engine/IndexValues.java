package com.demanddna.engine;

public record IndexValues(double traffic, double conversionRate, double orderValue) {

    public static final IndexValues NEUTRAL = new IndexValues(1.0, 1.0, 1.0);

    public double get(IndexKind kind) {
        return switch (kind) {
            case TRAFFIC -> traffic;
            case CONVERSION_RATE -> conversionRate;
            case ORDER_VALUE -> orderValue;
        };
    }
}
