package com.demanddna.engine;

/**
 * Absolute-unit anchors: sessions per unit of traffic index, conversion rate and order value
 * per unit of their respective indices.
 */
public record CalibrationConstants(double baseSessions, double baseConversionRate, double baseOrderValue) {
}
