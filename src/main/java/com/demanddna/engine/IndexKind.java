package com.demanddna.engine;

/**
 * The three normalized seasonal indices (median = 1.0) that make up a DNA profile.
 */
public enum IndexKind {
    TRAFFIC,
    CONVERSION_RATE,
    ORDER_VALUE
}
