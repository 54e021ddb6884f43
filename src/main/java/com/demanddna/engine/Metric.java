package com.demanddna.engine;

/**
 * Volume metrics carried by every projection row.
 */
public enum Metric {
    SESSIONS,
    CONVERSIONS,
    REVENUE
}
