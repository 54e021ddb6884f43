package com.demanddna.engine.goal;

/**
 * Lever assumed to close a revenue or conversion gap. The other levers stay at baseline.
 */
public enum VolumeDriver {
    TRAFFIC,
    CONVERSION_RATE,
    ORDER_VALUE
}
