package com.demanddna.engine.event;

public enum InjectionMode {
    /** Stored daily excess volumes are added as-is. */
    ABSOLUTE,
    /** Stored daily excess fractions are multiplied against the baseline of the target day. */
    RELATIVE
}
