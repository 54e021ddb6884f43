package com.demanddna.engine;

/**
 * Successive states of the DNA inside a {@link YearFrame}.
 * PURE is the blended profile, PRE_TRIAL adds pre-trial structural events and drives
 * calibration and the baseline, WORK adds post-trial structural events and drives the simulation.
 */
public enum Layer {
    PURE,
    PRE_TRIAL,
    WORK
}
