package com.demanddna.engine.event;

/**
 * Which index layer a structural event edits. Pre-trial edits also shift the calibration
 * anchor; post-trial edits only reshape the simulation.
 */
public enum EventScope {
    PRE_TRIAL("Pre-Trial"),
    POST_TRIAL("Post-Trial");

    private final String label;

    EventScope(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
