package com.demanddna.exception;

import java.util.UUID;

public class ScenarioNotFoundException extends DemandDnaException {
    public ScenarioNotFoundException(UUID id) {
        super("SCENARIO_NOT_FOUND", "Scenario with id '" + id + "' not found.");
    }
}
