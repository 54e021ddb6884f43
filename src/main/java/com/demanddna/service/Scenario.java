package com.demanddna.service;

import com.demanddna.engine.event.EventLog;

import java.time.Instant;
import java.util.UUID;

public record Scenario(UUID id, ScenarioContext context, EventLog events, Instant createdAt, Instant updatedAt) {

    Scenario withContext(ScenarioContext next) {
        return new Scenario(id, next, events, createdAt, Instant.now());
    }

    Scenario withEvents(EventLog next) {
        return new Scenario(id, context, next, createdAt, Instant.now());
    }
}
