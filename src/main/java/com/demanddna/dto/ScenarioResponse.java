package com.demanddna.dto;

import com.demanddna.engine.Granularity;
import com.demanddna.engine.MetricValues;
import com.demanddna.engine.event.SimulationEvent;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ScenarioResponse {
    UUID id;
    List<String> entities;
    LocalDate trialStart;
    LocalDate trialEnd;
    MetricValues observed;
    MetricValues adjustmentPercent;
    MetricValues adjusted;
    int projectionYear;
    Granularity resolution;
    List<SimulationEvent> events;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant updatedAt;
}
