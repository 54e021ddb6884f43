package com.demanddna.dto;

import com.demanddna.engine.CalibrationConstants;
import com.demanddna.engine.MetricValues;
import com.demanddna.engine.ProjectionRow;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ProjectionResponse {
    UUID scenarioId;
    int year;
    int eventCount;
    CalibrationConstants constants;
    double margin;
    MetricValues baselineTotals;
    MetricValues simulationTotals;
    List<ProjectionRow> rows;
}
