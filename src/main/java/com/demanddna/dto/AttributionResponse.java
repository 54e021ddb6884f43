package com.demanddna.dto;

import com.demanddna.engine.Metric;
import com.demanddna.engine.TargetMetric;
import com.demanddna.engine.attribution.AttributionRow;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class AttributionResponse {
    UUID scenarioId;
    TargetMetric targetMetric;
    Metric attributedMetric;
    double organic;
    double needed;
    double fullLog;
    double gap;
    boolean targetWindowEmpty;
    List<AttributionRow> rows;
}
