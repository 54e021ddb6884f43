package com.demanddna.dto;

import com.demanddna.engine.IndexValues;
import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class WeightsResponse {
    UUID scenarioId;
    double overallWeight;
    Map<String, Double> weights;
    Map<Integer, IndexValues> pureDna;
}
