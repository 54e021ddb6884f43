package com.demanddna.dto;

import com.demanddna.engine.DnaProfilePoint;
import com.demanddna.engine.Granularity;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class DnaProfileResponse {
    UUID scenarioId;
    int year;
    Granularity granularity;
    List<DnaProfilePoint> points;
}
