package com.demanddna.dto;

import com.demanddna.engine.Granularity;
import com.demanddna.engine.TargetMetric;
import com.demanddna.engine.goal.GoalPeriod;
import com.demanddna.engine.goal.KpiSnapshot;
import com.demanddna.engine.goal.VolumeDriver;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class GoalResponse {
    UUID scenarioId;
    TargetMetric metric;
    double value;
    Integer baseYear;
    Double growthPercent;
    Double baseValue;
    VolumeDriver driver;
    Granularity resolution;
    boolean targetWindowEmpty;
    KpiSnapshot needed;
    KpiSnapshot before;
    KpiSnapshot after;
    List<GoalPeriod> periods;
}
