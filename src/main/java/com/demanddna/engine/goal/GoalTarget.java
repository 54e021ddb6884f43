package com.demanddna.engine.goal;

import com.demanddna.engine.Granularity;
import com.demanddna.engine.TargetMetric;

import java.time.LocalDate;

public record GoalTarget(
    TargetMetric metric,
    double value,
    LocalDate start,
    LocalDate end,
    VolumeDriver driver,
    Granularity resolution
) {
}
