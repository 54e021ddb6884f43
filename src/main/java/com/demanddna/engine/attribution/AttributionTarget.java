package com.demanddna.engine.attribution;

import com.demanddna.engine.TargetMetric;

import java.time.LocalDate;

public record AttributionTarget(TargetMetric metric, double value, LocalDate start, LocalDate end) {
}
