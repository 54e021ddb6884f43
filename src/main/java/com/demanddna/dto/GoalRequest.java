package com.demanddna.dto;

import com.demanddna.engine.Granularity;
import com.demanddna.engine.TargetMetric;
import com.demanddna.engine.goal.VolumeDriver;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class GoalRequest {

    @NotNull(message = "metric is required")
    TargetMetric metric;

    /** Absolute target. Leave empty when the target derives from {@link #baseYear}. */
    @DecimalMin(value = "0.0", message = "value must be >= 0")
    Double value;

    /** Historical year whose actual KPI is grown into the target. Single-entity scenarios only. */
    Integer baseYear;

    /** Growth over the base year's actual, in percent. Defaults to 5. */
    Double growthPercent;

    @NotNull(message = "start is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate start;

    @NotNull(message = "end is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate end;

    @Builder.Default
    VolumeDriver driver = VolumeDriver.TRAFFIC;

    /** Defaults to the scenario's resolution. */
    Granularity resolution;
}
