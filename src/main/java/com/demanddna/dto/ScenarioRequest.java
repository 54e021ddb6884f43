package com.demanddna.dto;

import com.demanddna.engine.Granularity;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.*;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * Analyst context: which entities, the observed trial window and the projection year.
 * Adjustment percentages strip a known lift from the observed totals before calibration.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ScenarioRequest {

    @NotEmpty(message = "entities must not be empty")
    List<@NotBlank String> entities;

    @NotNull(message = "trialStart is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate trialStart;

    @NotNull(message = "trialEnd is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate trialEnd;

    @DecimalMin(value = "0.0", message = "observedSessions must be >= 0")
    double observedSessions;

    @DecimalMin(value = "0.0", message = "observedConversions must be >= 0")
    double observedConversions;

    @DecimalMin(value = "0.0", message = "observedRevenue must be >= 0")
    double observedRevenue;

    @DecimalMin(value = "-100.0", message = "sessionsAdjustmentPercent must be >= -100")
    double sessionsAdjustmentPercent;

    @DecimalMin(value = "-100.0", message = "conversionsAdjustmentPercent must be >= -100")
    double conversionsAdjustmentPercent;

    @DecimalMin(value = "-100.0", message = "revenueAdjustmentPercent must be >= -100")
    double revenueAdjustmentPercent;

    @Min(value = 1900, message = "projectionYear must be >= 1900")
    @Max(value = 2200, message = "projectionYear must be <= 2200")
    Integer projectionYear;

    @Builder.Default
    Granularity resolution = Granularity.MONTHLY;
}
