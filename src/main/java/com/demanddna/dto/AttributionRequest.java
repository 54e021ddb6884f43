package com.demanddna.dto;

import com.demanddna.engine.TargetMetric;
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
public class AttributionRequest {

    @NotNull(message = "metric is required")
    TargetMetric metric;

    @DecimalMin(value = "0.0", message = "value must be >= 0")
    double value;

    @NotNull(message = "start is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate start;

    @NotNull(message = "end is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate end;
}
