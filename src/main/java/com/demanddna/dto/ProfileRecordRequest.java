package com.demanddna.dto;

import com.demanddna.engine.Granularity;
import jakarta.validation.constraints.*;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ProfileRecordRequest {

    @NotBlank(message = "entity is required")
    String entity;

    @NotBlank(message = "yearLabel is required")
    @Pattern(regexp = "(?i)\\d{4}|overall", message = "yearLabel must be a four digit year or Overall")
    String yearLabel;

    @NotNull(message = "granularity is required")
    Granularity granularity;

    @Min(value = 1, message = "period must be >= 1")
    @Max(value = 366, message = "period must be <= 366")
    int period;

    @DecimalMin(value = "0.0", message = "sessions must be >= 0")
    double sessions;

    @DecimalMin(value = "0.0", message = "conversions must be >= 0")
    double conversions;

    @DecimalMin(value = "0.0", message = "revenue must be >= 0")
    double revenue;

    double conversionRate;
    double orderValue;

    @DecimalMin(value = "0.0", message = "trafficIndex must be >= 0")
    double trafficIndex;

    @DecimalMin(value = "0.0", message = "conversionRateIndex must be >= 0")
    double conversionRateIndex;

    @DecimalMin(value = "0.0", message = "orderValueIndex must be >= 0")
    double orderValueIndex;
}
