package com.demanddna.dto;

import com.demanddna.engine.ShockShape;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CampaignDefaultRequest {

    /** Entity name, or {@code __all__} for the global fallback. */
    @NotBlank(message = "entity is required")
    String entity;

    @NotNull(message = "shape is required")
    ShockShape shape;

    @DecimalMin(value = "-100.0", message = "liftPercent must be >= -100")
    @DecimalMax(value = "1000.0", message = "liftPercent must be <= 1000")
    double liftPercent;
}
