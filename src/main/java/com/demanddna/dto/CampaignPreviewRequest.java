package com.demanddna.dto;

import com.demanddna.engine.ShockShape;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Prospective campaign. When {@code liftPercent} is omitted the effective default for
 * {@code entity} and {@code shape} is used.
 */
@Value
@Builder
@Jacksonized
public class CampaignPreviewRequest {

    @NotNull(message = "start is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate start;

    @NotNull(message = "end is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate end;

    @NotNull(message = "shape is required")
    ShockShape shape;

    Double liftPercent;

    String entity;
}
