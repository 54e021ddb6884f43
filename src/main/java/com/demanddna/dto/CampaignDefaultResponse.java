package com.demanddna.dto;

import com.demanddna.engine.ShockShape;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CampaignDefaultResponse {
    String entity;
    ShockShape shape;
    String campaignLabel;
    double liftPercent;
    /** Where the effective value came from: ENTITY, GLOBAL or BUILT_IN. */
    String source;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant updatedAt;
}
