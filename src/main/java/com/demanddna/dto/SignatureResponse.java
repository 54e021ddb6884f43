package com.demanddna.dto;

import com.demanddna.engine.MetricValues;
import com.demanddna.engine.SignatureDay;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SignatureResponse {
    UUID id;
    String name;
    List<String> entities;
    LocalDate originStart;
    LocalDate originEnd;
    int durationDays;
    MetricValues floor;
    MetricValues totalExcess;
    double organicConversionRate;
    double eventConversionRate;
    double conversionRateDelta;
    List<SignatureDay> days;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
}
