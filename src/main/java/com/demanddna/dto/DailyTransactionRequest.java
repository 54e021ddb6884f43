package com.demanddna.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class DailyTransactionRequest {

    @NotBlank(message = "entity is required")
    String entity;

    @NotNull(message = "date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;

    @DecimalMin(value = "0.0", message = "sessions must be >= 0")
    double sessions;

    @DecimalMin(value = "0.0", message = "conversions must be >= 0")
    double conversions;

    @DecimalMin(value = "0.0", message = "revenue must be >= 0")
    double revenue;
}
