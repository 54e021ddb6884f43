package com.demanddna.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Jacksonized
public class SignatureRequest {

    /** Defaults to {@code Shock <start>-><end>}. */
    @Size(max = 200, message = "name must be at most 200 characters")
    String name;

    @NotEmpty(message = "entities must not be empty")
    List<@NotBlank String> entities;

    @NotNull(message = "start is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate start;

    @NotNull(message = "end is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate end;
}
