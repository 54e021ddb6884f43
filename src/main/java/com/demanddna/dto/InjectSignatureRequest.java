package com.demanddna.dto;

import com.demanddna.engine.event.InjectionMode;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class InjectSignatureRequest {

    @NotNull(message = "newStart is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate newStart;

    @Builder.Default
    InjectionMode mode = InjectionMode.ABSOLUTE;
}
