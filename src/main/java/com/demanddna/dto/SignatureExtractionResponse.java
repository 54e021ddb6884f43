package com.demanddna.dto;

import com.demanddna.engine.DailyObservation;
import com.demanddna.engine.MetricValues;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
public class SignatureExtractionResponse {
    LocalDate contextStart;
    LocalDate contextEnd;
    List<DailyObservation> context;
    MetricValues floor;
    SignatureResponse signature;
}
