package com.demanddna.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IngestionResponse {
    int stored;
    int replaced;
    List<String> entities;
    String requestId;
}
