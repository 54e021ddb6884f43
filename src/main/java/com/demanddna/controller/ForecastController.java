package com.demanddna.controller;

import com.demanddna.config.RequestIdFilter;
import com.demanddna.dto.AttributionRequest;
import com.demanddna.dto.AttributionResponse;
import com.demanddna.dto.DnaProfileResponse;
import com.demanddna.dto.GoalRequest;
import com.demanddna.dto.GoalResponse;
import com.demanddna.dto.ProjectionResponse;
import com.demanddna.dto.WeightsResponse;
import com.demanddna.engine.Granularity;
import com.demanddna.service.AttributionService;
import com.demanddna.service.ForecastService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/scenarios/{id}")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastService forecastService;
    private final AttributionService attributionService;

    @GetMapping("/weights")
    public ResponseEntity<WeightsResponse> weights(@PathVariable UUID id) {
        return ResponseEntity.ok(forecastService.weights(id));
    }

    @GetMapping("/projection")
    public ResponseEntity<ProjectionResponse> projection(
            @PathVariable UUID id, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("GET /scenarios/{}/projection | requestId={}", id, requestId);
        return ResponseEntity.ok(forecastService.project(id, requestId));
    }

    @GetMapping("/dna")
    public ResponseEntity<DnaProfileResponse> dna(
            @PathVariable UUID id, @RequestParam(required = false) Granularity granularity) {
        return ResponseEntity.ok(forecastService.dnaProfile(id, granularity));
    }

    @PostMapping("/goal")
    public ResponseEntity<GoalResponse> goal(
            @PathVariable UUID id, @Valid @RequestBody GoalRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /scenarios/{}/goal | metric={} | value={} | baseYear={} | requestId={}",
                 id, request.getMetric(), request.getValue(), request.getBaseYear(), requestId);
        return ResponseEntity.ok(forecastService.goal(id, request, requestId));
    }

    @PostMapping("/attribution")
    public Mono<ResponseEntity<AttributionResponse>> attribution(
            @PathVariable UUID id, @Valid @RequestBody AttributionRequest request,
            HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /scenarios/{}/attribution | metric={} | value={} | requestId={}",
                 id, request.getMetric(), request.getValue(), requestId);
        return attributionService.attribute(id, request, requestId).map(ResponseEntity::ok);
    }
}
