package com.demanddna.controller;

import com.demanddna.dto.ScenarioRequest;
import com.demanddna.dto.ScenarioResponse;
import com.demanddna.dto.ShiftEventRequest;
import com.demanddna.engine.event.SimulationEvent;
import com.demanddna.service.ScenarioSessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/** Scenario sessions and their ordered event logs. */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/scenarios")
@RequiredArgsConstructor
public class ScenarioController {

    private final ScenarioSessionService sessionService;

    @PostMapping
    public ResponseEntity<ScenarioResponse> create(@Valid @RequestBody ScenarioRequest request) {
        log.info("POST /scenarios | entities={} | trial={}..{}",
                 request.getEntities(), request.getTrialStart(), request.getTrialEnd());
        ScenarioResponse body = sessionService.toResponse(sessionService.create(request));
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("Location", "/api/v1/scenarios/" + body.getId())
            .body(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScenarioResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(sessionService.toResponse(sessionService.get(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ScenarioResponse> update(
            @PathVariable UUID id, @Valid @RequestBody ScenarioRequest request) {
        return ResponseEntity.ok(sessionService.toResponse(sessionService.updateContext(id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        sessionService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/events")
    public ResponseEntity<ScenarioResponse> appendEvent(
            @PathVariable UUID id, @Valid @RequestBody SimulationEvent event) {
        log.info("POST /scenarios/{}/events | type={}", id, event.eventType());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(sessionService.toResponse(sessionService.appendEvent(id, event)));
    }

    @DeleteMapping("/{id}/events/{index}")
    public ResponseEntity<ScenarioResponse> removeEvent(
            @PathVariable UUID id, @PathVariable @Min(0) int index) {
        return ResponseEntity.ok(sessionService.toResponse(sessionService.removeEvent(id, index)));
    }

    @PostMapping("/{id}/events/{index}/shift")
    public ResponseEntity<ScenarioResponse> shiftEvent(
            @PathVariable UUID id, @PathVariable @Min(0) int index,
            @Valid @RequestBody ShiftEventRequest request) {
        return ResponseEntity.ok(sessionService.toResponse(
            sessionService.shiftEvent(id, index, request.getNewStart())));
    }

    @DeleteMapping("/{id}/events")
    public ResponseEntity<ScenarioResponse> clearEvents(@PathVariable UUID id) {
        return ResponseEntity.ok(sessionService.toResponse(sessionService.clearEvents(id)));
    }
}
