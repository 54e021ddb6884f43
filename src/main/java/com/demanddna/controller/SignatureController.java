package com.demanddna.controller;

import com.demanddna.config.RequestIdFilter;
import com.demanddna.dto.InjectSignatureRequest;
import com.demanddna.dto.ScenarioResponse;
import com.demanddna.dto.SignatureExtractionResponse;
import com.demanddna.dto.SignatureRequest;
import com.demanddna.dto.SignatureResponse;
import com.demanddna.service.SignatureService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SignatureController {

    private final SignatureService signatureService;

    @PostMapping("/signatures/extract")
    public ResponseEntity<SignatureExtractionResponse> extract(@Valid @RequestBody SignatureRequest request) {
        return ResponseEntity.ok(signatureService.extract(request));
    }

    @PostMapping("/signatures")
    public ResponseEntity<SignatureResponse> save(
            @Valid @RequestBody SignatureRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /signatures | entities={} | window={}..{} | requestId={}",
                 request.getEntities(), request.getStart(), request.getEnd(), requestId);
        SignatureResponse body = signatureService.save(request, requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("Location", "/api/v1/signatures/" + body.getId())
            .body(body);
    }

    @GetMapping("/signatures")
    public ResponseEntity<List<SignatureResponse>> list() {
        return ResponseEntity.ok(signatureService.list());
    }

    @GetMapping("/signatures/{id}")
    public ResponseEntity<SignatureResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(signatureService.get(id));
    }

    @DeleteMapping("/signatures/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        signatureService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/scenarios/{id}/signatures/{signatureId}/inject")
    public ResponseEntity<ScenarioResponse> inject(
            @PathVariable UUID id, @PathVariable UUID signatureId,
            @Valid @RequestBody InjectSignatureRequest request) {
        log.info("POST /scenarios/{}/signatures/{}/inject | newStart={} | mode={}",
                 id, signatureId, request.getNewStart(), request.getMode());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(signatureService.inject(id, signatureId, request));
    }
}
