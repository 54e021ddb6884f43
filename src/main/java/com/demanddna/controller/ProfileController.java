package com.demanddna.controller;

import com.demanddna.config.RequestIdFilter;
import com.demanddna.dto.DailyTransactionRequest;
import com.demanddna.dto.IngestionResponse;
import com.demanddna.dto.ProfileRecordRequest;
import com.demanddna.engine.goal.YearlyKpi;
import com.demanddna.service.DnaService;
import com.demanddna.service.ProfileIngestionService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileIngestionService ingestionService;
    private final DnaService dnaService;

    @PostMapping("/profiles")
    public ResponseEntity<IngestionResponse> ingestProfiles(
            @Valid @RequestBody List<@Valid ProfileRecordRequest> records, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /profiles | count={} | requestId={}", records.size(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ingestionService.ingestProfiles(records, requestId));
    }

    @PostMapping("/transactions")
    public ResponseEntity<IngestionResponse> ingestTransactions(
            @Valid @RequestBody List<@Valid DailyTransactionRequest> rows, HttpServletRequest httpRequest) {
        String requestId = RequestIdFilter.requestId(httpRequest);
        log.info("POST /transactions | count={} | requestId={}", rows.size(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ingestionService.ingestTransactions(rows, requestId));
    }

    @GetMapping("/profiles/entities")
    public ResponseEntity<List<String>> entities() {
        return ResponseEntity.ok(ingestionService.listEntities());
    }

    @GetMapping("/profiles/{entity}/yearly-kpis")
    public ResponseEntity<List<YearlyKpi>> yearlyKpis(@PathVariable String entity) {
        return ResponseEntity.ok(dnaService.yearlyKpis(ProfileIngestionService.normaliseEntity(entity)));
    }
}
