package com.demanddna.service;

import com.demanddna.dto.AttributionRequest;
import com.demanddna.dto.AttributionResponse;
import com.demanddna.engine.ForecastContext;
import com.demanddna.engine.PureDna;
import com.demanddna.engine.attribution.AttributionEngine;
import com.demanddna.engine.attribution.AttributionReport;
import com.demanddna.engine.attribution.AttributionTarget;
import com.demanddna.engine.event.EventLog;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.UUID;

/**
 * Runs sequential marginal attribution with the log prefixes evaluated concurrently.
 * {@code flatMapSequential} keeps prefix order, so the report matches a sequential run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttributionService {

    private final ScenarioSessionService sessionService;
    private final DnaService dnaService;
    private final AttributionEngine attributionEngine;

    @Value("${attribution.parallelism:4}")
    private int parallelism;

    private Scheduler scheduler;

    @PostConstruct
    void init() {
        scheduler = Schedulers.newParallel("attribution", Math.max(1, parallelism));
    }

    @PreDestroy
    void shutdown() {
        if (scheduler != null) {
            scheduler.dispose();
        }
    }

    public Mono<AttributionResponse> attribute(UUID scenarioId, AttributionRequest request, String requestId) {
        Scenario scenario = sessionService.get(scenarioId);
        ScenarioContext context = scenario.context();
        EventLog eventLog = scenario.events();
        AttributionTarget target = new AttributionTarget(
            request.getMetric(), request.getValue(), request.getStart(), request.getEnd());

        if (!AttributionEngine.windowInYear(target, context.projectionYear())) {
            log.warn("Attribution window outside projection year | scenario={} | start={} | end={} | requestId={}",
                     scenarioId, request.getStart(), request.getEnd(), requestId);
            return Mono.just(toResponse(scenarioId, AttributionReport.emptyWindow(request.getMetric())));
        }

        PureDna dna = dnaService.pureDna(context);
        ForecastContext forecastContext = context.forecastContext();
        return Flux.range(0, eventLog.size() + 1)
            .flatMapSequential(length -> Mono.fromCallable(() ->
                    attributionEngine.evaluatePrefix(dna, forecastContext, eventLog.prefix(length), length, target))
                .subscribeOn(scheduler), Math.max(1, parallelism))
            .collectList()
            .map(totals -> attributionEngine.assemble(eventLog, target, totals))
            .doOnNext(report -> log.info(
                "Attribution done | scenario={} | metric={} | events={} | gap={} | requestId={}",
                scenarioId, report.attributedMetric(), eventLog.size(), report.gap(), requestId))
            .map(report -> toResponse(scenarioId, report));
    }

    private AttributionResponse toResponse(UUID scenarioId, AttributionReport report) {
        return AttributionResponse.builder()
            .scenarioId(scenarioId)
            .targetMetric(report.targetMetric())
            .attributedMetric(report.attributedMetric())
            .organic(report.organic())
            .needed(report.needed())
            .fullLog(report.fullLog())
            .gap(report.gap())
            .targetWindowEmpty(report.targetWindowEmpty())
            .rows(report.rows())
            .build();
    }
}
