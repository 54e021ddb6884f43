package com.demanddna.service;

import com.demanddna.dto.InjectSignatureRequest;
import com.demanddna.dto.ScenarioResponse;
import com.demanddna.dto.SignatureExtractionResponse;
import com.demanddna.dto.SignatureRequest;
import com.demanddna.dto.SignatureResponse;
import com.demanddna.engine.DailyObservation;
import com.demanddna.engine.MetricValues;
import com.demanddna.engine.ShockSignature;
import com.demanddna.engine.SignatureDay;
import com.demanddna.engine.SignatureExtraction;
import com.demanddna.engine.SignatureExtractor;
import com.demanddna.engine.event.ReappliedShockEvent;
import com.demanddna.entity.ShockSignatureRecord;
import com.demanddna.entity.SignatureDayEntry;
import com.demanddna.exception.InvalidEventException;
import com.demanddna.exception.NoSignificantShockException;
import com.demanddna.exception.SignatureNotFoundException;
import com.demanddna.repository.DailyTransactionRepository;
import com.demanddna.repository.ShockSignatureRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * De-shock extraction over raw transactions and the persisted signature library.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignatureService {

    private final DailyTransactionRepository transactionRepository;
    private final ShockSignatureRepository signatureRepository;
    private final SignatureExtractor extractor;
    private final ScenarioSessionService sessionService;

    @Transactional(readOnly = true)
    public SignatureExtractionResponse extract(SignatureRequest request) {
        SignatureExtraction extraction = runExtraction(request);
        ShockSignature signature = extraction.signature()
            .orElseThrow(() -> noShock(request));
        return SignatureExtractionResponse.builder()
            .contextStart(extraction.contextStart())
            .contextEnd(extraction.contextEnd())
            .context(extraction.context())
            .floor(extraction.floor())
            .signature(toResponse(signature, entities(request)))
            .build();
    }

    @Transactional
    public SignatureResponse save(SignatureRequest request, String requestId) {
        ShockSignature signature = runExtraction(request).signature()
            .orElseThrow(() -> noShock(request));
        ShockSignatureRecord saved = signatureRepository.save(toRecord(signature, entities(request), requestId));
        log.info("Signature saved | id={} | name={} | days={} | excessSessions={} | requestId={}",
                 saved.getId(), saved.getName(), saved.getDurationDays(), saved.getTotalExcessSessions(), requestId);
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<SignatureResponse> list() {
        return signatureRepository.findAllByOrderByCreatedAtDesc().stream().map(this::toResponse).toList();
    }

    @Transactional(readOnly = true)
    public SignatureResponse get(UUID id) {
        return toResponse(find(id));
    }

    @Transactional
    public void delete(UUID id) {
        ShockSignatureRecord record = find(id);
        signatureRepository.delete(record);
        log.info("Signature deleted | id={} | name={}", id, record.getName());
    }

    /**
     * Appends the stored signature to a scenario as a re-applied shock at {@code newStart}.
     */
    @Transactional(readOnly = true)
    public ScenarioResponse inject(UUID scenarioId, UUID signatureId, InjectSignatureRequest request) {
        if (request.getMode() == null) {
            throw new InvalidEventException("Injection mode is required");
        }
        ShockSignature signature = toSignature(find(signatureId));
        ReappliedShockEvent event = signature.toReappliedEvent(request.getNewStart(), request.getMode());
        Scenario updated = sessionService.appendEvent(scenarioId, event);
        log.info("Signature injected | scenario={} | signature={} | mode={} | newStart={}",
                 scenarioId, signatureId, request.getMode(), request.getNewStart());
        return sessionService.toResponse(updated);
    }

    private SignatureExtraction runExtraction(SignatureRequest request) {
        if (request.getStart().isAfter(request.getEnd())) {
            throw new InvalidEventException("Signature window starts " + request.getStart()
                + " after it ends " + request.getEnd());
        }
        List<String> entities = entities(request);
        LocalDate from = extractor.contextStart(request.getStart());
        LocalDate to = extractor.contextEnd(request.getEnd());
        List<DailyObservation> observations = transactionRepository
            .findByEntityInAndTransactionDateBetweenOrderByTransactionDateAsc(entities, from, to)
            .stream()
            .map(t -> new DailyObservation(t.getTransactionDate(), t.getSessions(), t.getConversions(), t.getRevenue()))
            .toList();
        String name = request.getName() != null && !request.getName().isBlank()
            ? request.getName().trim()
            : "Shock " + request.getStart() + "->" + request.getEnd();
        return extractor.extract(name, request.getStart(), request.getEnd(), observations);
    }

    private NoSignificantShockException noShock(SignatureRequest request) {
        log.warn("No significant shock | entities={} | start={} | end={}",
                 request.getEntities(), request.getStart(), request.getEnd());
        return new NoSignificantShockException(request.getStart(), request.getEnd());
    }

    private ShockSignatureRecord find(UUID id) {
        return signatureRepository.findById(id).orElseThrow(() -> new SignatureNotFoundException(id));
    }

    private static List<String> entities(SignatureRequest request) {
        return request.getEntities().stream().map(ProfileIngestionService::normaliseEntity).distinct().toList();
    }

    private ShockSignatureRecord toRecord(ShockSignature s, List<String> entities, String requestId) {
        return ShockSignatureRecord.builder()
            .name(s.name())
            .entities(String.join(",", entities))
            .originStart(s.originStart())
            .originEnd(s.originEnd())
            .durationDays(s.durationDays())
            .floorSessions(s.floor().sessions())
            .floorConversions(s.floor().conversions())
            .floorRevenue(s.floor().revenue())
            .totalExcessSessions(s.totalExcess().sessions())
            .totalExcessConversions(s.totalExcess().conversions())
            .totalExcessRevenue(s.totalExcess().revenue())
            .organicConversionRate(s.organicConversionRate())
            .eventConversionRate(s.eventConversionRate())
            .conversionRateDelta(s.conversionRateDelta())
            .days(s.days().stream()
                .map(d -> SignatureDayEntry.builder()
                    .date(d.date())
                    .excessSessions(d.excess().sessions())
                    .excessConversions(d.excess().conversions())
                    .excessRevenue(d.excess().revenue())
                    .relativeSessions(d.relative().sessions())
                    .relativeConversions(d.relative().conversions())
                    .relativeRevenue(d.relative().revenue())
                    .build())
                .collect(Collectors.toCollection(ArrayList::new)))
            .requestId(requestId)
            .build();
    }

    ShockSignature toSignature(ShockSignatureRecord r) {
        return new ShockSignature(r.getName(), r.getOriginStart(), r.getOriginEnd(), r.getDurationDays(),
            new MetricValues(r.getFloorSessions(), r.getFloorConversions(), r.getFloorRevenue()),
            new MetricValues(r.getTotalExcessSessions(), r.getTotalExcessConversions(), r.getTotalExcessRevenue()),
            r.getOrganicConversionRate(), r.getEventConversionRate(), r.getConversionRateDelta(),
            r.getDays().stream()
                .map(d -> new SignatureDay(d.getDate(),
                    new MetricValues(d.getExcessSessions(), d.getExcessConversions(), d.getExcessRevenue()),
                    new MetricValues(d.getRelativeSessions(), d.getRelativeConversions(), d.getRelativeRevenue())))
                .toList());
    }

    private SignatureResponse toResponse(ShockSignatureRecord r) {
        List<String> entities = r.getEntities() == null || r.getEntities().isBlank()
            ? List.of()
            : Arrays.asList(r.getEntities().split(","));
        return toResponse(toSignature(r), entities).toBuilder()
            .id(r.getId())
            .createdAt(r.getCreatedAt())
            .build();
    }

    private SignatureResponse toResponse(ShockSignature s, List<String> entities) {
        return SignatureResponse.builder()
            .name(s.name())
            .entities(entities)
            .originStart(s.originStart())
            .originEnd(s.originEnd())
            .durationDays(s.durationDays())
            .floor(s.floor())
            .totalExcess(s.totalExcess())
            .organicConversionRate(s.organicConversionRate())
            .eventConversionRate(s.eventConversionRate())
            .conversionRateDelta(s.conversionRateDelta())
            .days(s.days())
            .build();
    }
}
