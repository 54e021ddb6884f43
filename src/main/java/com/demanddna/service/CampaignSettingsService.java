package com.demanddna.service;

import com.demanddna.dto.CampaignDefaultRequest;
import com.demanddna.dto.CampaignDefaultResponse;
import com.demanddna.dto.CampaignPreviewRequest;
import com.demanddna.dto.CampaignPreviewResponse;
import com.demanddna.engine.MultiplierPoint;
import com.demanddna.engine.ShockEngine;
import com.demanddna.engine.ShockShape;
import com.demanddna.engine.event.ShockEvent;
import com.demanddna.entity.CampaignDefault;
import com.demanddna.exception.InvalidEventException;
import com.demanddna.repository.CampaignDefaultRepository;
import com.demanddna.repository.HistoricalIndexRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Default campaign lift per entity and shape, used only to pre-fill new shocks. Lookup order:
 * the entity's own row, the {@code __all__} row, then the configured built-in value.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CampaignSettingsService {

    static final String SOURCE_ENTITY = "ENTITY";
    static final String SOURCE_GLOBAL = "GLOBAL";
    static final String SOURCE_BUILT_IN = "BUILT_IN";
    static final long MAX_PREVIEW_DAYS = 366;

    private final CampaignDefaultRepository repository;
    private final HistoricalIndexRepository profileRepository;
    private final ShockEngine shockEngine;

    @Value("${campaign.default-lift-percent:25}")
    private double builtInLiftPercent;

    @Transactional(readOnly = true)
    public CampaignDefaultResponse effective(String entity, ShockShape shape) {
        String key = entity == null || entity.isBlank()
            ? CampaignDefault.GLOBAL
            : ProfileIngestionService.normaliseEntity(entity);
        Optional<CampaignDefault> own = repository.findByEntityAndShape(key, shape);
        if (own.isPresent()) {
            return toResponse(own.get(), CampaignDefault.GLOBAL.equals(key) ? SOURCE_GLOBAL : SOURCE_ENTITY);
        }
        return repository.findByEntityAndShape(CampaignDefault.GLOBAL, shape)
            .map(global -> toResponse(global, SOURCE_GLOBAL).toBuilder().entity(key).build())
            .orElseGet(() -> CampaignDefaultResponse.builder()
                .entity(key)
                .shape(shape)
                .campaignLabel(shape.getCampaignLabel())
                .liftPercent(builtInLiftPercent)
                .source(SOURCE_BUILT_IN)
                .build());
    }

    @Transactional(readOnly = true)
    public List<CampaignDefaultResponse> list() {
        return repository.findAllByOrderByEntityAscShapeAsc().stream()
            .map(d -> toResponse(d, CampaignDefault.GLOBAL.equals(d.getEntity()) ? SOURCE_GLOBAL : SOURCE_ENTITY))
            .toList();
    }

    @Transactional
    public CampaignDefaultResponse upsert(CampaignDefaultRequest request) {
        String entity = CampaignDefault.GLOBAL.equals(request.getEntity().trim())
            ? CampaignDefault.GLOBAL
            : ProfileIngestionService.normaliseEntity(request.getEntity());
        CampaignDefault saved = store(entity, request.getShape(), request.getLiftPercent());
        log.info("Campaign default saved | entity={} | shape={} | liftPercent={}",
                 entity, request.getShape(), request.getLiftPercent());
        return toResponse(saved, CampaignDefault.GLOBAL.equals(entity) ? SOURCE_GLOBAL : SOURCE_ENTITY);
    }

    /**
     * Copies every global row onto each entity known to the profile store, overwriting
     * entity-specific values.
     */
    @Transactional
    public List<CampaignDefaultResponse> applyGlobal() {
        List<CampaignDefault> globals = repository.findByEntity(CampaignDefault.GLOBAL);
        List<String> entities = profileRepository.findDistinctEntities();
        List<CampaignDefaultResponse> applied = new ArrayList<>();
        for (String entity : entities) {
            for (CampaignDefault global : globals) {
                applied.add(toResponse(store(entity, global.getShape(), global.getLiftPercent()), SOURCE_ENTITY));
            }
        }
        log.info("Global campaign defaults applied | entities={} | shapes={}", entities.size(), globals.size());
        return applied;
    }

    @Transactional(readOnly = true)
    public CampaignPreviewResponse preview(CampaignPreviewRequest request) {
        if (request.getStart().isAfter(request.getEnd())) {
            throw new InvalidEventException("Campaign starts " + request.getStart() + " after it ends " + request.getEnd());
        }
        if (ChronoUnit.DAYS.between(request.getStart(), request.getEnd()) >= MAX_PREVIEW_DAYS) {
            throw new InvalidEventException("Campaign preview is limited to " + MAX_PREVIEW_DAYS + " days");
        }
        double liftPercent = request.getLiftPercent() != null
            ? request.getLiftPercent()
            : effective(request.getEntity(), request.getShape()).getLiftPercent();
        ShockEvent shock = ShockEvent.builder()
            .start(request.getStart())
            .end(request.getEnd())
            .shape(request.getShape())
            .lift(liftPercent / 100.0)
            .build();
        List<MultiplierPoint> points = shockEngine.preview(shock);
        return CampaignPreviewResponse.builder()
            .shape(shock.getShape())
            .campaignLabel(shock.getShape().getCampaignLabel())
            .liftPercent(liftPercent)
            .durationDays(shock.durationDays())
            .peakMultiplier(points.stream().mapToDouble(MultiplierPoint::multiplier).max().orElse(0.0))
            .meanMultiplier(points.stream().mapToDouble(MultiplierPoint::multiplier).average().orElse(0.0))
            .points(points)
            .build();
    }

    private CampaignDefault store(String entity, ShockShape shape, double liftPercent) {
        CampaignDefault row = repository.findByEntityAndShape(entity, shape)
            .orElseGet(() -> CampaignDefault.builder().entity(entity).shape(shape).build());
        row.setLiftPercent(liftPercent);
        return repository.save(row);
    }

    private CampaignDefaultResponse toResponse(CampaignDefault d, String source) {
        return CampaignDefaultResponse.builder()
            .entity(d.getEntity())
            .shape(d.getShape())
            .campaignLabel(d.getShape().getCampaignLabel())
            .liftPercent(d.getLiftPercent())
            .source(source)
            .updatedAt(d.getUpdatedAt())
            .build();
    }
}
