package com.demanddna.service;

import com.demanddna.dto.ScenarioRequest;
import com.demanddna.dto.ScenarioResponse;
import com.demanddna.engine.Granularity;
import com.demanddna.engine.MetricValues;
import com.demanddna.engine.TrialObservation;
import com.demanddna.engine.event.CustomDragEvent;
import com.demanddna.engine.event.EventLog;
import com.demanddna.engine.event.ReappliedShockEvent;
import com.demanddna.engine.event.ShockEvent;
import com.demanddna.engine.event.SimulationEvent;
import com.demanddna.engine.event.SwapEvent;
import com.demanddna.exception.EventLimitExceededException;
import com.demanddna.exception.InvalidEventException;
import com.demanddna.exception.InvalidTrialWindowException;
import com.demanddna.exception.ScenarioNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory analyst sessions. Each mutation replaces the stored {@link Scenario} with a new
 * immutable value; nothing computed from a scenario is cached.
 */
@Slf4j
@Service
public class ScenarioSessionService {

    @Value("${scenarios.max-retained:500}")
    private int maxRetained;

    @Value("${scenarios.max-events:200}")
    private int maxEvents;

    private final ConcurrentHashMap<UUID, Scenario> scenarios = new ConcurrentHashMap<>();

    public Scenario create(ScenarioRequest request) {
        ScenarioContext context = toContext(request);
        Instant now = Instant.now();
        Scenario scenario = new Scenario(UUID.randomUUID(), context, EventLog.empty(), now, now);
        scenarios.put(scenario.id(), scenario);
        cleanupIfNeeded();
        log.info("Scenario created | id={} | entities={} | year={}",
                 scenario.id(), context.entities(), context.projectionYear());
        return scenario;
    }

    public Scenario get(UUID id) {
        Scenario scenario = scenarios.get(id);
        if (scenario == null) {
            throw new ScenarioNotFoundException(id);
        }
        return scenario;
    }

    public Scenario updateContext(UUID id, ScenarioRequest request) {
        ScenarioContext context = toContext(request);
        Scenario updated = mutate(id, s -> s.withContext(context));
        log.info("Scenario context updated | id={} | entities={} | year={}",
                 id, context.entities(), context.projectionYear());
        return updated;
    }

    public void delete(UUID id) {
        if (scenarios.remove(id) == null) {
            throw new ScenarioNotFoundException(id);
        }
        log.info("Scenario deleted | id={}", id);
    }

    public Scenario appendEvent(UUID id, SimulationEvent event) {
        validate(event);
        Scenario updated = mutate(id, s -> {
            if (s.events().size() >= maxEvents) {
                throw new EventLimitExceededException(s.events().size() + 1, maxEvents);
            }
            return s.withEvents(s.events().append(event));
        });
        log.info("Event appended | scenario={} | type={} | events={}", id, event.eventType(), updated.events().size());
        return updated;
    }

    public Scenario removeEvent(UUID id, int index) {
        Scenario updated = mutate(id, s -> {
            checkIndex(s, index);
            return s.withEvents(s.events().removeAt(index));
        });
        log.info("Event removed | scenario={} | index={} | events={}", id, index, updated.events().size());
        return updated;
    }

    /**
     * Moves the shock at {@code index} to {@code newStart}, keeping its length.
     */
    public Scenario shiftEvent(UUID id, int index, LocalDate newStart) {
        Scenario updated = mutate(id, s -> {
            checkIndex(s, index);
            if (!(s.events().get(index) instanceof ShockEvent shock)) {
                throw new InvalidEventException("Only shock events can be shifted; event " + index
                    + " is " + s.events().get(index).eventType());
            }
            return s.withEvents(s.events().replaceAt(index, shock.shiftedTo(newStart)));
        });
        log.info("Event shifted | scenario={} | index={} | newStart={}", id, index, newStart);
        return updated;
    }

    public Scenario clearEvents(UUID id) {
        Scenario updated = mutate(id, s -> s.withEvents(EventLog.empty()));
        log.info("Event log cleared | scenario={}", id);
        return updated;
    }

    public ScenarioResponse toResponse(Scenario scenario) {
        ScenarioContext context = scenario.context();
        TrialObservation trial = context.trial();
        return ScenarioResponse.builder()
            .id(scenario.id())
            .entities(context.entities())
            .trialStart(trial.start())
            .trialEnd(trial.end())
            .observed(trial.observed())
            .adjustmentPercent(trial.adjustmentPercent())
            .adjusted(trial.adjusted())
            .projectionYear(context.projectionYear())
            .resolution(context.resolution())
            .events(scenario.events().events())
            .createdAt(scenario.createdAt())
            .updatedAt(scenario.updatedAt())
            .build();
    }

    ScenarioContext toContext(ScenarioRequest request) {
        if (request.getTrialStart().isAfter(request.getTrialEnd())) {
            throw new InvalidTrialWindowException(request.getTrialStart(), request.getTrialEnd());
        }
        TrialObservation trial = new TrialObservation(
            request.getTrialStart(), request.getTrialEnd(),
            new MetricValues(request.getObservedSessions(), request.getObservedConversions(), request.getObservedRevenue()),
            new MetricValues(request.getSessionsAdjustmentPercent(), request.getConversionsAdjustmentPercent(),
                request.getRevenueAdjustmentPercent()));
        int year = request.getProjectionYear() != null ? request.getProjectionYear() : trial.start().getYear();
        Granularity resolution = request.getResolution() != null ? request.getResolution() : Granularity.MONTHLY;
        return new ScenarioContext(
            request.getEntities().stream().map(ProfileIngestionService::normaliseEntity).distinct().toList(),
            trial, year, resolution);
    }

    void validate(SimulationEvent event) {
        if (event == null) {
            throw new InvalidEventException("Event body is required");
        }
        if (event instanceof ShockEvent shock) {
            requireOrdered(shock.getStart(), shock.getEnd(), "shock");
        } else if (event instanceof CustomDragEvent drag) {
            requirePeriod(drag.effectiveGranularity(), drag.getTargetPeriod(), "targetPeriod");
            if (drag.getMultiplier() < 0) {
                throw new InvalidEventException("Custom drag multiplier must be >= 0");
            }
        } else if (event instanceof SwapEvent swap) {
            if (swap.rangeSwap()) {
                requireOrdered(swap.getRangeAStart(), swap.getRangeAEnd(), "swap range A");
                requireOrdered(swap.getRangeBStart(), swap.getRangeBEnd(), "swap range B");
            } else if (swap.getPeriodA() != null && swap.getPeriodB() != null) {
                requirePeriod(swap.effectiveGranularity(), swap.getPeriodA(), "periodA");
                requirePeriod(swap.effectiveGranularity(), swap.getPeriodB(), "periodB");
            } else {
                throw new InvalidEventException("Swap needs either periodA/periodB or all four range dates");
            }
        } else if (event instanceof ReappliedShockEvent reapplied) {
            if (reapplied.getNewStart() == null || reapplied.getMode() == null || reapplied.getDurationDays() < 1) {
                throw new InvalidEventException("Re-applied shock needs newStart, mode and a positive durationDays");
            }
            if (reapplied.storedDays() < reapplied.getDurationDays()) {
                throw new InvalidEventException("Re-applied shock lasts " + reapplied.getDurationDays()
                    + " days but stores " + reapplied.storedDays() + " " + reapplied.getMode().name().toLowerCase()
                    + " values");
            }
        }
    }

    private Scenario mutate(UUID id, UnaryOperator<Scenario> change) {
        Scenario updated = scenarios.computeIfPresent(id, (key, current) -> change.apply(current));
        if (updated == null) {
            throw new ScenarioNotFoundException(id);
        }
        return updated;
    }

    private void cleanupIfNeeded() {
        if (scenarios.size() <= maxRetained) {
            return;
        }
        scenarios.entrySet().stream()
            .sorted(Comparator.comparing(e -> e.getValue().updatedAt()))
            .limit(Math.max(1, scenarios.size() - maxRetained))
            .map(Map.Entry::getKey)
            .toList()
            .forEach(scenarios::remove);
    }

    private static void checkIndex(Scenario scenario, int index) {
        if (index < 0 || index >= scenario.events().size()) {
            throw new InvalidEventException("Event index " + index + " is outside the log of size "
                + scenario.events().size());
        }
    }

    private static void requireOrdered(LocalDate start, LocalDate end, String what) {
        if (start == null || end == null) {
            throw new InvalidEventException(what + " needs both a start and an end date");
        }
        if (start.isAfter(end)) {
            throw new InvalidEventException(what + " starts " + start + " after it ends " + end);
        }
    }

    private static void requirePeriod(Granularity granularity, int period, String field) {
        int max = switch (granularity) {
            case MONTHLY -> 12;
            case WEEKLY -> 53;
            case DAILY -> 366;
        };
        if (period < 1 || period > max) {
            throw new InvalidEventException(field + " " + period + " is outside 1.." + max
                + " for " + granularity.name().toLowerCase() + " granularity");
        }
    }
}
