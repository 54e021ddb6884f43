package com.demanddna.engine.event;

import com.demanddna.engine.MetricValues;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

/**
 * A stored shock signature placed at a new start date. Day {@code i} of the arrays lands
 * on {@code newStart + i}; only the channel selected by {@code mode} is injected.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ReappliedShockEvent implements SimulationEvent {

    @NotNull
    String signatureName;

    @NotNull
    InjectionMode mode;

    @NotNull
    LocalDate newStart;

    @Min(1)
    int durationDays;

    List<MetricValues> absoluteDeltas;

    List<MetricValues> relativeFractions;

    @Override
    public EventType eventType() {
        return EventType.REAPPLIED_SHOCK;
    }

    @Override
    public EventScope effectiveScope() {
        return EventScope.POST_TRIAL;
    }

    @Override
    public String describe() {
        return String.format("Re-applied '%s' (%s) from %s for %d days",
            signatureName, mode.name().toLowerCase(), newStart, durationDays);
    }

    public LocalDate newEnd() {
        return newStart.plusDays(durationDays - 1L);
    }

    /**
     * Days that carry a stored value in this event's mode.
     */
    public int storedDays() {
        List<MetricValues> series = series();
        return series == null ? 0 : Math.min(durationDays, series.size());
    }

    /**
     * Injected values for the day at {@code offset} from {@code newStart} in this event's mode,
     * or zero when the stored series is shorter.
     */
    public MetricValues injectionAt(int offset) {
        List<MetricValues> series = series();
        if (series == null || offset < 0 || offset >= durationDays || offset >= series.size()) {
            return MetricValues.ZERO;
        }
        return series.get(offset);
    }

    private List<MetricValues> series() {
        return mode == InjectionMode.ABSOLUTE ? absoluteDeltas : relativeFractions;
    }
}
