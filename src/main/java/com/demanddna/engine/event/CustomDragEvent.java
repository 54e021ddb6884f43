package com.demanddna.engine.event;

import com.demanddna.engine.Granularity;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Multiplies every index of the rows belonging to one period.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CustomDragEvent implements SimulationEvent {

    @Builder.Default
    Granularity granularity = Granularity.MONTHLY;

    @Min(1)
    int targetPeriod;

    @DecimalMin("0.0")
    double multiplier;

    @Builder.Default
    EventScope scope = EventScope.POST_TRIAL;

    @Override
    public EventType eventType() {
        return EventType.CUSTOM_DRAG;
    }

    @Override
    public EventScope effectiveScope() {
        return scope != null ? scope : EventScope.POST_TRIAL;
    }

    public Granularity effectiveGranularity() {
        return granularity != null ? granularity : Granularity.MONTHLY;
    }

    @Override
    public String describe() {
        return String.format("Custom drag %s %d x%.2f", effectiveGranularity().name().toLowerCase(),
            targetPeriod, multiplier);
    }
}
