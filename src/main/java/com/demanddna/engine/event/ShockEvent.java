package com.demanddna.engine.event;

import com.demanddna.engine.ShockShape;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Time-bound campaign. {@code lift} is a signed fraction: 0.5 adds half of the work-layer
 * traffic on a day where the shape weight is 1.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ShockEvent implements SimulationEvent {

    @NotNull
    LocalDate start;

    @NotNull
    LocalDate end;

    @NotNull
    ShockShape shape;

    double lift;

    @Override
    public EventType eventType() {
        return EventType.SHOCK;
    }

    @Override
    public EventScope effectiveScope() {
        return EventScope.POST_TRIAL;
    }

    @Override
    public String describe() {
        return String.format("%s %+.0f%% %s..%s", shape.getCampaignLabel(), lift * 100, start, end);
    }

    public long durationDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    /**
     * Contribution to the day's shock multiplier; zero outside the window.
     */
    public double multiplierOn(LocalDate date) {
        if (!covers(date)) {
            return 0.0;
        }
        long elapsed = ChronoUnit.DAYS.between(start, date);
        return lift * shape.weight(elapsed, durationDays());
    }

    public ShockEvent shiftedTo(LocalDate newStart) {
        return toBuilder()
            .start(newStart)
            .end(newStart.plusDays(durationDays() - 1))
            .build();
    }
}
