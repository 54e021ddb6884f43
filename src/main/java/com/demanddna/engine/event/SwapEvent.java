package com.demanddna.engine.event;

import com.demanddna.engine.Granularity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Exchanges the mean index level of two periods. Either {@code periodA}/{@code periodB}
 * name single periods, or the two date ranges are expanded to their sorted periods and
 * paired positionally; surplus periods of the longer range are left alone.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SwapEvent implements SimulationEvent {

    @Builder.Default
    Granularity granularity = Granularity.MONTHLY;

    @Builder.Default
    EventScope scope = EventScope.POST_TRIAL;

    Integer periodA;
    Integer periodB;

    LocalDate rangeAStart;
    LocalDate rangeAEnd;
    LocalDate rangeBStart;
    LocalDate rangeBEnd;

    @Override
    public EventType eventType() {
        return EventType.SWAP;
    }

    @Override
    public EventScope effectiveScope() {
        return scope != null ? scope : EventScope.POST_TRIAL;
    }

    public Granularity effectiveGranularity() {
        return granularity != null ? granularity : Granularity.MONTHLY;
    }

    public boolean rangeSwap() {
        return rangeAStart != null && rangeAEnd != null && rangeBStart != null && rangeBEnd != null;
    }

    public List<PeriodPair> periodPairs() {
        List<PeriodPair> pairs = new ArrayList<>();
        if (rangeSwap()) {
            List<Integer> a = effectiveGranularity().periodsBetween(rangeAStart, rangeAEnd);
            List<Integer> b = effectiveGranularity().periodsBetween(rangeBStart, rangeBEnd);
            for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
                pairs.add(new PeriodPair(a.get(i), b.get(i)));
            }
        } else if (periodA != null && periodB != null) {
            pairs.add(new PeriodPair(periodA, periodB));
        }
        return pairs;
    }

    @Override
    public String describe() {
        String level = effectiveGranularity().name().toLowerCase();
        if (rangeSwap()) {
            return String.format("Swap %s %s..%s <-> %s..%s", level, rangeAStart, rangeAEnd, rangeBStart, rangeBEnd);
        }
        return String.format("Swap %s %s <-> %s", level, periodA, periodB);
    }

    public record PeriodPair(int a, int b) {
    }
}
