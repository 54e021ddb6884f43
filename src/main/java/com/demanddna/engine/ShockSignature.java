package com.demanddna.engine;

import com.demanddna.engine.event.InjectionMode;
import com.demanddna.engine.event.ReappliedShockEvent;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

public record ShockSignature(
    String name,
    LocalDate originStart,
    LocalDate originEnd,
    int durationDays,
    MetricValues floor,
    MetricValues totalExcess,
    double organicConversionRate,
    double eventConversionRate,
    double conversionRateDelta,
    List<SignatureDay> days
) {

    public ShockSignature {
        days = List.copyOf(days);
    }

    /**
     * Places the signature at {@code newStart}. Calendar days of the origin window without
     * observations carry zero excess so every stored day keeps its offset.
     */
    public ReappliedShockEvent toReappliedEvent(LocalDate newStart, InjectionMode mode) {
        List<MetricValues> absolute = new ArrayList<>(durationDays);
        List<MetricValues> relative = new ArrayList<>(durationDays);
        for (int i = 0; i < durationDays; i++) {
            absolute.add(MetricValues.ZERO);
            relative.add(MetricValues.ZERO);
        }
        for (SignatureDay day : days) {
            int offset = (int) ChronoUnit.DAYS.between(originStart, day.date());
            if (offset >= 0 && offset < durationDays) {
                absolute.set(offset, day.excess());
                relative.set(offset, day.relative());
            }
        }
        return ReappliedShockEvent.builder()
            .signatureName(name)
            .mode(mode)
            .newStart(newStart)
            .durationDays(durationDays)
            .absoluteDeltas(List.copyOf(absolute))
            .relativeFractions(List.copyOf(relative))
            .build();
    }
}
