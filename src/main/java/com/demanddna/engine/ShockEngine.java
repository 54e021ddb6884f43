package com.demanddna.engine;

import com.demanddna.engine.event.InjectionMode;
import com.demanddna.engine.event.ReappliedShockEvent;
import com.demanddna.engine.event.ShockEvent;
import com.demanddna.engine.event.SimulationEvent;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily campaign multipliers and re-injected signature volumes. Overlapping shocks add their
 * contributions; so do overlapping re-injections, per metric and per channel.
 */
public class ShockEngine {

    public double[] multipliers(YearFrame frame, List<SimulationEvent> events) {
        List<ShockEvent> shocks = new ArrayList<>();
        for (SimulationEvent event : events) {
            if (event instanceof ShockEvent shock && frame.overlaps(shock.getStart(), shock.getEnd())) {
                shocks.add(shock);
            }
        }
        double[] multipliers = new double[frame.size()];
        for (ShockEvent shock : shocks) {
            for (int row : frame.rowsBetween(shock.getStart(), shock.getEnd())) {
                multipliers[row] += shock.multiplierOn(frame.date(row));
            }
        }
        return multipliers;
    }

    /**
     * Aligns each re-applied shock by day offset from its new start. Only offsets that land in
     * the frame's year and exist in the stored series are visited.
     */
    public Injections injections(YearFrame frame, List<SimulationEvent> events) {
        Injections injections = Injections.none(frame.size());
        for (SimulationEvent event : events) {
            if (!(event instanceof ReappliedShockEvent reapplied)) {
                continue;
            }
            MetricValues[] target = reapplied.getMode() == InjectionMode.ABSOLUTE
                ? injections.absolute()
                : injections.relative();
            long lead = ChronoUnit.DAYS.between(reapplied.getNewStart(), LocalDate.of(frame.year(), 1, 1));
            long first = Math.max(0, lead);
            long last = Math.min(reapplied.storedDays(), lead + frame.size());
            for (long offset = first; offset < last; offset++) {
                int row = (int) (offset - lead);
                target[row] = target[row].plus(reapplied.injectionAt((int) offset));
            }
        }
        return injections;
    }

    /**
     * Day-by-day multiplier profile of a prospective campaign, without any other event.
     */
    public List<MultiplierPoint> preview(ShockEvent shock) {
        List<MultiplierPoint> points = new ArrayList<>();
        int offset = 0;
        for (LocalDate day = shock.getStart(); !day.isAfter(shock.getEnd()); day = day.plusDays(1)) {
            points.add(new MultiplierPoint(day, offset++, shock.multiplierOn(day)));
        }
        return points;
    }
}
