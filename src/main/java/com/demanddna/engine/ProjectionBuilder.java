package com.demanddna.engine;

import com.demanddna.engine.event.SimulationEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a compiled frame and calibration constants into daily baseline and simulated volumes.
 *
 * <pre>
 *   baseline   S = bs * T_pre         C = S * bcr * CR_pre        R = C * baov * OV_pre
 *   standard   S = bs * T_work * (1 + shock)
 *              C = S_std * bcr * CR_work                    R = C_std * baov * OV_work
 *   simulation X = X_std + X_baseline * rel_X + abs_X
 * </pre>
 *
 * Bands are a fixed {@code margin} either side of each central value.
 */
public class ProjectionBuilder {

    private final ShockEngine shockEngine;
    private final double margin;

    public ProjectionBuilder(ShockEngine shockEngine, double margin) {
        this.shockEngine = shockEngine;
        this.margin = margin;
    }

    public double getMargin() {
        return margin;
    }

    public ProjectionResult build(YearFrame frame, CalibrationConstants constants, List<SimulationEvent> events) {
        double[] shocks = shockEngine.multipliers(frame, events);
        Injections injections = shockEngine.injections(frame, events);

        double bs = constants.baseSessions();
        double bcr = constants.baseConversionRate();
        double baov = constants.baseOrderValue();

        List<ProjectionRow> rows = new ArrayList<>(frame.size());
        for (int row = 0; row < frame.size(); row++) {
            double baseSessions = bs * frame.index(Layer.PRE_TRIAL, IndexKind.TRAFFIC, row);
            double baseConversions = baseSessions * bcr * frame.index(Layer.PRE_TRIAL, IndexKind.CONVERSION_RATE, row);
            double baseRevenue = baseConversions * baov * frame.index(Layer.PRE_TRIAL, IndexKind.ORDER_VALUE, row);
            MetricValues baseline = new MetricValues(baseSessions, baseConversions, baseRevenue);

            double stdSessions = bs * frame.index(Layer.WORK, IndexKind.TRAFFIC, row) * (1 + shocks[row]);
            double stdConversions = stdSessions * bcr * frame.index(Layer.WORK, IndexKind.CONVERSION_RATE, row);
            double stdRevenue = stdConversions * baov * frame.index(Layer.WORK, IndexKind.ORDER_VALUE, row);

            MetricValues rel = injections.relative()[row];
            MetricValues abs = injections.absolute()[row];
            MetricValues simulation = new MetricValues(
                stdSessions + baseSessions * rel.sessions() + abs.sessions(),
                stdConversions + baseConversions * rel.conversions() + abs.conversions(),
                stdRevenue + baseRevenue * rel.revenue() + abs.revenue());

            rows.add(new ProjectionRow(
                frame.date(row), frame.month(row), frame.week(row), frame.dayOfYear(row),
                shocks[row],
                baseline, simulation,
                baseline.scaled(1 - margin), baseline.scaled(1 + margin),
                simulation.scaled(1 - margin), simulation.scaled(1 + margin)));
        }
        return new ProjectionResult(frame.year(), constants, margin, rows, frame);
    }
}
