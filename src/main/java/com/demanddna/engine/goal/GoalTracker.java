package com.demanddna.engine.goal;

import com.demanddna.engine.CalibrationConstants;
import com.demanddna.engine.Granularity;
import com.demanddna.engine.MetricValues;
import com.demanddna.engine.ProjectionResult;
import com.demanddna.engine.ProjectionRow;
import com.demanddna.engine.YearFrame;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Translates a target into needed sessions, conversions and revenue over the target window
 * and spreads them across periods in proportion to the baseline.
 */
public class GoalTracker {

    public GoalAssessment assess(ProjectionResult projection, GoalTarget target) {
        YearFrame frame = projection.frame();
        int[] rows = frame.rowsBetween(target.start(), target.end());
        if (rows.length == 0) {
            return GoalAssessment.emptyWindow(target);
        }

        MetricValues base = projection.totals(ProjectionResult.Series.BASELINE, target.start(), target.end());
        MetricValues sim = projection.totals(ProjectionResult.Series.SIMULATION, target.start(), target.end());
        CalibrationConstants constants = projection.constants();
        double effAov = base.conversions() > 0 ? base.revenue() / base.conversions() : constants.baseOrderValue();
        double effCr = base.sessions() > 0 ? base.conversions() / base.sessions() : constants.baseConversionRate();

        MetricValues needed = neededVolumes(target, base, effCr, effAov);
        KpiSnapshot neededKpis = KpiSnapshot.of(needed);
        KpiSnapshot before = new KpiSnapshot(base.sessions(), base.conversions(), base.revenue(), effCr, effAov);
        KpiSnapshot after = KpiSnapshot.of(sim);

        return new GoalAssessment(target, false, neededKpis, before, after,
            periods(projection, rows, target.resolution(), needed));
    }

    MetricValues neededVolumes(GoalTarget target, MetricValues base, double effCr, double effAov) {
        double tv = target.value();
        VolumeDriver driver = target.driver() != null ? target.driver() : VolumeDriver.TRAFFIC;
        double sess;
        double conv;
        double rev;
        switch (target.metric()) {
            case REVENUE -> {
                rev = tv;
                if (driver == VolumeDriver.TRAFFIC) {
                    conv = divide(rev, effAov);
                    sess = divide(conv, effCr);
                } else if (driver == VolumeDriver.CONVERSION_RATE) {
                    sess = base.sessions();
                    conv = divide(rev, effAov);
                } else {
                    sess = base.sessions();
                    conv = base.conversions();
                }
            }
            case CONVERSIONS -> {
                conv = tv;
                if (driver == VolumeDriver.TRAFFIC) {
                    sess = divide(conv, effCr);
                } else {
                    sess = base.sessions();
                }
                rev = conv * effAov;
            }
            case SESSIONS -> {
                sess = tv;
                conv = tv * effCr;
                rev = conv * effAov;
            }
            case CONVERSION_RATE -> {
                sess = base.sessions();
                conv = base.sessions() * tv;
                rev = conv * effAov;
            }
            case ORDER_VALUE -> {
                sess = base.sessions();
                conv = base.conversions();
                rev = conv * tv;
            }
            default -> throw new IllegalArgumentException("Unsupported target metric " + target.metric());
        }
        return new MetricValues(sess, conv, rev);
    }

    private List<GoalPeriod> periods(ProjectionResult projection, int[] rows, Granularity resolution, MetricValues needed) {
        Granularity granularity = resolution != null ? resolution : Granularity.MONTHLY;
        YearFrame frame = projection.frame();
        Map<Integer, PeriodAccumulator> byPeriod = new TreeMap<>();
        MetricValues baseTotal = MetricValues.ZERO;
        for (int row : rows) {
            ProjectionRow r = projection.rows().get(row);
            PeriodAccumulator acc = byPeriod.computeIfAbsent(frame.period(granularity, row),
                k -> new PeriodAccumulator(r.date()));
            acc.baseline = acc.baseline.plus(r.baseline());
            acc.simulation = acc.simulation.plus(r.simulation());
            baseTotal = baseTotal.plus(r.baseline());
        }

        List<GoalPeriod> periods = new ArrayList<>(byPeriod.size());
        for (Map.Entry<Integer, PeriodAccumulator> entry : byPeriod.entrySet()) {
            PeriodAccumulator acc = entry.getValue();
            MetricValues periodNeeded = new MetricValues(
                share(needed.sessions(), acc.baseline.sessions(), baseTotal.sessions()),
                share(needed.conversions(), acc.baseline.conversions(), baseTotal.conversions()),
                share(needed.revenue(), acc.baseline.revenue(), baseTotal.revenue()));
            periods.add(new GoalPeriod(entry.getKey(), acc.firstDate, acc.baseline, acc.simulation, periodNeeded,
                acc.baseline.minus(periodNeeded), acc.simulation.minus(periodNeeded)));
        }
        return periods;
    }

    private static double divide(double numerator, double denominator) {
        return denominator > 0 ? numerator / denominator : 0.0;
    }

    private static double share(double total, double part, double whole) {
        return whole > 0 ? total * (part / whole) : 0.0;
    }

    private static final class PeriodAccumulator {
        private final LocalDate firstDate;
        private MetricValues baseline = MetricValues.ZERO;
        private MetricValues simulation = MetricValues.ZERO;

        private PeriodAccumulator(LocalDate firstDate) {
            this.firstDate = firstDate;
        }
    }
}
