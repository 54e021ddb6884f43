package com.demanddna.engine.attribution;

import com.demanddna.engine.ForecastContext;
import com.demanddna.engine.ForecastPipeline;
import com.demanddna.engine.Metric;
import com.demanddna.engine.ProjectionResult;
import com.demanddna.engine.PureDna;
import com.demanddna.engine.event.EventLog;
import com.demanddna.engine.event.SimulationEvent;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Sequential marginal attribution. Prefix {@code i} of the log is projected once; event
 * {@code i}'s contribution is {@code total(i + 1) - total(i)} over the target window.
 * Reordering the log changes the split, never the sum.
 */
public class AttributionEngine {

    private final ForecastPipeline pipeline;

    public AttributionEngine(ForecastPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public AttributionReport attribute(PureDna dna, ForecastContext context, EventLog log, AttributionTarget target) {
        if (!windowInYear(target, context.projectionYear())) {
            return AttributionReport.emptyWindow(target.metric());
        }
        List<PrefixTotals> totals = new ArrayList<>(log.size() + 1);
        for (int length = 0; length <= log.size(); length++) {
            totals.add(evaluatePrefix(dna, context, log.prefix(length), length, target));
        }
        return assemble(log, target, totals);
    }

    public PrefixTotals evaluatePrefix(PureDna dna, ForecastContext context, List<SimulationEvent> prefix,
                                       int length, AttributionTarget target) {
        return pipeline.run(dna, context, prefix)
            .map(result -> new PrefixTotals(length,
                result.totals(ProjectionResult.Series.SIMULATION, target.start(), target.end()),
                result.totals(ProjectionResult.Series.BASELINE, target.start(), target.end()),
                true))
            .orElseGet(() -> PrefixTotals.uncalibrated(length));
    }

    /**
     * @param totals one entry per prefix length {@code 0..log.size()}, in order
     */
    public AttributionReport assemble(EventLog log, AttributionTarget target, List<PrefixTotals> totals) {
        if (totals.size() != log.size() + 1) {
            throw new IllegalArgumentException("Expected " + (log.size() + 1) + " prefix totals, got " + totals.size());
        }
        Metric metric = target.metric().volumeMetric();
        double organic = totals.get(0).simulated().get(metric);
        double fullLog = totals.get(log.size()).simulated().get(metric);
        double needed = target.metric().isRatio()
            ? totals.get(log.size()).baseline().get(metric)
            : target.value();
        double gap = needed - organic;
        double divisor = gap != 0 ? gap : 1.0;

        List<AttributionRow> rows = new ArrayList<>(log.size());
        for (int i = 0; i < log.size(); i++) {
            SimulationEvent event = log.get(i);
            double contribution = totals.get(i + 1).simulated().get(metric) - totals.get(i).simulated().get(metric);
            rows.add(new AttributionRow(i, event.eventType(), event.describe(), event.effectiveScope().getLabel(),
                contribution, contribution / divisor * 100.0));
        }
        return new AttributionReport(target.metric(), metric, organic, needed, fullLog, gap, rows, false);
    }

    public static boolean windowInYear(AttributionTarget target, int year) {
        LocalDate start = target.start();
        LocalDate end = target.end();
        return start != null && end != null && !start.isAfter(end)
            && end.getYear() >= year && start.getYear() <= year;
    }
}
