package com.demanddna.engine;

import com.demanddna.engine.event.CustomDragEvent;
import com.demanddna.engine.event.EventScope;
import com.demanddna.engine.event.SimulationEvent;
import com.demanddna.engine.event.SwapEvent;

import java.util.List;

/**
 * Folds an event log over the pure DNA into the three index layers of a fresh year frame.
 * <ol>
 *   <li>broadcast the monthly DNA to every day, all three layers identical</li>
 *   <li>apply pre-trial drags and swaps, in log order, to the pre-trial layer</li>
 *   <li>copy pre-trial into work</li>
 *   <li>apply post-trial drags and swaps to the work layer</li>
 * </ol>
 * Shocks and re-applied shocks are not index edits and are skipped here.
 */
public class EventLayerCompiler {

    private final YearFrameBuilder frameBuilder;

    public EventLayerCompiler(YearFrameBuilder frameBuilder) {
        this.frameBuilder = frameBuilder;
    }

    public YearFrame compile(PureDna dna, int year, List<SimulationEvent> events) {
        YearFrame frame = frameBuilder.build(year);
        broadcast(frame, dna);

        applyScoped(frame, events, EventScope.PRE_TRIAL, Layer.PRE_TRIAL);
        frame.copyLayer(Layer.PRE_TRIAL, Layer.WORK);
        applyScoped(frame, events, EventScope.POST_TRIAL, Layer.WORK);
        return frame;
    }

    private void broadcast(YearFrame frame, PureDna dna) {
        for (int row = 0; row < frame.size(); row++) {
            IndexValues month = dna.forMonth(frame.month(row));
            for (Layer layer : Layer.values()) {
                for (IndexKind kind : IndexKind.values()) {
                    frame.column(layer, kind)[row] = month.get(kind);
                }
            }
        }
    }

    private void applyScoped(YearFrame frame, List<SimulationEvent> events, EventScope scope, Layer layer) {
        for (SimulationEvent event : events) {
            if (event.effectiveScope() != scope) {
                continue;
            }
            if (event instanceof CustomDragEvent drag) {
                applyDrag(frame, drag, layer);
            } else if (event instanceof SwapEvent swap) {
                applySwap(frame, swap, layer);
            }
        }
    }

    void applyDrag(YearFrame frame, CustomDragEvent drag, Layer layer) {
        int[] rows = frame.rowsInPeriod(drag.effectiveGranularity(), drag.getTargetPeriod());
        for (IndexKind kind : IndexKind.values()) {
            double[] column = frame.column(layer, kind);
            for (int row : rows) {
                column[row] *= drag.getMultiplier();
            }
        }
    }

    void applySwap(YearFrame frame, SwapEvent swap, Layer layer) {
        Granularity granularity = swap.effectiveGranularity();
        for (SwapEvent.PeriodPair pair : swap.periodPairs()) {
            int[] rowsA = frame.rowsInPeriod(granularity, pair.a());
            int[] rowsB = frame.rowsInPeriod(granularity, pair.b());
            if (rowsA.length == 0 || rowsB.length == 0) {
                continue;
            }
            for (IndexKind kind : IndexKind.values()) {
                double[] column = frame.column(layer, kind);
                double meanA = Stats.mean(column, rowsA);
                double meanB = Stats.mean(column, rowsB);
                rescale(column, rowsA, meanA, meanB);
                rescale(column, rowsB, meanB, meanA);
            }
        }
    }

    // A non-positive own mean cannot be rescaled; the rows take the other side's mean outright.
    private static void rescale(double[] column, int[] rows, double ownMean, double otherMean) {
        for (int row : rows) {
            column[row] = ownMean > 0 ? column[row] * (otherMean / ownMean) : otherMean;
        }
    }
}
