package com.demanddna.engine;

import com.demanddna.engine.event.SimulationEvent;

import java.util.List;
import java.util.Optional;

/**
 * One full rebuild: compile layers, calibrate, project. Stateless; every call starts from
 * the unmodified pure DNA.
 */
public class ForecastPipeline {

    private final EventLayerCompiler compiler;
    private final Calibrator calibrator;
    private final ProjectionBuilder projectionBuilder;

    public ForecastPipeline(EventLayerCompiler compiler, Calibrator calibrator, ProjectionBuilder projectionBuilder) {
        this.compiler = compiler;
        this.calibrator = calibrator;
        this.projectionBuilder = projectionBuilder;
    }

    public YearFrame compile(PureDna dna, ForecastContext context, List<SimulationEvent> events) {
        return compiler.compile(dna, context.projectionYear(), events);
    }

    /**
     * Empty when the trial window cannot be calibrated against the compiled pre-trial layer.
     */
    public Optional<ProjectionResult> run(PureDna dna, ForecastContext context, List<SimulationEvent> events) {
        YearFrame frame = compile(dna, context, events);
        return calibrator.calibrate(frame, context.trial())
            .map(constants -> projectionBuilder.build(frame, constants, events));
    }
}
