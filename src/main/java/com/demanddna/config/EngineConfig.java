package com.demanddna.config;

import com.demanddna.engine.Calibrator;
import com.demanddna.engine.DnaBlender;
import com.demanddna.engine.EventLayerCompiler;
import com.demanddna.engine.ForecastPipeline;
import com.demanddna.engine.ProjectionBuilder;
import com.demanddna.engine.ShockEngine;
import com.demanddna.engine.SignatureExtractor;
import com.demanddna.engine.SimilarityWeighting;
import com.demanddna.engine.YearFrameBuilder;
import com.demanddna.engine.attribution.AttributionEngine;
import com.demanddna.engine.goal.GoalTracker;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the plain-Java forecasting engine. Tunables come from {@code application.yml}.
 */
@Configuration
public class EngineConfig {

    @Bean
    public SimilarityWeighting similarityWeighting() {
        return new SimilarityWeighting();
    }

    @Bean
    public DnaBlender dnaBlender(@Value("${dna.overall-weight:0.35}") double overallWeight) {
        return new DnaBlender(overallWeight);
    }

    @Bean
    public EventLayerCompiler eventLayerCompiler() {
        return new EventLayerCompiler(new YearFrameBuilder());
    }

    @Bean
    public ShockEngine shockEngine() {
        return new ShockEngine();
    }

    @Bean
    public ForecastPipeline forecastPipeline(EventLayerCompiler compiler, ShockEngine shockEngine,
                                             @Value("${projection.margin:0.15}") double margin) {
        return new ForecastPipeline(compiler, new Calibrator(), new ProjectionBuilder(shockEngine, margin));
    }

    @Bean
    public AttributionEngine attributionEngine(ForecastPipeline pipeline) {
        return new AttributionEngine(pipeline);
    }

    @Bean
    public GoalTracker goalTracker() {
        return new GoalTracker();
    }

    @Bean
    public SignatureExtractor signatureExtractor(
            @Value("${signature.context-days:14}") int contextDays,
            @Value("${signature.floor-percentile:10}") double floorPercentile) {
        return new SignatureExtractor(contextDays, floorPercentile);
    }
}
