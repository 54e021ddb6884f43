package com.demanddna.service;

import com.demanddna.dto.DnaProfileResponse;
import com.demanddna.dto.GoalRequest;
import com.demanddna.dto.GoalResponse;
import com.demanddna.dto.ProjectionResponse;
import com.demanddna.dto.WeightsResponse;
import com.demanddna.engine.ForecastPipeline;
import com.demanddna.engine.Granularity;
import com.demanddna.engine.ProjectionResult;
import com.demanddna.engine.PureDna;
import com.demanddna.engine.YearFrame;
import com.demanddna.engine.goal.GoalAssessment;
import com.demanddna.engine.goal.GoalTarget;
import com.demanddna.engine.goal.GoalTracker;
import com.demanddna.engine.goal.YearlyKpi;
import com.demanddna.exception.InvalidGoalException;
import com.demanddna.exception.UncalibratableTrialException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Read side of a scenario. Every call rebuilds the pipeline from the scenario's current
 * context and event log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private final ScenarioSessionService sessionService;
    private final DnaService dnaService;
    private final ForecastPipeline pipeline;
    private final GoalTracker goalTracker;

    static final double DEFAULT_GROWTH_PERCENT = 5.0;

    public WeightsResponse weights(UUID scenarioId) {
        ScenarioContext context = sessionService.get(scenarioId).context();
        Map<String, Double> weights = dnaService.weights(context);
        PureDna dna = dnaService.pureDna(context, weights);
        return WeightsResponse.builder()
            .scenarioId(scenarioId)
            .overallWeight(dnaService.overallWeight())
            .weights(weights)
            .pureDna(dna.months())
            .build();
    }

    public ProjectionResponse project(UUID scenarioId, String requestId) {
        Scenario scenario = sessionService.get(scenarioId);
        ProjectionResult result = run(scenario);
        log.info("Projection built | scenario={} | year={} | events={} | requestId={}",
                 scenarioId, result.year(), scenario.events().size(), requestId);
        return ProjectionResponse.builder()
            .scenarioId(scenarioId)
            .year(result.year())
            .eventCount(scenario.events().size())
            .constants(result.constants())
            .margin(result.margin())
            .baselineTotals(result.yearTotals(ProjectionResult.Series.BASELINE))
            .simulationTotals(result.yearTotals(ProjectionResult.Series.SIMULATION))
            .rows(result.rows())
            .build();
    }

    public DnaProfileResponse dnaProfile(UUID scenarioId, Granularity granularity) {
        Scenario scenario = sessionService.get(scenarioId);
        ScenarioContext context = scenario.context();
        Granularity level = granularity != null ? granularity : context.resolution();
        YearFrame frame = pipeline.compile(dnaService.pureDna(context), context.forecastContext(),
            scenario.events().events());
        return DnaProfileResponse.builder()
            .scenarioId(scenarioId)
            .year(frame.year())
            .granularity(level)
            .points(frame.profile(level))
            .build();
    }

    public GoalResponse goal(UUID scenarioId, GoalRequest request, String requestId) {
        Scenario scenario = sessionService.get(scenarioId);
        Granularity resolution = request.getResolution() != null
            ? request.getResolution()
            : scenario.context().resolution();
        YearlyKpi base = baseYearKpi(scenario.context(), request);
        double growth = request.getGrowthPercent() != null ? request.getGrowthPercent() : DEFAULT_GROWTH_PERCENT;
        double value = base != null ? base.grown(request.getMetric(), growth) : request.getValue();
        GoalTarget target = new GoalTarget(request.getMetric(), value,
            request.getStart(), request.getEnd(), request.getDriver(), resolution);

        GoalAssessment assessment = goalTracker.assess(run(scenario), target);
        if (assessment.targetWindowEmpty()) {
            log.warn("Goal window outside projection year | scenario={} | start={} | end={} | requestId={}",
                     scenarioId, request.getStart(), request.getEnd(), requestId);
        } else {
            log.info("Goal assessed | scenario={} | metric={} | value={} | baseYear={} | requestId={}",
                     scenarioId, request.getMetric(), value, request.getBaseYear(), requestId);
        }
        return GoalResponse.builder()
            .scenarioId(scenarioId)
            .metric(target.metric())
            .value(target.value())
            .baseYear(base != null ? base.year() : null)
            .growthPercent(base != null ? growth : null)
            .baseValue(base != null ? base.value(request.getMetric()) : null)
            .driver(target.driver())
            .resolution(resolution)
            .targetWindowEmpty(assessment.targetWindowEmpty())
            .needed(assessment.needed())
            .before(assessment.before())
            .after(assessment.after())
            .periods(assessment.periods())
            .build();
    }

    /**
     * The base year's actual KPIs when the goal is growth based, {@code null} for an absolute value.
     */
    private YearlyKpi baseYearKpi(ScenarioContext context, GoalRequest request) {
        if (request.getBaseYear() == null) {
            if (request.getValue() == null) {
                throw new InvalidGoalException("A goal needs either a value or a baseYear.");
            }
            return null;
        }
        if (request.getValue() != null) {
            throw new InvalidGoalException("A goal takes a value or a baseYear, not both.");
        }
        if (context.entities().size() != 1) {
            throw new InvalidGoalException("A baseYear goal needs a single-entity scenario, got "
                + context.entities().size() + " entities.");
        }
        String entity = context.entities().get(0);
        return dnaService.yearlyKpis(entity).stream()
            .filter(kpi -> kpi.year() == request.getBaseYear())
            .findFirst()
            .orElseThrow(() -> new InvalidGoalException(
                "No history for " + entity + " in base year " + request.getBaseYear() + "."));
    }

    ProjectionResult run(Scenario scenario) {
        ScenarioContext context = scenario.context();
        PureDna dna = dnaService.pureDna(context);
        return pipeline.run(dna, context.forecastContext(), scenario.events().events())
            .orElseThrow(() -> {
                log.warn("Uncalibratable trial | scenario={} | start={} | end={} | year={}",
                         scenario.id(), context.trial().start(), context.trial().end(), context.projectionYear());
                return new UncalibratableTrialException(
                    context.trial().start(), context.trial().end(), context.projectionYear());
            });
    }
}
