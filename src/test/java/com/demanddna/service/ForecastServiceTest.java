package com.demanddna.service;

import com.demanddna.dto.DnaProfileResponse;
import com.demanddna.dto.GoalRequest;
import com.demanddna.dto.GoalResponse;
import com.demanddna.dto.ProjectionResponse;
import com.demanddna.dto.WeightsResponse;
import com.demanddna.engine.EngineFixtures;
import com.demanddna.engine.Granularity;
import com.demanddna.engine.MetricValues;
import com.demanddna.engine.PureDna;
import com.demanddna.engine.ShockShape;
import com.demanddna.engine.TargetMetric;
import com.demanddna.engine.TrialObservation;
import com.demanddna.engine.event.CustomDragEvent;
import com.demanddna.engine.event.EventLog;
import com.demanddna.engine.event.EventScope;
import com.demanddna.engine.event.ShockEvent;
import com.demanddna.engine.goal.GoalTracker;
import com.demanddna.engine.goal.YearlyKpi;
import com.demanddna.exception.InvalidGoalException;
import com.demanddna.exception.ProfileDataMissingException;
import com.demanddna.exception.UncalibratableTrialException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ForecastServiceTest {

    @Mock ScenarioSessionService sessionService;
    @Mock DnaService             dnaService;

    private ForecastService service;
    private final UUID id = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new ForecastService(sessionService, dnaService, EngineFixtures.pipeline(), new GoalTracker());
    }

    private Scenario scenario(EventLog events) {
        TrialObservation trial = EngineFixtures.referenceTrial();
        ScenarioContext context = new ScenarioContext(List.of("store"), trial, 2023, Granularity.MONTHLY);
        return new Scenario(id, context, events, Instant.now(), Instant.now());
    }

    @Test
    void project_returnsCalibratedTotals() {
        ShockEvent shock = ShockEvent.builder()
            .start(LocalDate.of(2023, 3, 1)).end(LocalDate.of(2023, 3, 10)).shape(ShockShape.STEP).lift(0.5).build();
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty().append(shock)));
        when(dnaService.pureDna(any())).thenReturn(PureDna.neutral());

        ProjectionResponse response = service.project(id, "req-1");

        assertThat(response.getYear()).isEqualTo(2023);
        assertThat(response.getEventCount()).isEqualTo(1);
        assertThat(response.getMargin()).isEqualTo(0.15);
        assertThat(response.getRows()).hasSize(365);
        assertThat(response.getConstants().baseSessions()).isCloseTo(100.0, within(1e-9));
        assertThat(response.getBaselineTotals().sessions()).isCloseTo(36_500.0, within(1e-6));
        assertThat(response.getSimulationTotals().sessions()).isCloseTo(37_000.0, within(1e-6));
    }

    @Test
    void project_uncalibratableTrial_throws() {
        CustomDragEvent zero = CustomDragEvent.builder()
            .targetPeriod(1).multiplier(0.0).scope(EventScope.PRE_TRIAL).build();
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty().append(zero)));
        when(dnaService.pureDna(any())).thenReturn(PureDna.neutral());

        assertThatThrownBy(() -> service.project(id, "req-2"))
            .isInstanceOf(UncalibratableTrialException.class)
            .hasMessageContaining("2023-01-01");
    }

    @Test
    void project_missingProfiles_propagates() {
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty()));
        when(dnaService.pureDna(any())).thenThrow(new ProfileDataMissingException(List.of("store")));

        assertThatThrownBy(() -> service.project(id, "req-3")).isInstanceOf(ProfileDataMissingException.class);
    }

    @Test
    void weights_includesBlendedDna() {
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty()));
        when(dnaService.weights(any())).thenReturn(Map.of("2021", 0.25, "2022", 0.75));
        when(dnaService.pureDna(any(), anyMap())).thenReturn(PureDna.neutral());
        when(dnaService.overallWeight()).thenReturn(0.35);

        WeightsResponse response = service.weights(id);

        assertThat(response.getOverallWeight()).isEqualTo(0.35);
        assertThat(response.getWeights()).containsEntry("2022", 0.75);
        assertThat(response.getPureDna()).hasSize(12);
        verify(dnaService, never()).pureDna(any());
    }

    @Test
    void dnaProfile_defaultsToScenarioResolution() {
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty()));
        when(dnaService.pureDna(any())).thenReturn(PureDna.neutral());

        DnaProfileResponse monthly = service.dnaProfile(id, null);
        DnaProfileResponse daily = service.dnaProfile(id, Granularity.DAILY);

        assertThat(monthly.getGranularity()).isEqualTo(Granularity.MONTHLY);
        assertThat(monthly.getPoints()).hasSize(12);
        assertThat(daily.getPoints()).hasSize(365);
    }

    @Test
    void goal_assessesAgainstProjection() {
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty()));
        when(dnaService.pureDna(any())).thenReturn(PureDna.neutral());
        GoalRequest request = GoalRequest.builder()
            .metric(TargetMetric.SESSIONS).value(4_000.0)
            .start(LocalDate.of(2023, 1, 1)).end(LocalDate.of(2023, 1, 31))
            .build();

        GoalResponse response = service.goal(id, request, "req-4");

        assertThat(response.getResolution()).isEqualTo(Granularity.MONTHLY);
        assertThat(response.isTargetWindowEmpty()).isFalse();
        assertThat(response.getNeeded().sessions()).isEqualTo(4_000.0);
        assertThat(response.getBefore().sessions()).isCloseTo(3_100.0, within(1e-6));
        assertThat(response.getPeriods()).hasSize(1);
        MetricValues gap = response.getPeriods().get(0).baselineGap();
        assertThat(gap.sessions()).isCloseTo(-900.0, within(1e-6));
    }

    private static GoalRequest.GoalRequestBuilder januaryGoal(TargetMetric metric) {
        return GoalRequest.builder()
            .metric(metric)
            .start(LocalDate.of(2023, 1, 1)).end(LocalDate.of(2023, 1, 31));
    }

    @Test
    void goal_baseYearGrowth_derivesTargetFromYearlyActuals() {
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty()));
        when(dnaService.pureDna(any())).thenReturn(PureDna.neutral());
        when(dnaService.yearlyKpis("store")).thenReturn(List.of(
            new YearlyKpi(2021, 2_000, 40, 4_000),
            new YearlyKpi(2022, 3_000, 60, 6_000)));

        GoalResponse response = service.goal(id,
            januaryGoal(TargetMetric.SESSIONS).baseYear(2022).growthPercent(20.0).build(), "req-5");

        assertThat(response.getValue()).isCloseTo(3_600.0, within(1e-9));
        assertThat(response.getBaseYear()).isEqualTo(2022);
        assertThat(response.getBaseValue()).isEqualTo(3_000.0);
        assertThat(response.getGrowthPercent()).isEqualTo(20.0);
        assertThat(response.getNeeded().sessions()).isCloseTo(3_600.0, within(1e-9));
    }

    @Test
    void goal_baseYearWithoutGrowth_usesDefaultGrowth() {
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty()));
        when(dnaService.pureDna(any())).thenReturn(PureDna.neutral());
        when(dnaService.yearlyKpis("store")).thenReturn(List.of(new YearlyKpi(2022, 3_000, 60, 6_000)));

        GoalResponse response = service.goal(id,
            januaryGoal(TargetMetric.ORDER_VALUE).baseYear(2022).build(), "req-6");

        assertThat(response.getValue()).isCloseTo(105.0, within(1e-9));
        assertThat(response.getGrowthPercent()).isEqualTo(ForecastService.DEFAULT_GROWTH_PERCENT);
    }

    @Test
    void goal_absoluteValue_leavesBaseFieldsEmpty() {
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty()));
        when(dnaService.pureDna(any())).thenReturn(PureDna.neutral());

        GoalResponse response = service.goal(id, januaryGoal(TargetMetric.REVENUE).value(9_000.0).build(), "req-7");

        assertThat(response.getBaseYear()).isNull();
        assertThat(response.getBaseValue()).isNull();
        verify(dnaService, never()).yearlyKpis(anyString());
    }

    @Test
    void goal_unknownBaseYear_throws() {
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty()));
        when(dnaService.yearlyKpis("store")).thenReturn(List.of(new YearlyKpi(2022, 3_000, 60, 6_000)));

        assertThatThrownBy(() -> service.goal(id, januaryGoal(TargetMetric.REVENUE).baseYear(2019).build(), "req-8"))
            .isInstanceOf(InvalidGoalException.class)
            .hasMessageContaining("2019");
    }

    @Test
    void goal_baseYearOnMultiEntityScenario_throws() {
        ScenarioContext context = new ScenarioContext(List.of("store", "outlet"), EngineFixtures.referenceTrial(),
            2023, Granularity.MONTHLY);
        when(sessionService.get(id)).thenReturn(new Scenario(id, context, EventLog.empty(), Instant.now(), Instant.now()));

        assertThatThrownBy(() -> service.goal(id, januaryGoal(TargetMetric.REVENUE).baseYear(2022).build(), "req-9"))
            .isInstanceOf(InvalidGoalException.class)
            .hasMessageContaining("single-entity");
        verifyNoInteractions(dnaService);
    }

    @Test
    void goal_valueAndBaseYearTogetherOrNeither_throw() {
        when(sessionService.get(id)).thenReturn(scenario(EventLog.empty()));

        assertThatThrownBy(() -> service.goal(id,
                januaryGoal(TargetMetric.REVENUE).value(1.0).baseYear(2022).build(), "req-10"))
            .isInstanceOf(InvalidGoalException.class);
        assertThatThrownBy(() -> service.goal(id, januaryGoal(TargetMetric.REVENUE).build(), "req-11"))
            .isInstanceOf(InvalidGoalException.class);
    }
}
