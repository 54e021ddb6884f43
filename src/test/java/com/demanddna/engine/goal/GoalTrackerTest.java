package com.demanddna.engine.goal;

import com.demanddna.engine.EngineFixtures;
import com.demanddna.engine.Granularity;
import com.demanddna.engine.MetricValues;
import com.demanddna.engine.ProjectionResult;
import com.demanddna.engine.PureDna;
import com.demanddna.engine.ShockShape;
import com.demanddna.engine.TargetMetric;
import com.demanddna.engine.event.ShockEvent;
import com.demanddna.engine.event.SimulationEvent;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.demanddna.engine.EngineFixtures.YEAR;
import static org.assertj.core.api.Assertions.*;

class GoalTrackerTest {

    private static final LocalDate JAN_1 = LocalDate.of(YEAR, 1, 1);
    private static final LocalDate JAN_31 = LocalDate.of(YEAR, 1, 31);
    private static final MetricValues JANUARY_BASE = new MetricValues(3_100, 62, 6_200);

    private final GoalTracker tracker = new GoalTracker();

    private static ProjectionResult projection(List<SimulationEvent> events) {
        return EngineFixtures.pipeline().run(PureDna.neutral(), EngineFixtures.referenceContext(), events).orElseThrow();
    }

    private static GoalTarget target(TargetMetric metric, double value, VolumeDriver driver) {
        return new GoalTarget(metric, value, JAN_1, JAN_31, driver, Granularity.MONTHLY);
    }

    private MetricValues needed(TargetMetric metric, double value, VolumeDriver driver) {
        return tracker.neededVolumes(target(metric, value, driver), JANUARY_BASE, 0.02, 100.0);
    }

    private static void assertVolumes(MetricValues actual, double sessions, double conversions, double revenue) {
        assertThat(actual.sessions()).isCloseTo(sessions, within(1e-6));
        assertThat(actual.conversions()).isCloseTo(conversions, within(1e-6));
        assertThat(actual.revenue()).isCloseTo(revenue, within(1e-6));
    }

    @Test
    void revenueTarget_trafficDriver_backsOutSessions() {
        assertVolumes(needed(TargetMetric.REVENUE, 10_000, VolumeDriver.TRAFFIC), 5_000, 100, 10_000);
    }

    @Test
    void revenueTarget_conversionRateDriver_holdsSessions() {
        assertVolumes(needed(TargetMetric.REVENUE, 10_000, VolumeDriver.CONVERSION_RATE), 3_100, 100, 10_000);
    }

    @Test
    void revenueTarget_orderValueDriver_holdsVolumes() {
        assertVolumes(needed(TargetMetric.REVENUE, 10_000, VolumeDriver.ORDER_VALUE), 3_100, 62, 10_000);
    }

    @Test
    void conversionsTarget_derivesSessionsAndRevenue() {
        assertVolumes(needed(TargetMetric.CONVERSIONS, 93, VolumeDriver.TRAFFIC), 4_650, 93, 9_300);
        assertVolumes(needed(TargetMetric.CONVERSIONS, 93, VolumeDriver.CONVERSION_RATE), 3_100, 93, 9_300);
    }

    @Test
    void sessionsTarget_appliesEffectiveRatios() {
        assertVolumes(needed(TargetMetric.SESSIONS, 6_200, VolumeDriver.TRAFFIC), 6_200, 124, 12_400);
    }

    @Test
    void ratioTargets_holdBaselineVolumes() {
        assertVolumes(needed(TargetMetric.CONVERSION_RATE, 0.03, VolumeDriver.TRAFFIC), 3_100, 93, 9_300);
        assertVolumes(needed(TargetMetric.ORDER_VALUE, 150, VolumeDriver.TRAFFIC), 3_100, 62, 9_300);
    }

    @Test
    void zeroEffectiveRatios_fallBackToZero() {
        MetricValues result = tracker.neededVolumes(
            target(TargetMetric.REVENUE, 10_000, VolumeDriver.TRAFFIC), MetricValues.ZERO, 0.0, 0.0);

        assertVolumes(result, 0, 0, 10_000);
    }

    @Test
    void assess_reportsBeforeAfterAndNeededKpis() {
        ShockEvent shock = ShockEvent.builder()
            .start(LocalDate.of(YEAR, 1, 10)).end(LocalDate.of(YEAR, 1, 19))
            .shape(ShockShape.STEP).lift(1.0).build();

        GoalAssessment assessment = tracker.assess(projection(List.of(shock)),
            target(TargetMetric.REVENUE, 10_000, VolumeDriver.TRAFFIC));

        assertThat(assessment.targetWindowEmpty()).isFalse();
        assertThat(assessment.before().sessions()).isCloseTo(3_100, within(1e-6));
        assertThat(assessment.before().conversionRate()).isCloseTo(0.02, within(1e-12));
        assertThat(assessment.before().orderValue()).isCloseTo(100, within(1e-9));
        assertThat(assessment.after().sessions()).isCloseTo(4_100, within(1e-6));
        assertThat(assessment.needed().sessions()).isCloseTo(5_000, within(1e-6));
        assertThat(assessment.needed().orderValue()).isCloseTo(100, within(1e-9));

        GoalPeriod january = assessment.periods().get(0);
        assertThat(assessment.periods()).hasSize(1);
        assertThat(january.period()).isEqualTo(1);
        assertThat(january.firstDate()).isEqualTo(JAN_1);
        assertThat(january.baselineGap().sessions()).isCloseTo(-1_900, within(1e-6));
        assertThat(january.simulationGap().sessions()).isCloseTo(-900, within(1e-6));
    }

    @Test
    void assess_spreadsNeededProportionallyToBaseline() {
        GoalTarget target = new GoalTarget(TargetMetric.SESSIONS, 11_800, JAN_1, LocalDate.of(YEAR, 2, 28),
            VolumeDriver.TRAFFIC, Granularity.MONTHLY);

        GoalAssessment assessment = tracker.assess(projection(List.of()), target);

        assertThat(assessment.periods()).extracting(GoalPeriod::period).containsExactly(1, 2);
        assertThat(assessment.periods().get(0).needed().sessions()).isCloseTo(6_200, within(1e-6));
        assertThat(assessment.periods().get(1).needed().sessions()).isCloseTo(5_600, within(1e-6));
        assertThat(assessment.periods().get(1).baselineGap().sessions()).isCloseTo(-2_800, within(1e-6));
    }

    @Test
    void assess_dailyResolution_emitsOnePeriodPerDay() {
        GoalTarget target = new GoalTarget(TargetMetric.SESSIONS, 3_100, JAN_1, JAN_31,
            VolumeDriver.TRAFFIC, Granularity.DAILY);

        GoalAssessment assessment = tracker.assess(projection(List.of()), target);

        assertThat(assessment.periods()).hasSize(31);
        assertThat(assessment.periods()).allSatisfy(p ->
            assertThat(p.baselineGap().sessions()).isCloseTo(0.0, within(1e-6)));
    }

    @Test
    void assess_windowOutsideYear_isFlaggedEmpty() {
        GoalTarget target = new GoalTarget(TargetMetric.REVENUE, 5_000,
            LocalDate.of(YEAR - 1, 3, 1), LocalDate.of(YEAR - 1, 3, 31), VolumeDriver.TRAFFIC, Granularity.MONTHLY);

        GoalAssessment assessment = tracker.assess(projection(List.of()), target);

        assertThat(assessment.targetWindowEmpty()).isTrue();
        assertThat(assessment.periods()).isEmpty();
        assertThat(assessment.needed()).isEqualTo(KpiSnapshot.ZERO);
    }
}
