package com.demanddna.engine.goal;

import com.demanddna.engine.Granularity;
import com.demanddna.engine.ProfilePoint;
import com.demanddna.engine.TargetMetric;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class YearlyKpiTest {

    private static ProfilePoint month(String year, int month, double sessions, double conversions, double revenue) {
        return new ProfilePoint("store", year, Granularity.MONTHLY, month, sessions, conversions, revenue, 1, 1, 1);
    }

    @Test
    void fromMonthly_sumsVolumesPerYearLabel() {
        List<ProfilePoint> rows = List.of(
            month("2022", 1, 1_000, 20, 2_000),
            month("2021", 1, 500, 5, 400),
            month("2022", 2, 3_000, 60, 6_000),
            month("Overall", 1, 9_999, 99, 9_999),
            new ProfilePoint("store", "2022", Granularity.DAILY, 1, 777, 7, 70, 1, 1, 1));

        List<YearlyKpi> kpis = YearlyKpi.fromMonthly(rows);

        assertThat(kpis).extracting(YearlyKpi::year).containsExactly(2021, 2022);
        YearlyKpi y2022 = kpis.get(1);
        assertThat(y2022.sessions()).isEqualTo(4_000.0);
        assertThat(y2022.conversions()).isEqualTo(80.0);
        assertThat(y2022.revenue()).isEqualTo(8_000.0);
        assertThat(y2022.conversionRate()).isCloseTo(0.02, within(1e-12));
        assertThat(y2022.orderValue()).isCloseTo(100.0, within(1e-12));
    }

    @Test
    void ratios_zeroDenominator_areZero() {
        YearlyKpi empty = new YearlyKpi(2020, 0, 0, 500);

        assertThat(empty.value(TargetMetric.CONVERSION_RATE)).isZero();
        assertThat(empty.value(TargetMetric.ORDER_VALUE)).isZero();
    }

    @Test
    void grown_appliesGrowthToSelectedMetric() {
        YearlyKpi base = new YearlyKpi(2022, 4_000, 80, 8_000);

        assertThat(base.grown(TargetMetric.REVENUE, 10)).isCloseTo(8_800.0, within(1e-9));
        assertThat(base.grown(TargetMetric.SESSIONS, 0)).isEqualTo(4_000.0);
        assertThat(base.grown(TargetMetric.ORDER_VALUE, -50)).isCloseTo(50.0, within(1e-9));
    }
}
