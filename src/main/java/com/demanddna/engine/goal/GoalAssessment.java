package com.demanddna.engine.goal;

import java.util.List;

public record GoalAssessment(
    GoalTarget target,
    boolean targetWindowEmpty,
    KpiSnapshot needed,
    KpiSnapshot before,
    KpiSnapshot after,
    List<GoalPeriod> periods
) {

    public static GoalAssessment emptyWindow(GoalTarget target) {
        return new GoalAssessment(target, true, KpiSnapshot.ZERO, KpiSnapshot.ZERO, KpiSnapshot.ZERO, List.of());
    }
}
