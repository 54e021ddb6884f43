package com.demanddna.engine.attribution;

import com.demanddna.engine.event.EventType;

public record AttributionRow(
    int index,
    EventType eventType,
    String description,
    String scope,
    double contribution,
    double gapCoveragePercent
) {
}
