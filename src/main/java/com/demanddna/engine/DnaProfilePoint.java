package com.demanddna.engine;

import java.time.LocalDate;

public record DnaProfilePoint(
    int period,
    LocalDate firstDate,
    IndexValues pure,
    IndexValues preTrial,
    IndexValues work
) {
}
