package com.demanddna.engine;

import java.time.LocalDate;

public record MultiplierPoint(LocalDate date, int dayOffset, double multiplier) {
}
