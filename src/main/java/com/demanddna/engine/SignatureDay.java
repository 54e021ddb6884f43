package com.demanddna.engine;

import java.time.LocalDate;

/**
 * Excess volumes above the organic floor on one day of a signature window, absolute and as
 * a fraction of the floor.
 */
public record SignatureDay(LocalDate date, MetricValues excess, MetricValues relative) {
}
