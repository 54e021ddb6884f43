package com.demanddna.engine;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a de-shock pass: the daily context series shown around the window, the floor,
 * and the signature when any excess traffic was found.
 */
public record SignatureExtraction(
    LocalDate contextStart,
    LocalDate contextEnd,
    List<DailyObservation> context,
    MetricValues floor,
    Optional<ShockSignature> signature
) {
}
