package com.demanddna.engine;

import com.demanddna.engine.event.CustomDragEvent;
import com.demanddna.engine.event.EventScope;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.demanddna.engine.EngineFixtures.*;
import static org.assertj.core.api.Assertions.*;

class CalibratorTest {

    private final EventLayerCompiler compiler = new EventLayerCompiler(new YearFrameBuilder());
    private final Calibrator calibrator = new Calibrator();

    @Test
    void calibrate_flatDna_returnsReferenceConstants() {
        YearFrame frame = compiler.compile(PureDna.neutral(), YEAR, List.of());

        CalibrationConstants constants = calibrator.calibrate(frame, referenceTrial()).orElseThrow();

        assertThat(constants.baseSessions()).isCloseTo(100.0, within(1e-9));
        assertThat(constants.baseConversionRate()).isCloseTo(0.02, within(1e-12));
        assertThat(constants.baseOrderValue()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void calibrate_appliesAdjustmentPercent() {
        YearFrame frame = compiler.compile(PureDna.neutral(), YEAR, List.of());
        TrialObservation trial = new TrialObservation(TRIAL_START, TRIAL_END,
            new MetricValues(3300, 60, 6000), new MetricValues(10, 0, 0));

        CalibrationConstants constants = calibrator.calibrate(frame, trial).orElseThrow();

        assertThat(constants.baseSessions()).isCloseTo(100.0, within(1e-9));
        assertThat(constants.baseConversionRate()).isCloseTo(0.02, within(1e-12));
    }

    @Test
    void adjustment_ofMinusOneHundredPercent_keepsRawValue() {
        TrialObservation trial = new TrialObservation(TRIAL_START, TRIAL_END,
            new MetricValues(3000, 60, 6000), new MetricValues(-100, 0, 0));

        assertThat(trial.adjusted().sessions()).isEqualTo(3000.0);
    }

    @Test
    void calibrate_dividesRatiosByMeanIndexOverTrial() {
        PureDna dna = new PureDna(java.util.Map.of(1, new IndexValues(2.0, 0.5, 4.0)));
        YearFrame frame = compiler.compile(dna, YEAR, List.of());

        CalibrationConstants constants = calibrator.calibrate(frame, referenceTrial()).orElseThrow();

        assertThat(constants.baseSessions()).isCloseTo(50.0, within(1e-9));
        assertThat(constants.baseConversionRate()).isCloseTo(0.04, within(1e-12));
        assertThat(constants.baseOrderValue()).isCloseTo(25.0, within(1e-9));
    }

    @Test
    void calibrate_zeroTrafficOverTrial_isEmpty() {
        CustomDragEvent zero = CustomDragEvent.builder()
            .targetPeriod(1).multiplier(0.0).scope(EventScope.PRE_TRIAL).build();
        YearFrame frame = compiler.compile(PureDna.neutral(), YEAR, List.of(zero));

        assertThat(calibrator.calibrate(frame, referenceTrial())).isEmpty();
    }

    @Test
    void calibrate_trialOutsideYear_isEmpty() {
        YearFrame frame = compiler.compile(PureDna.neutral(), 2024, List.of());

        assertThat(calibrator.calibrate(frame, referenceTrial())).isEmpty();
    }

    @Test
    void calibrate_ignoresPostTrialEvents() {
        CustomDragEvent postTrial = CustomDragEvent.builder().targetPeriod(1).multiplier(0.0).build();
        YearFrame frame = compiler.compile(PureDna.neutral(), YEAR, List.of(postTrial));

        Optional<CalibrationConstants> constants = calibrator.calibrate(frame, referenceTrial());

        assertThat(constants).isPresent();
        assertThat(constants.get().baseSessions()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void calibrate_zeroSessions_givesZeroRatios() {
        YearFrame frame = compiler.compile(PureDna.neutral(), YEAR, List.of());
        TrialObservation trial = new TrialObservation(TRIAL_START, LocalDate.of(YEAR, 1, 5), MetricValues.ZERO);

        CalibrationConstants constants = calibrator.calibrate(frame, trial).orElseThrow();

        assertThat(constants).isEqualTo(new CalibrationConstants(0.0, 0.0, 0.0));
    }
}
