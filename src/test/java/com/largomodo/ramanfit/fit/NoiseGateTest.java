package com.largomodo.ramanfit.fit;

import com.largomodo.ramanfit.core.InsufficientDataException;
import com.largomodo.ramanfit.core.domain.LinearBackground;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.generators.SyntheticSpectra;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NoiseGateTest {

    private static final LinearBackground ZERO = new LinearBackground(0, 0);

    private final Spectrum strongPeak = SyntheticSpectra.lorentzian("peak", 1360, 1000, 30, 0, 0);

    @Test
    void testStrongPeakPassesGate() {
        NoiseAssessment assessment = new NoiseGate(2, 0.1).assess(strongPeak, ZERO);

        assertFalse(assessment.noisy());
        assertTrue(assessment.snr() > 100, "snr = " + assessment.snr());
        assertEquals(1000, assessment.signalPeak(), 1e-9);
    }

    @Test
    void testFlatNoiseIsNoisy() {
        Spectrum flat = SyntheticSpectra.flat("flat", 100, 0.5, 42);

        NoiseAssessment assessment = new NoiseGate(2, 0.1).assess(flat, new BackgroundEstimator().estimate(flat));

        assertTrue(assessment.noisy());
        assertTrue(assessment.snr() < 2);
    }

    @Test
    void testSnrAtThresholdIsNotNoisy() {
        // noise window range 0.9 - (0 - 0.1) = 1.0, signal 2.5
        Spectrum spectrum = SyntheticSpectra.of("s", x -> x == 1750 ? 0.9 : x == 1500 ? 2.5 : 0);

        NoiseAssessment atThreshold = new NoiseGate(2, 0.1).assess(spectrum, ZERO);
        NoiseAssessment belowThreshold = new NoiseGate(3, 0.1).assess(spectrum, ZERO);

        assertEquals(2, atThreshold.snr());
        assertFalse(atThreshold.noisy());
        assertTrue(belowThreshold.noisy());
    }

    @Test
    void testSignalIsMeasuredAboveBackgroundAtPeakPosition() {
        Spectrum spectrum = SyntheticSpectra.of("s", x -> 10 + (x == 1500 ? 5 : 0));

        NoiseAssessment assessment = new NoiseGate(2, 0.1).assess(spectrum, new LinearBackground(10, 0));

        assertEquals(5, assessment.signalPeak(), 1e-12);
        assertEquals(50, assessment.snr());
    }

    @Test
    void testZeroNoiseRangeSaturates() {
        Spectrum spectrum = SyntheticSpectra.of("s", x -> x == 1500 ? 5 : 0);

        NoiseAssessment assessment = new NoiseGate(2, 0).assess(spectrum, ZERO);

        assertEquals(Integer.MAX_VALUE, assessment.snr());
        assertFalse(assessment.noisy());
    }

    @Test
    void testNoSignalAndNoNoiseIsNoisy() {
        Spectrum spectrum = SyntheticSpectra.of("s", x -> 0);

        NoiseAssessment assessment = new NoiseGate(2, 0).assess(spectrum, ZERO);

        assertEquals(0, assessment.snr());
        assertTrue(assessment.noisy());
    }

    @Test
    void testMissingNoiseWindowIsInsufficientData() {
        Spectrum shortRange = new Spectrum("s", SyntheticSpectra.of("s", x -> 1).points().subList(300, 700));

        assertThrows(InsufficientDataException.class, () -> new NoiseGate(2, 0.1).assess(shortRange, ZERO));
    }

    @Property
    void noisyExactlyWhenSnrBelowThreshold(@ForAll @DoubleRange(min = 0, max = 1000) double threshold) {
        NoiseAssessment assessment = new NoiseGate(threshold, 0.1).assess(strongPeak, ZERO);

        assertEquals(assessment.snr() < threshold, assessment.noisy());
    }
}
