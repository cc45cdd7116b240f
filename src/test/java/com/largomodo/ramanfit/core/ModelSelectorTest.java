package com.largomodo.ramanfit.core;

import com.largomodo.ramanfit.core.domain.FitModel;
import com.largomodo.ramanfit.core.domain.FitStyle;
import com.largomodo.ramanfit.core.domain.PeakFamily;
import com.largomodo.ramanfit.core.domain.PeakLabel;
import com.largomodo.ramanfit.core.domain.PeakReport;
import com.largomodo.ramanfit.core.domain.SampleRecord;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.fit.ModelSeed;
import com.largomodo.ramanfit.fit.PeakFitter;
import com.largomodo.ramanfit.fit.PeakInitializer;
import com.largomodo.ramanfit.generators.SyntheticSpectra;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ModelSelector with a mocked fitter returning hand-built models.
 * <p>
 * Tests verify:
 * - Each acceptance branch and its boundary
 * - The Lorentzian fit is attempted only when both Voigt tests fail
 * - Voigt2 reports the Voigt numbers unchanged
 */
class ModelSelectorTest {

    private final Spectrum spectrum = SyntheticSpectra.lorentzian("s", 1360, 500, 30, 10, 0);
    private final MetricsCalculator metrics = new MetricsCalculator();
    private PeakFitter mockFitter;
    private ModelSelector selector;

    @BeforeEach
    void setUp() {
        mockFitter = mock(PeakFitter.class);
        FitSettings settings = FitSettings.defaults();
        selector = new ModelSelector(new PeakInitializer(settings), mockFitter, metrics, settings);
    }

    private void givenVoigt(FitModel voigt) {
        when(mockFitter.fit(eq(spectrum), argThat(seed -> seed != null && seed.family() == PeakFamily.VOIGT)))
                .thenReturn(voigt);
    }

    private void givenLorentzian(FitModel lorentzian) {
        when(mockFitter.fit(eq(spectrum), argThat(seed -> seed != null && seed.family() == PeakFamily.LORENTZIAN)))
                .thenReturn(lorentzian);
    }

    private ModelSelection select() {
        return selector.select(spectrum, FitModels.FLAT);
    }

    @Test
    void testConstructorRejectsNullFitter() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                new ModelSelector(new PeakInitializer(FitSettings.defaults()), null, metrics, FitSettings.defaults()));
        assertEquals("All dependencies must not be null", ex.getMessage());
    }

    @Test
    void testLowR2AndNarrowD1IsVoigt1() {
        givenVoigt(FitModels.voigt(2, 1, 1, 0.8, 20));

        ModelSelection selection = select();

        assertEquals(FitStyle.VOIGT1, selection.style());
        assertTrue(selection.lorentzian().isEmpty());
        verify(mockFitter, times(1)).fit(any(), any());
    }

    @Test
    void testLowR2AndLowR1IsVoigt3() {
        givenVoigt(FitModels.voigt(2, 1, 1, 0.4, 70));

        ModelSelection selection = select();

        assertEquals(FitStyle.VOIGT3, selection.style());
        verify(mockFitter, times(1)).fit(any(), any());
    }

    @ParameterizedTest
    @CsvSource({
            "59.99, VOIGT1",
            "60.0, VOIGT3"
    })
    void testD1WidthBoundary(double d1HalfWidth, FitStyle expected) {
        givenVoigt(FitModels.voigt(2, 1, 1, 0.4, d1HalfWidth));

        assertEquals(expected, select().style());
    }

    @Test
    void testR1AtLimitIsNotVoigt3() {
        givenVoigt(FitModels.voigt(2, 1, 1, 0.5, 70));
        givenLorentzian(FitModels.lorentzian(1, 1, 1, 1, 1));

        assertEquals(FitStyle.LORENTZIANS, select().style());
    }

    @Test
    void testR2AtLimitSelectsNeitherVoigtStyle() {
        // R2 = 3 / (3 + 1 + 1) = 0.6 exactly
        givenVoigt(FitModels.voigt(1, 3, 1, 0.1, 10));
        givenLorentzian(FitModels.lorentzian(1, 1, 1, 1, 1));

        ModelSelection selection = select();

        assertEquals(FitStyle.LORENTZIANS, selection.style());
        verify(mockFitter, times(2)).fit(any(), any());
    }

    @Test
    void testUndefinedR2MovesOnToLorentzian() {
        givenVoigt(FitModels.voigt(0, 0, 0, 0, 10));
        givenLorentzian(FitModels.lorentzian(1, 1, 1, 1, 1));

        assertEquals(FitStyle.LORENTZIANS, select().style());
    }

    @Test
    void testAcceptedLorentzianReportsFivePeaks() {
        FitModel lorentzian = FitModels.lorentzian(1, 1, 1, 1, 1);
        givenVoigt(FitModels.voigt(1, 4, 1, 2, 80));
        givenLorentzian(lorentzian);

        ModelSelection selection = select();
        SampleRecord record = selection.record();

        assertEquals(FitStyle.LORENTZIANS, selection.style());
        assertSame(lorentzian, selection.accepted());
        assertTrue(record.peak(PeakLabel.D4).area().isPresent());
        assertEquals(record.ra2Temp(), record.reportedTemp());
        assertEquals(metrics.r2(selection.voigt()), record.r2RatioVoigt());
    }

    @Test
    void testRa2AtLimitIsStillAccepted() {
        // RA2 = (1 + 1) / (0.5 + 0.25 + 0.25) = 2.0
        givenVoigt(FitModels.voigt(1, 4, 1, 2, 80));
        givenLorentzian(FitModels.lorentzian(0.5, 1, 0.25, 0.25, 1));

        assertEquals(FitStyle.LORENTZIANS, select().style());
    }

    @Test
    void testHighRa2FallsBackToVoigtNumbers() {
        FitModel voigt = FitModels.voigt(1, 4, 1, 2, 80);
        givenVoigt(voigt);
        // RA2 = (5 + 5) / (1 + 1 + 1)
        givenLorentzian(FitModels.lorentzian(1, 5, 1, 1, 5));

        ModelSelection selection = select();
        SampleRecord record = selection.record();
        SampleRecord voigtOnly = metrics.buildRecord("s", spectrum, FitStyle.VOIGT2, voigt, voigt);

        assertEquals(FitStyle.VOIGT2, selection.style());
        assertSame(voigt, selection.accepted());
        assertTrue(selection.lorentzian().isPresent());
        assertEquals(voigtOnly, record);
        assertEquals(PeakReport.notApplicable(), record.peak(PeakLabel.D3));
        assertFalse(record.ra2Ratio().isPresent());
        assertEquals(record.r2Temp(), record.reportedTemp());
    }

    @Test
    void testUndefinedRa2FallsBackToVoigt() {
        givenVoigt(FitModels.voigt(1, 4, 1, 2, 80));
        givenLorentzian(FitModels.lorentzian(0, 1, 0, 0, 1));

        assertEquals(FitStyle.VOIGT2, select().style());
    }

    @Test
    void testSeedsComeFromInitializer() {
        givenVoigt(FitModels.voigt(1, 4, 1, 2, 80));
        givenLorentzian(FitModels.lorentzian(1, 1, 1, 1, 1));

        select();

        ArgumentCaptor<ModelSeed> seeds = ArgumentCaptor.forClass(ModelSeed.class);
        verify(mockFitter, times(2)).fit(eq(spectrum), seeds.capture());
        assertEquals(PeakFamily.VOIGT, seeds.getAllValues().get(0).family());
        assertEquals(PeakFamily.LORENTZIAN, seeds.getAllValues().get(1).family());
        assertEquals(5, seeds.getAllValues().get(1).peaks().size());
    }
}
