package com.largomodo.ramanfit.fit;

import com.largomodo.ramanfit.core.FitSettings;
import com.largomodo.ramanfit.core.domain.LinearBackground;
import com.largomodo.ramanfit.core.domain.PeakFamily;
import com.largomodo.ramanfit.core.domain.PeakLabel;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.core.domain.SpectrumPoint;

import java.util.List;
import java.util.Optional;

/**
 * Heuristic starting points for the two peak models.
 * <p>
 * Each band is seeded from the highest point of a fixed search window, less the estimated
 * background at a fixed reference wavenumber. Windows are open intervals. A window with no
 * points seeds a zero height and, where the location comes from the maximum, the centre of
 * the location bound.
 * <p>
 * Scale factors (the ×10 on Voigt amplitudes, the fixed location and width variables) only
 * move the starting point; the optimiser is free to leave it.
 */
public class PeakInitializer {

    private static final double VOIGT_AMPLITUDE_SCALE = 10;
    private static final double VOIGT_WIDTH_START = -5;
    private static final double VOIGT_G_LOCATION = 1580;

    private final FitSettings settings;

    public PeakInitializer(FitSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.settings = settings;
    }

    /**
     * Seeds the three-peak Voigt model (G, D1, D2).
     */
    public ModelSeed voigtSeed(Spectrum spectrum, LinearBackground background) {
        BoundedParameter gLocation = new BoundedParameter(1563, 1605);
        double gAmplitude = VOIGT_AMPLITUDE_SCALE * rawMax(spectrum, 1575, 1600);
        PeakSeed g = new PeakSeed(PeakLabel.G, gAmplitude, gLocation.inverse(VOIGT_G_LOCATION),
                VOIGT_WIDTH_START, gLocation, new BoundedParameter(0.1, 40.1));

        double d1Amplitude = VOIGT_AMPLITUDE_SCALE * height(spectrum, background, 1200, 1450, 1350);
        PeakSeed d1 = new PeakSeed(PeakLabel.D1, d1Amplitude, 0.1, VOIGT_WIDTH_START,
                new BoundedParameter(1345, 1365), new BoundedParameter(0.1, 100.1));

        double d2Amplitude = VOIGT_AMPLITUDE_SCALE * height(spectrum, background, 1605, 1640, 1600);
        PeakSeed d2 = new PeakSeed(PeakLabel.D2, d2Amplitude, 0.6, VOIGT_WIDTH_START,
                new BoundedParameter(1605, 1625), new BoundedParameter(0.1, 16.1));

        return new ModelSeed(PeakFamily.VOIGT, background, List.of(g, d1, d2),
                settings.voigtTolerance(), settings.voigtMaxIterations());
    }

    /**
     * Seeds the five-peak Lorentzian model (G, D1 to D4).
     */
    public ModelSeed lorentzianSeed(Spectrum spectrum, LinearBackground background) {
        BoundedParameter gLocation = new BoundedParameter(1567, 1605);
        Optional<SpectrumPoint> gMax = spectrum.maxWithin(1580, 1600);
        PeakSeed g = new PeakSeed(PeakLabel.G,
                height(gMax, background, 1600),
                locationOf(gMax, gLocation),
                -1.5, gLocation, new BoundedParameter(1, 41));

        // D1 location is inverted against a wider range than it is bounded to
        BoundedParameter d1Location = new BoundedParameter(1350, 1370);
        Optional<SpectrumPoint> d1Max = spectrum.maxWithin(1350, 1370);
        PeakSeed d1 = new PeakSeed(PeakLabel.D1,
                height(d1Max, background, 1350),
                locationOf(d1Max, new BoundedParameter(1350, 1450)),
                -0.5, d1Location, new BoundedParameter(1, 101));

        PeakSeed d2 = new PeakSeed(PeakLabel.D2,
                height(spectrum, background, 1610, 1640, 1600), -5, -1.5,
                new BoundedParameter(1590, 1630), new BoundedParameter(1, 41));

        PeakSeed d3 = new PeakSeed(PeakLabel.D3,
                height(spectrum, background, 1490, 1510, 1500), 0.1, 1,
                new BoundedParameter(1475, 1525), new BoundedParameter(1, 101));

        PeakSeed d4 = new PeakSeed(PeakLabel.D4,
                height(spectrum, background, 1140, 1150, 1150), 5, 1,
                new BoundedParameter(1200, 1250), new BoundedParameter(1, 101));

        return new ModelSeed(PeakFamily.LORENTZIAN, background, List.of(g, d1, d2, d3, d4),
                settings.lorentzianTolerance(), settings.lorentzianMaxIterations());
    }

    private static double rawMax(Spectrum spectrum, double lo, double hi) {
        return spectrum.maxWithin(lo, hi).map(SpectrumPoint::intensity).orElse(0.0);
    }

    private static double height(Spectrum spectrum, LinearBackground background,
                                 double lo, double hi, double reference) {
        return height(spectrum.maxWithin(lo, hi), background, reference);
    }

    private static double height(Optional<SpectrumPoint> max, LinearBackground background, double reference) {
        return max.map(p -> p.intensity() - background.valueAt(reference)).orElse(0.0);
    }

    private static double locationOf(Optional<SpectrumPoint> max, BoundedParameter inversion) {
        return max.map(p -> inversion.inverse(p.wavenumber())).orElse(0.0);
    }
}
