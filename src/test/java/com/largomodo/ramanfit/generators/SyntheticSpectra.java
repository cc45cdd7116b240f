package com.largomodo.ramanfit.generators;

import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.core.domain.SpectrumPoint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.function.DoubleUnaryOperator;

/**
 * Builds test spectra on a 2 cm⁻¹ grid running from 2200 down to 800 cm⁻¹ (file order, high end first).
 */
public final class SyntheticSpectra {

    public static final double HIGH_END = 2200;
    public static final double LOW_END = 800;
    public static final double STEP = 2;

    private SyntheticSpectra() {
    }

    public static Spectrum of(String name, DoubleUnaryOperator intensity) {
        List<SpectrumPoint> points = new ArrayList<>();
        for (double x = HIGH_END; x >= LOW_END; x -= STEP) {
            points.add(new SpectrumPoint(x, intensity.applyAsDouble(x)));
        }
        return new Spectrum(name, points);
    }

    /**
     * Single Lorentzian band on a linear background.
     */
    public static Spectrum lorentzian(String name, double centre, double height, double halfWidth,
                                      double intercept, double slope) {
        return of(name, x -> intercept + slope * x
                + height * halfWidth * halfWidth / ((x - centre) * (x - centre) + halfWidth * halfWidth));
    }

    /**
     * Flat spectrum with seeded uniform noise of the given amplitude.
     */
    public static Spectrum flat(String name, double level, double noise, long seed) {
        Random random = new Random(seed);
        return of(name, x -> level + noise * (2 * random.nextDouble() - 1));
    }

    public static Path write(Spectrum spectrum, Path file) throws IOException {
        StringBuilder text = new StringBuilder();
        for (SpectrumPoint p : spectrum.points()) {
            text.append(String.format(Locale.ROOT, "%.4f\t%.6f%n", p.wavenumber(), p.intensity()));
        }
        Files.writeString(file, text.toString(), StandardCharsets.UTF_8);
        return file;
    }
}
