package com.largomodo.ramanfit.core.domain;

/**
 * A single (wavenumber, intensity) sample of a Raman spectrum.
 *
 * @param wavenumber Raman shift in cm⁻¹
 * @param intensity  detector counts at that shift
 */
public record SpectrumPoint(double wavenumber, double intensity) {

    public SpectrumPoint {
        if (!Double.isFinite(wavenumber) || !Double.isFinite(intensity)) {
            throw new IllegalArgumentException(
                    "Spectrum point must be finite, got: (" + wavenumber + ", " + intensity + ")");
        }
    }
}
