package com.largomodo.ramanfit.core.domain;

import java.util.List;
import java.util.Optional;

/**
 * Fitted background plus an ordered set of peaks.
 * <p>
 * Two variants are produced: three Voigt peaks (G, D1, D2) or five Lorentzian peaks
 * (G, D1 to D4).
 *
 * @param family     line shape shared by all peaks
 * @param background fitted linear background
 * @param peaks      peaks in {@link PeakLabel} order (unmodifiable)
 * @param outcome    optimiser outcome
 */
public record FitModel(PeakFamily family, LinearBackground background,
                       List<PeakComponent> peaks, FitOutcome outcome) {

    public FitModel {
        peaks = List.copyOf(peaks);
        for (PeakComponent peak : peaks) {
            if (peak.family() != family) {
                throw new IllegalArgumentException("Peak " + peak.label() + " is " + peak.family()
                        + " but model is " + family);
            }
        }
    }

    public Optional<PeakComponent> peak(PeakLabel label) {
        return peaks.stream().filter(p -> p.label() == label).findFirst();
    }

    /**
     * Looks up a peak the model is known to contain.
     *
     * @throws IllegalStateException if the model has no such peak
     */
    public PeakComponent require(PeakLabel label) {
        return peak(label).orElseThrow(() ->
                new IllegalStateException(family + " model has no " + label + " peak"));
    }

    public boolean has(PeakLabel label) {
        return peak(label).isPresent();
    }

    /**
     * Sum of all peaks at a wavenumber, background excluded.
     */
    public double peakSum(double wavenumber) {
        double sum = 0;
        for (PeakComponent peak : peaks) {
            sum += peak.valueAt(wavenumber);
        }
        return sum;
    }

    /**
     * Full model value {@code background(x) + Σ peak(x)}.
     */
    public double valueAt(double wavenumber) {
        return background.valueAt(wavenumber) + peakSum(wavenumber);
    }
}
