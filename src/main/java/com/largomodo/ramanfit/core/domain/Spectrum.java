package com.largomodo.ramanfit.core.domain;

import java.util.List;
import java.util.Optional;

/**
 * Immutable Raman spectrum of one sample, in file order.
 * <p>
 * File order matters: the first point is treated as the high-wavenumber end and the last
 * point as the low-wavenumber end. The linear background estimate relies on that convention,
 * so points are never re-sorted.
 *
 * @param name   sample name (input file name without its extension)
 * @param points spectrum points in file order (unmodifiable)
 */
public record Spectrum(String name, List<SpectrumPoint> points) {

    public Spectrum {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Spectrum name must not be null or blank");
        }
        points = List.copyOf(points);
    }

    public int size() {
        return points.size();
    }

    public SpectrumPoint first() {
        return points.get(0);
    }

    public SpectrumPoint last() {
        return points.get(points.size() - 1);
    }

    /**
     * Finds the point of highest intensity strictly inside (lo, hi).
     * <p>
     * Ties resolve to the first point in file order.
     *
     * @param lo exclusive lower wavenumber
     * @param hi exclusive upper wavenumber
     * @return the maximum point, or empty if no point falls inside the window
     */
    public Optional<SpectrumPoint> maxWithin(double lo, double hi) {
        SpectrumPoint best = null;
        for (SpectrumPoint p : points) {
            if (p.wavenumber() > lo && p.wavenumber() < hi
                    && (best == null || p.intensity() > best.intensity())) {
                best = p;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Finds the point of lowest intensity strictly inside (lo, hi).
     *
     * @param lo exclusive lower wavenumber
     * @param hi exclusive upper wavenumber
     * @return the minimum point, or empty if no point falls inside the window
     */
    public Optional<SpectrumPoint> minWithin(double lo, double hi) {
        SpectrumPoint best = null;
        for (SpectrumPoint p : points) {
            if (p.wavenumber() > lo && p.wavenumber() < hi
                    && (best == null || p.intensity() < best.intensity())) {
                best = p;
            }
        }
        return Optional.ofNullable(best);
    }
}
