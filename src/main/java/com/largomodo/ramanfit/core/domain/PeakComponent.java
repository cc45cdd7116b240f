package com.largomodo.ramanfit.core.domain;

/**
 * One fitted band of a {@link FitModel}, already mapped back to physical units.
 * <p>
 * Width is the half width at half maximum while the pipeline runs. {@link #finalized()}
 * produces the reporting copy with the full width (FWHM); location, height and area are
 * unaffected by finalisation.
 *
 * @param label     band identity
 * @param family    line shape
 * @param location  centre wavenumber
 * @param amplitude fitted coefficient (non-negative)
 * @param height    peak maximum above the background
 * @param width     half width (HWHM) or, after {@link #finalized()}, full width (FWHM)
 * @param area      integrated area
 */
public record PeakComponent(PeakLabel label, PeakFamily family, double location,
                            double amplitude, double height, double width, double area) {

    public PeakComponent {
        if (label == null || family == null) {
            throw new IllegalArgumentException("Peak label and family must not be null");
        }
    }

    /**
     * Builds a component from fitted amplitude, location and half width, deriving height
     * and area from the family.
     */
    public static PeakComponent of(PeakLabel label, PeakFamily family,
                                   double location, double amplitude, double halfWidth) {
        return new PeakComponent(label, family, location, amplitude,
                family.height(amplitude, halfWidth), halfWidth,
                family.area(amplitude, halfWidth));
    }

    /**
     * Peak contribution at a wavenumber (background excluded).
     */
    public double valueAt(double wavenumber) {
        return amplitude * family.profile(wavenumber - location, width);
    }

    /**
     * HWHM to FWHM conversion for reporting.
     */
    public PeakComponent finalized() {
        return new PeakComponent(label, family, location, amplitude, height, width * 2, area);
    }
}
