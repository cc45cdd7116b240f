package com.largomodo.ramanfit.fit;

/**
 * Arctangent map from an unconstrained optimiser variable onto a closed physical range.
 * <pre>
 *   bound(z)   = (hi - lo) / π · (atan(z) + π/2) + lo
 *   inverse(x) = tan(π · (x - lo) / (hi - lo) - π/2)
 * </pre>
 * Every real {@code z} maps inside [lo, hi], so optimiser steps of any size keep the peak
 * physical without a constrained solver.
 * <p>
 * {@link #inverse(double)} is not clamped. A guess outside [lo, hi] lands outside the
 * principal branch of tan and maps forward to a different point of the range; callers
 * seeding from measured maxima inherit that behaviour.
 *
 * @param lo lower bound
 * @param hi upper bound, strictly above lo
 */
public record BoundedParameter(double lo, double hi) {

    public BoundedParameter {
        if (!(hi > lo)) {
            throw new IllegalArgumentException("Upper bound must exceed lower bound: [" + lo + ", " + hi + "]");
        }
    }

    public double bound(double z) {
        return (hi - lo) / Math.PI * (Math.atan(z) + Math.PI / 2) + lo;
    }

    public double inverse(double physical) {
        return Math.tan(Math.PI * (physical - lo) / (hi - lo) - Math.PI / 2);
    }

    public boolean contains(double physical) {
        return physical >= lo && physical <= hi;
    }

    /**
     * Non-negative amplitude {@code sqrt(z²)}.
     */
    public static double amplitude(double z) {
        return Math.sqrt(z * z);
    }
}
