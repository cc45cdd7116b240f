package com.largomodo.ramanfit.core;

import com.largomodo.ramanfit.ledger.LedgerKeyMatching;

/**
 * Tunable thresholds and optimiser settings for one processing run.
 * <p>
 * Immutable; {@link #defaults()} reproduces the long-standing laboratory settings and the
 * {@code with...} methods derive variants (the CLI uses them to apply command-line options).
 *
 * @param noiseThreshold     minimum integer SNR for a spectrum to be fitted (default 2)
 * @param noiseFloorOffset   subtracted from the noise window minimum so a flat window still gives
 *                           a positive noise range (default 0.1)
 * @param r2Limit            R2 must be strictly below this for either Voigt acceptance (default 0.6)
 * @param d1WidthLimit       floor of the D1 half width must be strictly below this for Voigt1 (default 60)
 * @param r1Limit            floor(100·R1) must be strictly below 100·r1Limit for Voigt3 (default 0.5)
 * @param ra2Limit           floor(100·RA2) above 100·ra2Limit rejects the Lorentzian fit (default 2.0)
 * @param voigtTolerance     relative cost reduction that ends the Voigt fit (default 1e-8)
 * @param voigtMaxIterations Voigt iteration cap (default 500)
 * @param lorentzianTolerance     relative cost reduction that ends the Lorentzian fit (default 1e-4)
 * @param lorentzianMaxIterations Lorentzian iteration cap (default 2000)
 * @param keyMatching        how the ledger decides a sample was already processed
 */
public record FitSettings(double noiseThreshold, double noiseFloorOffset,
                          double r2Limit, int d1WidthLimit, double r1Limit, double ra2Limit,
                          double voigtTolerance, int voigtMaxIterations,
                          double lorentzianTolerance, int lorentzianMaxIterations,
                          LedgerKeyMatching keyMatching) {

    public static final double DEFAULT_NOISE_THRESHOLD = 2;
    public static final double DEFAULT_R2_LIMIT = 0.6;

    public FitSettings {
        if (voigtMaxIterations <= 0 || lorentzianMaxIterations <= 0) {
            throw new IllegalArgumentException("Iteration caps must be positive");
        }
        if (voigtTolerance <= 0 || lorentzianTolerance <= 0) {
            throw new IllegalArgumentException("Tolerances must be positive");
        }
        if (noiseFloorOffset < 0) {
            throw new IllegalArgumentException("noiseFloorOffset must not be negative, got: " + noiseFloorOffset);
        }
        if (keyMatching == null) {
            throw new IllegalArgumentException("keyMatching must not be null");
        }
    }

    public static FitSettings defaults() {
        return new FitSettings(DEFAULT_NOISE_THRESHOLD, 0.1,
                DEFAULT_R2_LIMIT, 60, 0.5, 2.0,
                1e-8, 500,
                1e-4, 2000,
                LedgerKeyMatching.SUBSTRING);
    }

    public FitSettings withNoiseThreshold(double threshold) {
        return new FitSettings(threshold, noiseFloorOffset, r2Limit, d1WidthLimit, r1Limit, ra2Limit,
                voigtTolerance, voigtMaxIterations, lorentzianTolerance, lorentzianMaxIterations, keyMatching);
    }

    public FitSettings withR2Limit(double limit) {
        return new FitSettings(noiseThreshold, noiseFloorOffset, limit, d1WidthLimit, r1Limit, ra2Limit,
                voigtTolerance, voigtMaxIterations, lorentzianTolerance, lorentzianMaxIterations, keyMatching);
    }

    public FitSettings withIterationCaps(int voigtCap, int lorentzianCap) {
        return new FitSettings(noiseThreshold, noiseFloorOffset, r2Limit, d1WidthLimit, r1Limit, ra2Limit,
                voigtTolerance, voigtCap, lorentzianTolerance, lorentzianCap, keyMatching);
    }

    public FitSettings withKeyMatching(LedgerKeyMatching matching) {
        return new FitSettings(noiseThreshold, noiseFloorOffset, r2Limit, d1WidthLimit, r1Limit, ra2Limit,
                voigtTolerance, voigtMaxIterations, lorentzianTolerance, lorentzianMaxIterations, matching);
    }

    /**
     * R1 limit in the integer percent units the Voigt3 test compares against.
     */
    public int r1LimitPercent() {
        return (int) Math.round(r1Limit * 100);
    }

    /**
     * RA2 limit in integer percent units.
     */
    public int ra2LimitPercent() {
        return (int) Math.round(ra2Limit * 100);
    }
}
