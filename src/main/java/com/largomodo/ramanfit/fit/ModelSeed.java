package com.largomodo.ramanfit.fit;

import com.largomodo.ramanfit.core.domain.LinearBackground;
import com.largomodo.ramanfit.core.domain.PeakFamily;

import java.util.List;

/**
 * Everything the optimiser needs to fit one model: line shape, starting background, peak seeds
 * and stopping rules.
 *
 * @param family        line shape of every peak
 * @param background    starting background (fitted freely, no bounds)
 * @param peaks         peak seeds in ledger order
 * @param tolerance     relative cost reduction below which the fit is converged
 * @param maxIterations iteration cap
 */
public record ModelSeed(PeakFamily family, LinearBackground background, List<PeakSeed> peaks,
                        double tolerance, int maxIterations) {

    public ModelSeed {
        if (family == null || background == null) {
            throw new IllegalArgumentException("Model family and background must not be null");
        }
        peaks = List.copyOf(peaks);
        if (peaks.isEmpty()) {
            throw new IllegalArgumentException("A model needs at least one peak");
        }
        if (tolerance <= 0 || maxIterations <= 0) {
            throw new IllegalArgumentException("Tolerance and iteration cap must be positive");
        }
    }

    /**
     * Length of the unconstrained parameter vector: intercept, slope, then three per peak.
     */
    public int parameterCount() {
        return 2 + 3 * peaks.size();
    }

    /**
     * Starting parameter vector in optimiser order.
     */
    public double[] startVector() {
        double[] start = new double[parameterCount()];
        start[0] = background.intercept();
        start[1] = background.slope();
        for (int i = 0; i < peaks.size(); i++) {
            PeakSeed seed = peaks.get(i);
            start[2 + 3 * i] = seed.amplitude();
            start[3 + 3 * i] = seed.location();
            start[4 + 3 * i] = seed.width();
        }
        return start;
    }
}
