package com.largomodo.ramanfit.fit;

import com.largomodo.ramanfit.core.domain.FitModel;
import com.largomodo.ramanfit.core.domain.Spectrum;

/**
 * Fits a seeded multi-peak model to a spectrum.
 * <p>
 * Implementations never fail on non-convergence: a fit that reaches its iteration cap returns
 * the best parameters seen, with {@link com.largomodo.ramanfit.core.domain.ReportedValue.ExceededCap}
 * as its iteration count.
 */
public interface PeakFitter {

    /**
     * @param spectrum spectrum to fit, every point weighted equally
     * @param seed     starting point, bounds and stopping rules
     * @return fitted model with peaks in seed order and widths as half widths
     */
    FitModel fit(Spectrum spectrum, ModelSeed seed);
}
