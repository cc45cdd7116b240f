package com.largomodo.ramanfit.fit;

import com.largomodo.ramanfit.core.InsufficientDataException;
import com.largomodo.ramanfit.core.domain.LinearBackground;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.core.domain.SpectrumPoint;

/**
 * Linear baseline through the two end points of a spectrum.
 * <p>
 * The first record is the high-wavenumber end (x_end, y_end) and the last record the
 * low-wavenumber end (x_init, y_init):
 * <pre>
 *   slope     = (y_end - y_init) / (x_end - x_init)
 *   intercept = y_init - slope * x_init
 * </pre>
 * The estimate seeds the optimiser and anchors the noise gate; the fitted background replaces
 * it once a model has been fitted.
 */
public class BackgroundEstimator {

    /**
     * @throws InsufficientDataException if the spectrum has fewer than two points or both ends
     *                                   share a wavenumber
     */
    public LinearBackground estimate(Spectrum spectrum) {
        if (spectrum.size() < 2) {
            throw new InsufficientDataException("Spectrum " + spectrum.name() + " has " + spectrum.size()
                    + " point(s); at least 2 are needed to estimate a background");
        }
        SpectrumPoint end = spectrum.first();
        SpectrumPoint init = spectrum.last();

        double run = end.wavenumber() - init.wavenumber();
        if (run == 0) {
            throw new InsufficientDataException("Spectrum " + spectrum.name()
                    + " starts and ends at the same wavenumber " + end.wavenumber());
        }
        double slope = (end.intensity() - init.intensity()) / run;
        double intercept = init.intensity() - slope * init.wavenumber();
        return new LinearBackground(intercept, slope);
    }
}
