package com.largomodo.ramanfit.fit;

import com.largomodo.ramanfit.core.InsufficientDataException;
import com.largomodo.ramanfit.core.domain.LinearBackground;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.core.domain.SpectrumPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signal-to-noise gate that keeps unusable spectra away from the optimiser.
 * <p>
 * Noise is the intensity range of the flat region (1740, 1830) cm⁻¹; signal is the highest
 * point of (1200, 1790) cm⁻¹ above the background at that wavenumber. Both windows are open
 * intervals.
 * <pre>
 *   snr = trunc(signal / (noiseHigh - (noiseLow - noiseFloorOffset)))
 * </pre>
 * Truncation uses Java's saturating int conversion, so a zero noise range gives
 * {@link Integer#MAX_VALUE} for a positive signal and NaN (no signal, no noise) gives 0.
 */
public class NoiseGate {

    private static final Logger log = LoggerFactory.getLogger(NoiseGate.class);

    static final double NOISE_WINDOW_LO = 1740;
    static final double NOISE_WINDOW_HI = 1830;
    static final double SIGNAL_WINDOW_LO = 1200;
    static final double SIGNAL_WINDOW_HI = 1790;

    private final double threshold;
    private final double noiseFloorOffset;

    public NoiseGate(double threshold, double noiseFloorOffset) {
        this.threshold = threshold;
        this.noiseFloorOffset = noiseFloorOffset;
    }

    /**
     * @throws InsufficientDataException if the noise or signal window holds no point
     */
    public NoiseAssessment assess(Spectrum spectrum, LinearBackground background) {
        SpectrumPoint noiseMax = spectrum.maxWithin(NOISE_WINDOW_LO, NOISE_WINDOW_HI)
                .orElseThrow(() -> emptyWindow(spectrum, NOISE_WINDOW_LO, NOISE_WINDOW_HI));
        SpectrumPoint noiseMin = spectrum.minWithin(NOISE_WINDOW_LO, NOISE_WINDOW_HI)
                .orElseThrow(() -> emptyWindow(spectrum, NOISE_WINDOW_LO, NOISE_WINDOW_HI));
        SpectrumPoint signalMax = spectrum.maxWithin(SIGNAL_WINDOW_LO, SIGNAL_WINDOW_HI)
                .orElseThrow(() -> emptyWindow(spectrum, SIGNAL_WINDOW_LO, SIGNAL_WINDOW_HI));

        double noiseHigh = noiseMax.intensity();
        double noiseLow = noiseMin.intensity() - noiseFloorOffset;
        double signal = signalMax.intensity() - background.valueAt(signalMax.wavenumber());
        int snr = (int) (signal / (noiseHigh - noiseLow));

        log.debug("Noise window [{}, {}], signal peak {} at {} cm-1, snr = {}",
                noiseLow, noiseHigh, signal, signalMax.wavenumber(), snr);

        return new NoiseAssessment(snr, signal, noiseHigh, noiseLow, snr < threshold);
    }

    private static InsufficientDataException emptyWindow(Spectrum spectrum, double lo, double hi) {
        return new InsufficientDataException("Spectrum " + spectrum.name()
                + " has no points between " + lo + " and " + hi + " cm-1");
    }
}
