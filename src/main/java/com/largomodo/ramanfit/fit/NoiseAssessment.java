package com.largomodo.ramanfit.fit;

/**
 * Result of the pre-fit signal-to-noise check.
 *
 * @param snr        integer signal-to-noise ratio (truncated toward zero)
 * @param signalPeak background-corrected maximum of the signal window
 * @param noiseHigh  maximum of the noise reference window
 * @param noiseLow   minimum of the noise reference window, less the noise floor offset
 * @param noisy      true if {@code snr} is below the threshold
 */
public record NoiseAssessment(int snr, double signalPeak, double noiseHigh, double noiseLow, boolean noisy) {
}
