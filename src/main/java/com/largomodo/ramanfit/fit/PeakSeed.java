package com.largomodo.ramanfit.fit;

import com.largomodo.ramanfit.core.domain.PeakLabel;

/**
 * Starting point and bounds of one peak, in the optimiser's unconstrained coordinates.
 *
 * @param label      band identity
 * @param amplitude  starting amplitude variable (the fitted amplitude is its absolute value)
 * @param location   starting location variable
 * @param width      starting half-width variable
 * @param locationBound physical range of the centre
 * @param widthBound    physical range of the half width
 */
public record PeakSeed(PeakLabel label, double amplitude, double location, double width,
                       BoundedParameter locationBound, BoundedParameter widthBound) {

    public PeakSeed {
        if (label == null || locationBound == null || widthBound == null) {
            throw new IllegalArgumentException("Peak seed label and bounds must not be null");
        }
    }
}
