package com.largomodo.ramanfit.core.domain;

import com.largomodo.ramanfit.lineshape.LorentzianProfile;
import com.largomodo.ramanfit.lineshape.VoigtProfile;

/**
 * Line shape family of a fitted peak.
 * <p>
 * The two families interpret the fitted amplitude differently:
 * <ul>
 *   <li>VOIGT: amplitude multiplies the area-normalised Voigt profile, so the amplitude itself
 *       is reported as the area and the height is {@code amplitude · V(0, w)}</li>
 *   <li>LORENTZIAN: amplitude is the peak height and the area is {@code height · π · w}</li>
 * </ul>
 */
public enum PeakFamily {
    VOIGT {
        @Override
        public double profile(double offset, double halfWidth) {
            return VoigtProfile.value(offset, halfWidth);
        }

        @Override
        public double height(double amplitude, double halfWidth) {
            return amplitude * VoigtProfile.peakValue(halfWidth);
        }

        @Override
        public double area(double amplitude, double halfWidth) {
            return amplitude;
        }
    },
    LORENTZIAN {
        @Override
        public double profile(double offset, double halfWidth) {
            return LorentzianProfile.value(offset, halfWidth);
        }

        @Override
        public double height(double amplitude, double halfWidth) {
            return amplitude;
        }

        @Override
        public double area(double amplitude, double halfWidth) {
            return LorentzianProfile.area(amplitude, halfWidth);
        }
    };

    /**
     * Unit-amplitude line shape at {@code offset} from the centre.
     */
    public abstract double profile(double offset, double halfWidth);

    public abstract double height(double amplitude, double halfWidth);

    public abstract double area(double amplitude, double halfWidth);
}
