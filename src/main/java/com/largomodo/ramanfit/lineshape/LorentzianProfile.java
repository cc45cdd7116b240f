package com.largomodo.ramanfit.lineshape;

/**
 * Unit-height Lorentzian line shape {@code w² / (x² + w²)} with half width {@code w}.
 */
public final class LorentzianProfile {

    private LorentzianProfile() {
    }

    public static double value(double x, double halfWidth) {
        double w2 = halfWidth * halfWidth;
        return w2 / (x * x + w2);
    }

    /**
     * Integrated area of a Lorentzian of the given height, {@code height · π · w}.
     */
    public static double area(double height, double halfWidth) {
        return height * Math.PI * halfWidth;
    }
}
