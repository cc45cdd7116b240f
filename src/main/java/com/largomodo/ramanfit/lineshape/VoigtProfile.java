package com.largomodo.ramanfit.lineshape;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;

/**
 * Voigt line shape via the real part of the Faddeeva function.
 * <p>
 * {@code V(x, y) = Re w(x + iy)}, the convolution of a unit-area Gaussian
 * (σ = 1/√2) with a Lorentzian of half width {@code y}. The profile integrates to √π over x,
 * so a fitted coefficient multiplying it is proportional to the peak area.
 * <p>
 * Evaluated with Humlicek's W4 rational approximation (J. Quant. Spectrosc. Radiat. Transfer
 * 27, 1982), accurate to about 1e-4 relative over the whole upper half plane. This is the same
 * approximation gnuplot's {@code voigt(x, y)} uses, so fitted amplitudes stay comparable with
 * results produced by the earlier gnuplot-driven tooling.
 * <p>
 * Stateless utility. Safe for concurrent use.
 */
public final class VoigtProfile {

    private VoigtProfile() {
        // Static utility class - prevent instantiation
    }

    /**
     * Evaluates the Voigt profile.
     *
     * @param x offset from the line centre
     * @param y Lorentzian half width, must be non-negative
     * @return {@code Re w(x + iy)}
     * @throws IllegalArgumentException if y is negative
     */
    public static double value(double x, double y) {
        if (y < 0) {
            throw new IllegalArgumentException("Voigt width must be non-negative, got: " + y);
        }
        return faddeeva(x, y).getReal();
    }

    /**
     * Peak height of a unit-coefficient profile, {@code V(0, y)}.
     */
    public static double peakValue(double y) {
        return value(0, y);
    }

    static Complex faddeeva(double x, double y) {
        // Humlicek works in t = y - ix
        Complex t = new Complex(y, -x);
        double s = FastMath.abs(x) + y;

        if (s >= 15) {
            // Region I: one-pole approximation
            return t.multiply(0.5641896).divide(t.multiply(t).add(0.5));
        }
        if (s >= 5.5) {
            // Region II
            Complex u = t.multiply(t);
            Complex numerator = t.multiply(u.multiply(0.5641896).add(1.410474));
            Complex denominator = u.multiply(u.add(3)).add(0.75);
            return numerator.divide(denominator);
        }
        if (y >= 0.195 * FastMath.abs(x) - 0.176) {
            // Region III
            Complex numerator = polynomial(t, 16.4955, 20.20933, 11.96482, 3.778987, 0.5642236);
            Complex denominator = polynomial(t, 16.4955, 38.82363, 39.27121, 21.69274, 6.699398, 1.0);
            return numerator.divide(denominator);
        }
        // Region IV
        Complex u = t.multiply(t);
        Complex negU = u.negate();
        Complex numerator = t.multiply(polynomial(negU,
                36183.31, 3321.9905, 1540.787, 219.0313, 35.76683, 1.320522, 0.56419));
        Complex denominator = polynomial(negU,
                32066.6, 24322.84, 9022.228, 2186.181, 364.2191, 61.57037, 1.841439, 1.0);
        return u.exp().subtract(numerator.divide(denominator));
    }

    /**
     * Horner evaluation of {@code c0 + c1*z + c2*z^2 + ...}.
     */
    private static Complex polynomial(Complex z, double... coefficients) {
        Complex result = new Complex(coefficients[coefficients.length - 1]);
        for (int i = coefficients.length - 2; i >= 0; i--) {
            result = result.multiply(z).add(coefficients[i]);
        }
        return result;
    }
}
