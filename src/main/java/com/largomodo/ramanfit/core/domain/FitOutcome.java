package com.largomodo.ramanfit.core.domain;

import java.util.Arrays;

/**
 * How an optimiser run ended.
 *
 * <p>
 * {@code iterations} is the optimiser's iteration count when the fit converged normally, and
 * {@link ReportedValue#exceededCap(int)} when it stopped at its cap. A fit that ends because its
 * tolerance can no longer be met reports the number of model evaluations instead, since the
 * optimiser gives no iteration count in that case; it is an upper bound on the iterations run.
 *
 * @param converged  true if the fit ended on its tolerance rather than its cap
 * @param iterations iteration count, evaluation count or exceeded cap, as above
 * @param residuals  {@code y_i - f(x_i)} at the final parameters, in spectrum order
 * @param cost       sum of squared residuals at the final parameters
 */
public record FitOutcome(boolean converged, ReportedValue iterations, double[] residuals, double cost) {

    public FitOutcome {
        if (iterations == null) {
            throw new IllegalArgumentException("iterations must not be null");
        }
        residuals = residuals.clone();
    }

    @Override
    public double[] residuals() {
        return residuals.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FitOutcome)) {
            return false;
        }
        FitOutcome other = (FitOutcome) o;
        return converged == other.converged
                && iterations.equals(other.iterations)
                && Arrays.equals(residuals, other.residuals)
                && Double.compare(cost, other.cost) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Boolean.hashCode(converged) + iterations.hashCode()) + Arrays.hashCode(residuals);
    }
}
