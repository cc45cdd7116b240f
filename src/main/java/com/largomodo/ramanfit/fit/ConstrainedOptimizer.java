package com.largomodo.ramanfit.fit;

import com.largomodo.ramanfit.core.domain.FitModel;
import com.largomodo.ramanfit.core.domain.FitOutcome;
import com.largomodo.ramanfit.core.domain.LinearBackground;
import com.largomodo.ramanfit.core.domain.PeakComponent;
import com.largomodo.ramanfit.core.domain.ReportedValue;
import com.largomodo.ramanfit.core.domain.Spectrum;
import com.largomodo.ramanfit.core.domain.SpectrumPoint;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Levenberg-Marquardt fit of background plus peaks, with bounds enforced by reparameterisation.
 * <p>
 * The optimiser works on an unconstrained vector
 * {@code [intercept, slope, (amplitude, location, width) per peak]}. Amplitudes enter the model
 * as {@code |z|}; locations and widths pass through their {@link BoundedParameter}, so every
 * candidate the solver tries is physical. The Jacobian is taken by central differences.
 * <p>
 * The fit stops when the relative cost reduction drops below the seed's tolerance. If the
 * iteration cap is reached first the lowest-cost parameters evaluated so far are returned and the
 * iteration count is reported as exceeded; that is a normal outcome, not an error. If the
 * tolerance becomes unreachable the best point is kept and the model evaluation count stands in
 * for the iteration count (see {@link FitOutcome}).
 * <p>
 * Instances are stateless and may be shared.
 */
public class ConstrainedOptimizer implements PeakFitter {

    private static final Logger log = LoggerFactory.getLogger(ConstrainedOptimizer.class);

    private static final double DIFFERENCE_STEP = 1e-6;

    @Override
    public FitModel fit(Spectrum spectrum, ModelSeed seed) {
        int n = spectrum.size();
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            SpectrumPoint p = spectrum.points().get(i);
            x[i] = p.wavenumber();
            y[i] = p.intensity();
        }

        BestPoint best = new BestPoint(seed.startVector());
        MultivariateJacobianFunction model = point -> {
            double[] params = point.toArray();
            double[] values = evaluate(seed, params, x);
            best.offer(params, cost(values, y));
            return new Pair<>(new ArrayRealVector(values, false), jacobian(seed, params, x));
        };

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(seed.startVector())
                .model(model)
                .target(y)
                .maxEvaluations(Integer.MAX_VALUE)
                .maxIterations(seed.maxIterations())
                .build();

        LevenbergMarquardtOptimizer optimizer = new LevenbergMarquardtOptimizer()
                .withCostRelativeTolerance(seed.tolerance());

        double[] result;
        boolean converged;
        ReportedValue iterations;
        try {
            LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
            result = optimum.getPoint().toArray();
            converged = true;
            iterations = ReportedValue.of(optimum.getIterations());
        } catch (MaxCountExceededException e) {
            log.debug("{} fit reached {} iterations without converging, keeping best point",
                    seed.family(), seed.maxIterations());
            result = best.params();
            converged = false;
            iterations = ReportedValue.exceededCap(seed.maxIterations());
        } catch (ConvergenceException e) {
            // Tolerance unreachable; evaluation count stands in for iterations
            log.debug("{} fit stopped early: {}", seed.family(), e.getMessage());
            result = best.params();
            converged = true;
            iterations = ReportedValue.of(best.evaluations());
        }

        double[] values = evaluate(seed, result, x);
        double[] residuals = new double[n];
        for (int i = 0; i < n; i++) {
            residuals[i] = y[i] - values[i];
        }
        FitOutcome outcome = new FitOutcome(converged, iterations, residuals, cost(values, y));

        log.debug("{} fit finished after {} iterations, cost = {}",
                seed.family(), iterations.render(), outcome.cost());
        return decode(seed, result, outcome);
    }

    static double[] evaluate(ModelSeed seed, double[] params, double[] x) {
        double[] values = new double[x.length];
        int peaks = seed.peaks().size();
        double[] amplitude = new double[peaks];
        double[] location = new double[peaks];
        double[] width = new double[peaks];
        for (int k = 0; k < peaks; k++) {
            PeakSeed peak = seed.peaks().get(k);
            amplitude[k] = BoundedParameter.amplitude(params[2 + 3 * k]);
            location[k] = peak.locationBound().bound(params[3 + 3 * k]);
            width[k] = peak.widthBound().bound(params[4 + 3 * k]);
        }
        for (int i = 0; i < x.length; i++) {
            double sum = params[0] + params[1] * x[i];
            for (int k = 0; k < peaks; k++) {
                sum += amplitude[k] * seed.family().profile(x[i] - location[k], width[k]);
            }
            values[i] = sum;
        }
        return values;
    }

    private static RealMatrix jacobian(ModelSeed seed, double[] params, double[] x) {
        RealMatrix jacobian = new Array2DRowRealMatrix(x.length, params.length);
        double[] shifted = params.clone();
        for (int j = 0; j < params.length; j++) {
            double h = DIFFERENCE_STEP * FastMath.max(FastMath.abs(params[j]), 1);
            shifted[j] = params[j] + h;
            double[] up = evaluate(seed, shifted, x);
            shifted[j] = params[j] - h;
            double[] down = evaluate(seed, shifted, x);
            shifted[j] = params[j];
            for (int i = 0; i < x.length; i++) {
                jacobian.setEntry(i, j, (up[i] - down[i]) / (2 * h));
            }
        }
        return jacobian;
    }

    private static double cost(double[] values, double[] y) {
        double sum = 0;
        for (int i = 0; i < y.length; i++) {
            double r = y[i] - values[i];
            sum += r * r;
        }
        return sum;
    }

    private static FitModel decode(ModelSeed seed, double[] params, FitOutcome outcome) {
        List<PeakComponent> peaks = new ArrayList<>(seed.peaks().size());
        for (int k = 0; k < seed.peaks().size(); k++) {
            PeakSeed peak = seed.peaks().get(k);
            peaks.add(PeakComponent.of(peak.label(), seed.family(),
                    peak.locationBound().bound(params[3 + 3 * k]),
                    BoundedParameter.amplitude(params[2 + 3 * k]),
                    peak.widthBound().bound(params[4 + 3 * k])));
        }
        return new FitModel(seed.family(), new LinearBackground(params[0], params[1]), peaks, outcome);
    }

    /**
     * Lowest-cost parameter vector the solver has evaluated.
     */
    private static final class BestPoint {

        private double[] params;
        private double cost = Double.POSITIVE_INFINITY;
        private int evaluations;

        BestPoint(double[] start) {
            this.params = start.clone();
        }

        void offer(double[] candidate, double candidateCost) {
            evaluations++;
            if (candidateCost < cost) {
                cost = candidateCost;
                params = candidate.clone();
            }
        }

        int evaluations() {
            return evaluations;
        }

        double[] params() {
            return params.clone();
        }
    }
}
