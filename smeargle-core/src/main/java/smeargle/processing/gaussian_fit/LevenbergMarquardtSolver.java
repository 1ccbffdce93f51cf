/* 
 * Copyright (C) 2026 the SMEARGLE developers
 *
 * This File is part of SMEARGLE
 *
 * SMEARGLE is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SMEARGLE is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SMEARGLE.  If not, see <http://www.gnu.org/licenses/>.
 */
package smeargle.processing.gaussian_fit;

import Jama.Matrix;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.function.Predicate;

/**
 * Least-square curve fitting with the Levenberg-Marquardt algorithm.
 * Minimizes E = sum {(y[k] - f(x[k], a))^2}. The function implements the value and gradient of f(x, a), NOT the value and gradient of E with respect to a.
 * @author SMEARGLE developers
 */
public class LevenbergMarquardtSolver {
    public static final Logger logger = LoggerFactory.getLogger(LevenbergMarquardtSolver.class);
    private final int maxIteration;
    private final double lambda;
    private final double termEpsilon;

    /**
     * Creates a new Levenberg-Marquardt solver for least-square curve fitting problems.
     * @param maxIteration stop and return after this many iterations if not done
     * @param lambda blend between steepest descent (lambda high) and
     *	jump to bottom of quadratic (lambda zero). Start with 0.001.
     * @param termEpsilon termination accuracy, relative to the sum-squared-error
     */
    public LevenbergMarquardtSolver(int maxIteration, double lambda, double termEpsilon) {
        this.maxIteration = maxIteration;
        this.lambda = lambda;
        this.termEpsilon = termEpsilon;
    }

    /**
     * Creates a new Levenberg-Marquardt solver for least-square curve fitting problems,
     * with default parameters set to:
     * <ul>
     * 	<li> <code>maxIter = 1000</code>
     * 	<li> <code>lambda  = 1e-3</code>
     * 	<li> <code>epsilon = 1e-10</code>
     * </ul>
     */
    public LevenbergMarquardtSolver() {
        this(1000, 1e-3, 1e-10);
    }

    @Override
    public String toString() {
        return "Levenberg-Marquardt least-square curve fitting algorithm";
    }

    public static class Solution {
        public final double[] parameters;
        public final int iterations;
        public final boolean converged;
        public final double chiSquared;
        Solution(double[] parameters, int iterations, boolean converged, double chiSquared) {
            this.parameters = parameters;
            this.iterations = iterations;
            this.converged = converged;
            this.chiSquared = chiSquared;
        }
    }

    public Solution solve(double[] x, double[] y, double[] initialParameters, ParametricUnivariateFunction f) {
        return solve(x, y, initialParameters, f, a -> true);
    }

    /**
     * Calculate the current sum-squared-error
     */
    public static double chiSquared(final double[] x, final double[] a, final double[] y, final ParametricUnivariateFunction f)  {
        double sum = 0.;
        for( int i = 0; i < y.length; i++ ) {
            double d = y[i] - f.value(x[i], a);
            sum = sum + (d*d);
        }
        return sum;
    }

    /**
     *
     * @param x domain points
     * @param y corresponding values
     * @param initialParameters starting point, not modified
     * @param f model
     * @param isValid parameter sets outside the model domain are never evaluated: steps towards them are rejected
     * @return last accepted parameters. When the iteration limit is reached before convergence, {@link Solution#converged} is false
     */
    public Solution solve(double[] x, double[] y, double[] initialParameters, ParametricUnivariateFunction f, Predicate<double[]> isValid) {
        int nparm = initialParameters.length;
        double[] a = Arrays.copyOf(initialParameters, nparm);
        double lambda = this.lambda;
        double e0 = chiSquared(x, a, y, f);
        boolean done = false;
        boolean converged = false;

        // g = gradient, JtJ = jacobian, d = step to minimum
        // JtJ d = -g, solve for d
        double[][] JtJ = new double[nparm][nparm];
        double[] g = new double[nparm];
        int iter = 0;
        int term = 0;	// termination count test

        do {
            ++iter;

            // hessian approximation
            for( int r = 0; r < nparm; r++ ) {
                g[r] = 0.;
                for( int c = 0; c < nparm; c++ ) JtJ[r][c] = 0.;
            }
            for( int i = 0; i < y.length; i++ ) {
                double[] gradValues = f.gradient(x[i], a);
                double residual = y[i] - f.value(x[i], a);
                for( int r = 0; r < nparm; r++ ) {
                    g[r] += residual * gradValues[r];
                    for (int c = 0; c < nparm; c++) JtJ[r][c] += gradValues[r] * gradValues[c];
                }
            }

            // boost diagonal towards gradient descent
            for( int r = 0; r < nparm; r++ ) JtJ[r][r] *= (1. + lambda);

            double[] d;
            try {
                d = (new Matrix(JtJ)).lu().solve(new Matrix(g, nparm)).getRowPackedCopy();
            } catch (RuntimeException re) {
                // Matrix is singular
                logger.trace("singular matrix at iteration {}", iter);
                lambda *= 10.;
                if (iter >= maxIteration) done = true;
                continue;
            }
            double[] na = new double[nparm]; // next parameters
            for (int i = 0; i<nparm; ++i) na[i] = a[i] + d[i];
            boolean valid = isValid.test(na);
            double e1 = valid ? chiSquared(x, na, y, f) : Double.NaN;

            // termination test (slightly different than NR)
            if (!valid || Double.isNaN(e1) || Math.abs(e1-e0) > termEpsilon * Math.max(1, e0)) term = 0;
            else {
                term++;
                if (term == 4) {
                    done = true;
                    converged = true;
                }
            }
            if (iter >= maxIteration) done = true;

            if (!valid || Double.isNaN(e1) || e1 > e0) { // new location worse than before
                lambda *= 10.;
            }
            else {		// new location better, accept new parameters
                lambda *= 0.1;
                e0 = e1;
                a = na;
            }
        } while(!done);
        if (!converged) logger.debug("no convergence after {} iterations, chi2={}", iter, e0);
        return new Solution(a, iter, converged, e0);
    }
}
