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

import org.apache.commons.math3.analysis.function.Gaussian;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.image.Histogram;
import smeargle.image.HistogramFactory;
import smeargle.image.Image;
import smeargle.utils.ArrayUtil;

import java.util.function.Predicate;

/**
 * Fit of a Gaussian to the fixed bin width histogram of pixel values. Masked pixels and non-finite values are ignored.
 * The noise cut of {@link GaussianInitialGuess} only affects the starting point: the fit runs over every bin of the histogram.
 * @author SMEARGLE developers
 */
public class HistogramGaussianFit {
    public final static Logger logger = LoggerFactory.getLogger(HistogramGaussianFit.class);
    public final static int OVERSAMPLING = 100;
    // amplitude, mean, sigma
    final static Predicate<double[]> VALID_PARAMETERS = a -> a[2] > 0 && Double.isFinite(a[0]) && Double.isFinite(a[1]) && Double.isFinite(a[2]);

    public static Histogram getHistogram(Image image, double binWidth) {
        return HistogramFactory.getHistogram(image, binWidth);
    }

    public static GaussianFitResult fit(Image image, double binWidth) {
        return fit(getHistogram(image, binWidth));
    }

    public static GaussianFitResult fit(double[] values, double binWidth) {
        return fit(HistogramFactory.getHistogram(values, binWidth));
    }

    public static GaussianFitResult fit(Histogram histogram) {
        return fit(histogram, new LevenbergMarquardtSolver());
    }

    public static GaussianFitResult fit(Histogram histogram, LevenbergMarquardtSolver solver) {
        GaussianInitialGuess guess = GaussianInitialGuess.estimate(histogram);
        double[] x = histogram.getBinCenters();
        double[] y = histogram.getCounts();
        double sigma = guess.getStddev() > 0 ? guess.getStddev() : histogram.getBinSize();
        double[] init = new double[]{guess.getAmplitude(), guess.getMean(), sigma};
        LevenbergMarquardtSolver.Solution solution = solver.solve(x, y, init, new Gaussian.Parametric(), VALID_PARAMETERS);
        if (!solution.converged) logger.warn("Gaussian fit of {} did not converge after {} iterations; returning last parameters", histogram, solution.iterations);
        double[] a = solution.parameters;
        double max = getMaxValue(new Gaussian(a[0], a[1], a[2]), x);
        GaussianFitResult res = new GaussianFitResult(a[0], a[1], a[2], max, guess, solution.converged);
        logger.debug("{} -> {} ({} iterations)", guess, res, solution.iterations);
        return res;
    }

    /**
     *
     * @param f
     * @param x
     * @return maximum of {@param f} over OVERSAMPLING * x.length evenly spaced points from min(x)-1 to max(x)+1
     */
    static double getMaxValue(Gaussian f, double[] x) {
        double min = x[ArrayUtil.min(x)];
        double max = x[ArrayUtil.max(x)];
        double res = Double.NEGATIVE_INFINITY;
        for (double v : ArrayUtil.linspace(min - 1, max + 1, OVERSAMPLING * x.length)) {
            double fv = f.value(v);
            if (fv > res) res = fv;
        }
        return res;
    }
}
