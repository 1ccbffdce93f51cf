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

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.function.Gaussian;
import org.json.simple.JSONObject;

/**
 * Fitted Gaussian {@code amplitude * exp(-(x - mean)^2 / (2 stddev^2))}.
 * {@link #getMax()} is the maximum of the fitted curve evaluated over an oversampled range of the histogram, which may differ from the amplitude.
 * @author SMEARGLE developers
 */
public class GaussianFitResult implements UnivariateFunction {
    private final double mean, stddev, amplitude, max;
    private final Gaussian evaluator;
    private final GaussianInitialGuess initialGuess;
    private final boolean converged;

    public GaussianFitResult(double amplitude, double mean, double stddev, double max, GaussianInitialGuess initialGuess, boolean converged) {
        this.mean = mean;
        this.stddev = Math.abs(stddev);
        this.amplitude = amplitude;
        this.max = max;
        this.evaluator = new Gaussian(amplitude, mean, this.stddev);
        this.initialGuess = initialGuess;
        this.converged = converged;
    }

    public double getMean() {
        return mean;
    }

    public double getStddev() {
        return stddev;
    }

    public double getAmplitude() {
        return amplitude;
    }

    public double getMax() {
        return max;
    }

    public UnivariateFunction getEvaluator() {
        return evaluator;
    }

    @Override
    public double value(double x) {
        return evaluator.value(x);
    }

    public GaussianInitialGuess getInitialGuess() {
        return initialGuess;
    }

    /**
     *
     * @return false if no histogram peak could be detected to build the initial guess
     */
    public boolean isPeakFound() {
        return initialGuess.isPeakFound();
    }

    public boolean isConverged() {
        return converged;
    }

    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("mean", mean);
        res.put("stddev", stddev);
        res.put("amplitude", amplitude);
        res.put("max", max);
        return res;
    }

    @Override
    public String toString() {
        return "GaussianFit{mean="+mean+", stddev="+stddev+", amplitude="+amplitude+", max="+max+(converged?"":", not converged")+"}";
    }
}
