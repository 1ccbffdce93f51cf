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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.image.Histogram;
import smeargle.utils.ArrayUtil;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Starting point of the Gaussian fit of a histogram.
 * <ol>
 *     <li>Bins whose count is lower than the coefficient of variation of all counts are discarded as noise (all bins are kept if none remains)</li>
 *     <li>Peaks at least {@link #MIN_PEAK_WIDTHS} samples wide are searched, widths being measured at half prominence. Looser widths are tried when a level yields no estimate</li>
 *     <li>The FWHM estimate is the largest peak width, or the second largest one if the largest exceeds the standard deviation of the kept counts</li>
 *     <li>If no level yields an estimate, the FWHM of a unit standard deviation is used and {@link #isPeakFound()} returns false</li>
 *     <li>Mean and amplitude are the bin center and count of the highest detected peak, or of the highest kept bin</li>
 * </ol>
 * Estimation never fails on a non-empty histogram.
 * @author SMEARGLE developers
 */
public class GaussianInitialGuess {
    public final static Logger logger = LoggerFactory.getLogger(GaussianInitialGuess.class);
    /**
     * 2 sqrt(2 ln 2): ratio between full width at half maximum and standard deviation
     */
    public final static double FWHM_TO_SIGMA = 2 * Math.sqrt(2 * Math.log(2));
    public final static double DEFAULT_FWHM = FWHM_TO_SIGMA;
    public final static double[] MIN_PEAK_WIDTHS = new double[]{5, 2, 1};
    public final static double FWHM_REL_HEIGHT = 0.5;

    private final double mean, stddev, amplitude, fwhm;
    private final boolean peakFound;

    public GaussianInitialGuess(double mean, double stddev, double amplitude) {
        this(mean, stddev, amplitude, stddev * FWHM_TO_SIGMA, true);
    }

    private GaussianInitialGuess(double mean, double stddev, double amplitude, double fwhm, boolean peakFound) {
        this.mean = mean;
        this.stddev = stddev;
        this.amplitude = amplitude;
        this.fwhm = fwhm;
        this.peakFound = peakFound;
    }

    public static GaussianInitialGuess estimate(Histogram histogram) {
        double[] centers = histogram.getBinCenters();
        double[] counts = histogram.getCounts();
        int[] kept = getNonNoiseBins(counts);
        double[] x = ArrayUtil.select(centers, kept);
        double[] y = ArrayUtil.select(counts, kept);
        double countStd = ArrayUtil.getMeanAndSigma(y)[1];

        Double fwhm = null;
        List<PeakFinder.Peak> peaks = null;
        for (int level = 0; level<MIN_PEAK_WIDTHS.length; ++level) {
            boolean last = level == MIN_PEAK_WIDTHS.length - 1;
            if (last) logger.warn("Peaks at least {} bins wide cannot be found, relying on {}-bin wide peaks for estimates: estimates may be very off", MIN_PEAK_WIDTHS[level-1], MIN_PEAK_WIDTHS[level]);
            peaks = PeakFinder.findPeaks(y, MIN_PEAK_WIDTHS[level], last ? 1 : FWHM_REL_HEIGHT);
            fwhm = extractFWHM(PeakFinder.getWidths(y, peaks, FWHM_REL_HEIGHT), countStd);
            logger.debug("initial guess: min width={} -> {} peaks, fwhm estimate: {}", MIN_PEAK_WIDTHS[level], peaks.size(), fwhm);
            if (fwhm!=null) break;
        }
        boolean peakFound = fwhm!=null;
        if (!peakFound) {
            logger.warn("No peak found in histogram ({}): the profile seems flat, a unit standard deviation is used as initial guess", histogram);
            fwhm = DEFAULT_FWHM;
        }
        double stddev = fwhm / FWHM_TO_SIGMA * histogram.getBinSize();
        int peakIdx;
        if (peaks!=null && !peaks.isEmpty()) peakIdx = peaks.stream().mapToInt(p -> p.index).boxed().max((i1, i2) -> Double.compare(y[i1], y[i2])).get();
        else peakIdx = ArrayUtil.max(y);
        GaussianInitialGuess res = new GaussianInitialGuess(x[peakIdx], stddev, y[peakIdx], fwhm, peakFound);
        logger.debug("initial guess: {}", res);
        return res;
    }

    /**
     *
     * @param counts
     * @return indices of bins whose count is at least the coefficient of variation of {@param counts}, all indices if there are none
     */
    public static int[] getNonNoiseBins(double[] counts) {
        double[] meanAndStd = ArrayUtil.getMeanAndSigma(counts);
        double variation = meanAndStd[1] / meanAndStd[0];
        int[] kept = IntStream.range(0, counts.length).filter(i -> counts[i] >= variation).toArray();
        if (kept.length == 0) {
            logger.debug("no bin count above variation: {}, all bins are kept", variation);
            return IntStream.range(0, counts.length).toArray();
        }
        return kept;
    }

    /**
     *
     * @param widths peak widths
     * @param countStd standard deviation of counts
     * @return the largest width, or the second largest if the largest one exceeds {@param countStd}. null if no estimate can be made
     */
    static Double extractFWHM(double[] widths, double countStd) {
        if (widths.length==0) return null;
        double[] sorted = ArrayUtil.sortedCopy(widths);
        double max = sorted[sorted.length-1];
        if (max > countStd) {
            if (sorted.length < 2) return null;
            return sorted[sorted.length-2];
        }
        return max;
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

    public double getFWHM() {
        return fwhm;
    }

    public boolean isPeakFound() {
        return peakFound;
    }

    @Override
    public String toString() {
        return "InitialGuess{mean="+mean+", stddev="+stddev+", amplitude="+amplitude+", fwhm="+fwhm+(peakFound?"":", no peak found")+"}";
    }
}
