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
package smeargle.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.core.ConfigurationException;
import smeargle.core.ImprecisionException;
import smeargle.data_structure.SigmaMultiple;
import smeargle.image.Image;
import smeargle.image.ImageByte;
import smeargle.processing.gaussian_fit.GaussianFitResult;
import smeargle.processing.gaussian_fit.HistogramGaussianFit;
import smeargle.utils.ArrayUtil;
import smeargle.utils.RobustStatistics;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.function.DoublePredicate;

/**
 * Filters computed from pixel values. Each filter returns a new mask with the shape of the input image, a pixel inside the mask being rejected.
 * Pixels of the mask carried by the input image stay rejected. Input images are never modified.
 * @author SMEARGLE developers
 */
public class ValueFilters {
    public final static Logger logger = LoggerFactory.getLogger(ValueFilters.class);
    /**
     * Resolution of double precision arithmetic used to convert percentages to pixel counts
     */
    public final static double MACHINE_RESOLUTION = 1e-15;
    /**
     * Orders of magnitude below resolution limit where imprecision warnings start
     */
    public final static double IMPRECISION_WARNING_MARGIN = 5;

    private static ImageByte checkEmpty(ImageByte mask) {
        if (mask.count()==0) logger.info("{} rejects no pixel; check its configuration", mask.getName());
        return mask;
    }

    protected static ImageByte filter(Image data, String name, DoublePredicate reject) {
        ImageByte res = new ImageByte(name, data);
        for (int z = 0; z<data.sizeZ(); ++z) {
            for (int xy = 0; xy<data.sizeXY(); ++xy) {
                if (data.isMasked(xy, z) || reject.test(data.getPixel(xy, z))) res.setInsideMask(xy, z, true);
            }
        }
        return res;
    }

    /**
     *
     * @param data
     * @param minimumValue
     * @return mask of pixels strictly lower than {@param minimumValue}
     */
    public static ImageByte filterMinimumValue(Image data, double minimumValue) {
        return checkEmpty(filter(data, "filter_minimum_value", v -> v < minimumValue));
    }

    /**
     *
     * @param data
     * @param maximumValue
     * @return mask of pixels strictly greater than {@param maximumValue}
     */
    public static ImageByte filterMaximumValue(Image data, double maximumValue) {
        return checkEmpty(filter(data, "filter_maximum_value", v -> v > maximumValue));
    }

    /**
     *
     * @param data
     * @param exactValue
     * @param tolerance absolute tolerance, see {@link smeargle.configuration.RuntimeConfiguration#getFloatEqualityTolerance()}
     * @return mask of pixels within {@param tolerance} of {@param exactValue}
     */
    public static ImageByte filterExactValue(Image data, double exactValue, double tolerance) {
        if (!(tolerance>=0)) throw new ConfigurationException("Float equality tolerance must be positive, got: "+tolerance);
        if (Double.isInfinite(exactValue)) return checkEmpty(filter(data, "filter_exact_value", v -> v == exactValue));
        return checkEmpty(filter(data, "filter_exact_value", v -> Math.abs(v - exactValue) <= tolerance));
    }

    /**
     *
     * @param data
     * @return mask of NaN and infinite pixels
     */
    public static ImageByte filterInvalidValue(Image data) {
        return checkEmpty(filter(data, "filter_invalid_value", v -> !Double.isFinite(v)));
    }

    /**
     * Rejects pixels outside [mean - low * stddev ; mean + high * stddev], mean and stddev being robust estimates over valid pixels
     * @param data
     * @param sigmaMultiple
     * @return mask
     */
    public static ImageByte filterSigmaValue(Image data, SigmaMultiple sigmaMultiple) {
        double[] meanAndStd = RobustStatistics.getRobustMeanAndStd(data);
        logger.debug("sigma filter: robust mean={} std={} multiple={}", meanAndStd[0], meanAndStd[1], sigmaMultiple);
        return checkEmpty(filterOutsideRange(data, meanAndStd[0], meanAndStd[1], sigmaMultiple, "filter_sigma_value"));
    }

    /**
     *
     * @param data
     * @param sigmaMultiple one value (symmetric) or two values (low, high)
     * @return mask
     */
    public static ImageByte filterSigmaValue(Image data, double... sigmaMultiple) {
        return filterSigmaValue(data, SigmaMultiple.of(sigmaMultiple));
    }

    /**
     * Same as {@link #filterSigmaValue(Image, SigmaMultiple)}, with mean and stddev taken from a Gaussian fit of the value histogram
     * @param data
     * @param sigmaMultiple
     * @param binWidth width of histogram bins
     * @return mask
     */
    public static ImageByte filterGaussianTruncation(Image data, SigmaMultiple sigmaMultiple, double binWidth) {
        GaussianFitResult fit = HistogramGaussianFit.fit(data, binWidth);
        double stddev = Math.abs(fit.getStddev());
        logger.debug("gaussian truncation: fitted mean={} std={} multiple={}", fit.getMean(), stddev, sigmaMultiple);
        return checkEmpty(filterOutsideRange(data, fit.getMean(), stddev, sigmaMultiple, "filter_gaussian_truncation"));
    }

    private static ImageByte filterOutsideRange(Image data, double mean, double stddev, SigmaMultiple sigmaMultiple, String name) {
        double[] range = sigmaMultiple.getRange(mean, stddev);
        ImageByte min = filter(data, "lower_bound", v -> v < range[0]);
        ImageByte max = filter(data, "upper_bound", v -> v > range[1]);
        return MaskSynthesis.synthesize(min, max).setName(name);
    }

    /**
     * Rejects the {@param topCount} highest and {@param bottomCount} lowest valid pixels. Pixels equal to the cut values are kept.
     * @param data
     * @param topCount 0 for no truncation of high values
     * @param bottomCount 0 for no truncation of low values
     * @return mask
     */
    public static ImageByte filterPixelTruncation(Image data, int topCount, int bottomCount) {
        return checkEmpty(pixelTruncation(data, topCount, bottomCount, "filter_pixel_truncation"));
    }

    private static ImageByte pixelTruncation(Image data, int topCount, int bottomCount, String name) {
        if (topCount<0 || bottomCount<0) throw new ConfigurationException("Pixel counts must be positive, got top="+topCount+" bottom="+bottomCount);
        double[] sorted = ArrayUtil.sortedCopy(data.streamValid().toArray());
        int n = sorted.length;
        if ((long)topCount + bottomCount >= n && (topCount>0 || bottomCount>0)) throw new ConfigurationException("Cannot truncate "+topCount+" top and "+bottomCount+" bottom pixels out of "+n+" valid pixels");
        double upperValue = topCount>0 ? sorted[n - topCount - 1] : Double.POSITIVE_INFINITY;
        double bottomValue = bottomCount>0 ? sorted[bottomCount] : Double.NEGATIVE_INFINITY;
        logger.debug("pixel truncation: top={} bottom={} -> value range [{}; {}]", topCount, bottomCount, bottomValue, upperValue);
        // invalid values are left to the invalid value filter
        return filter(data, name, v -> v > upperValue || v < bottomValue);
    }

    /**
     * Pixel truncation with counts computed in decimal arithmetic: top = n - floor(n (1 - topPercent)), bottom = floor(n bottomPercent)
     * @param data
     * @param topPercent fraction in [0; 1]
     * @param bottomPercent fraction in [0; 1]
     * @return mask
     * @throws ImprecisionException if the number of pixels exceeds the resolution of double arithmetic
     */
    public static ImageByte filterPercentTruncation(Image data, double topPercent, double bottomPercent) {
        if (!(topPercent>=0 && topPercent<=1) || !(bottomPercent>=0 && bottomPercent<=1)) throw new ConfigurationException("Percentages must be within [0; 1], got top="+topPercent+" bottom="+bottomPercent);
        long n = data.streamValid().count();
        checkPrecision(n);
        int[] counts = getTruncationCounts(n, topPercent, bottomPercent);
        return checkEmpty(pixelTruncation(data, counts[0], counts[1], "filter_percent_truncation"));
    }

    /**
     *
     * @param n number of pixels
     * @param topPercent
     * @param bottomPercent
     * @return number of top and bottom pixels to truncate
     */
    public static int[] getTruncationCounts(long n, double topPercent, double bottomPercent) {
        BigDecimal total = BigDecimal.valueOf(n);
        BigDecimal kept = total.multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(topPercent))).setScale(0, RoundingMode.FLOOR);
        int top = total.subtract(kept).intValueExact();
        int bottom = total.multiply(BigDecimal.valueOf(bottomPercent)).setScale(0, RoundingMode.FLOOR).intValueExact();
        return new int[]{top, bottom};
    }

    /**
     *
     * @param n number of pixels
     * @throws ImprecisionException if log10(n) exceeds -log10(resolution)
     */
    public static void checkPrecision(long n) {
        if (n<=0) return;
        double log = Math.log10(n);
        double limit = -Math.log10(MACHINE_RESOLUTION);
        if (log > limit) throw new ImprecisionException("Current number of pixels ("+n+") exceeds the resolution of float multiplication; percent truncation would be inaccurate");
        else if (log > limit - IMPRECISION_WARNING_MARGIN) logger.warn("Float multiplication is used to calculate truncations: the number of pixels ({}) approaches the machine resolution for multiplication", n);
    }
}
