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
package smeargle.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.core.DataShapeException;
import smeargle.image.Image;

import java.util.Arrays;

/**
 * Mean and standard deviation computed only over values strictly inside the interquartile fences
 * [Q1 - 1.5 IQR ; Q3 + 1.5 IQR]. Quartile indices are {@code round((n+1)/4)} and {@code round(3(n+1)/4)} with half-to-even rounding, clamped to [0; n-1].
 * @author SMEARGLE developers
 */
public class RobustStatistics {
    public final static Logger logger = LoggerFactory.getLogger(RobustStatistics.class);
    public final static double FENCE_FACTOR = 1.5;

    public static double robustMean(double[] values) {
        return getRobustMeanAndStd(values)[0];
    }

    public static double robustStd(double[] values) {
        return getRobustMeanAndStd(values)[1];
    }

    /**
     * Masked pixels and non-finite values are excluded
     * @param image
     * @return robust mean
     */
    public static double robustMean(Image image) {
        return robustMean(image.streamValid().toArray());
    }

    public static double robustStd(Image image) {
        return robustStd(image.streamValid().toArray());
    }

    public static double[] getRobustMeanAndStd(Image image) {
        return getRobustMeanAndStd(image.streamValid().toArray());
    }

    /**
     *
     * @param values
     * @return mean and population standard deviation of fenced values
     */
    public static double[] getRobustMeanAndStd(double[] values) {
        return ArrayUtil.getMeanAndSigma(getFencedValues(values));
    }

    /**
     *
     * @param values
     * @return sorted values strictly inside the interquartile fences
     * @throws DataShapeException if {@param values} is empty or no value lies inside the fences
     */
    public static double[] getFencedValues(double[] values) {
        if (values.length==0) throw new DataShapeException("Cannot compute robust statistics of an empty array");
        double[] y = ArrayUtil.sortedCopy(values);
        int n = y.length;
        int q1 = clamp((long)Math.rint((n + 1) / 4d), n);
        int q3 = clamp((long)Math.rint((n + 1) * 3 / 4d), n);
        double iqr = y[q3] - y[q1];
        double lowFence = y[q1] - FENCE_FACTOR * iqr;
        double highFence = y[q3] + FENCE_FACTOR * iqr;
        double[] res = Arrays.stream(y).filter(v -> v>lowFence && v<highFence).toArray();
        logger.trace("robust statistics: n={} q1={} q3={} fences=[{}; {}] kept={}", n, y[q1], y[q3], lowFence, highFence, res.length);
        if (res.length==0) throw new DataShapeException("No value lies strictly inside the interquartile fences ["+lowFence+"; "+highFence+"]");
        return res;
    }

    private static int clamp(long idx, int n) {
        if (idx<0) return 0;
        if (idx>=n) return n-1;
        return (int)idx;
    }
}
