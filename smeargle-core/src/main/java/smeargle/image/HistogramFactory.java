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
package smeargle.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.core.ConfigurationException;
import smeargle.core.DataShapeException;

import java.util.Arrays;
import java.util.stream.DoubleStream;

/**
 * Fixed bin width histograms.
 * @author SMEARGLE developers
 */
public class HistogramFactory {
    public final static Logger logger = LoggerFactory.getLogger(HistogramFactory.class);

    /**
     * Edges start at {@param min} every {@param binSize}, the last edge being {@param max}. When (max-min) is not a multiple of binSize the last bin is narrower.
     * @param min
     * @param max
     * @param binSize
     * @return bin edges
     */
    public static double[] getBinEdges(double min, double max, double binSize) {
        if (!(binSize>0) || Double.isInfinite(binSize)) throw new ConfigurationException("Bin width must be a positive finite number, got: "+binSize);
        if (!Double.isFinite(min) || !Double.isFinite(max)) throw new DataShapeException("Histogram range must be finite: ["+min+"; "+max+"]");
        long n = (long)Math.ceil((max - min) / binSize);
        if (n<0) n = 0;
        if (n>Integer.MAX_VALUE-1) throw new ConfigurationException("Bin width "+binSize+" is too small for range ["+min+"; "+max+"]");
        double[] edges = new double[(int)n+1];
        int count = 0;
        for (int i = 0; i<n; ++i) {
            double e = min + i * binSize;
            if (e>=max) break; // rounding
            edges[count++] = e;
        }
        edges[count++] = max;
        return count==edges.length ? edges : Arrays.copyOf(edges, count);
    }

    /**
     *
     * @param values non-finite values are ignored
     * @param binSize width of bins
     * @return histogram from min to max of {@param values}
     */
    public static Histogram getHistogram(double[] values, double binSize) {
        if (!(binSize>0)) throw new ConfigurationException("Bin width must be a positive number, got: "+binSize);
        values = Arrays.stream(values).filter(Double::isFinite).toArray();
        if (values.length==0) throw new DataShapeException("Cannot compute histogram of empty data");
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v<min) min = v;
            if (v>max) max = v;
        }
        double[] edges = getBinEdges(min, max, binSize);
        if (edges.length<2) throw new DataShapeException("Histogram needs at least two distinct bin edges; data is constant: "+min);
        long[] data = new long[edges.length-1];
        Histogram res = new Histogram(data, edges, binSize);
        for (double v : values) ++data[res.getIdxFromValue(v)];
        logger.debug("histogram: {} from {} values", res, values.length);
        return res;
    }

    public static Histogram getHistogram(DoubleStream values, double binSize) {
        return getHistogram(values.toArray(), binSize);
    }

    /**
     *
     * @param image
     * @param binSize
     * @return histogram of non-masked finite values of {@param image}
     */
    public static Histogram getHistogram(Image image, double binSize) {
        return getHistogram(image.streamValid(), binSize);
    }
}
