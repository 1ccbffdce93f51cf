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

import java.util.ArrayList;
import java.util.List;

/**
 * Peak detection on a 1D signal.
 * <ul>
 *     <li>Peaks are local maxima; a flat maximum (plateau) is reported at its middle sample (rounded down)</li>
 *     <li>The prominence of a peak is its height above the highest of its two bases. A base is the lowest sample reached before the signal rises above the peak or ends</li>
 *     <li>The width of a peak is measured at {@code peak - relHeight * prominence}, with linear interpolation between samples and within its bases</li>
 * </ul>
 * @author SMEARGLE developers
 */
public class PeakFinder {

    /**
     * Peak location with its prominence bases and width
     */
    public static class Peak {
        public final int index;
        public final double prominence;
        public final int leftBase, rightBase;
        public final double width, widthHeight, leftPosition, rightPosition;

        public Peak(int index, double prominence, int leftBase, int rightBase, double width, double widthHeight, double leftPosition, double rightPosition) {
            this.index = index;
            this.prominence = prominence;
            this.leftBase = leftBase;
            this.rightBase = rightBase;
            this.width = width;
            this.widthHeight = widthHeight;
            this.leftPosition = leftPosition;
            this.rightPosition = rightPosition;
        }

        @Override
        public String toString() {
            return "Peak{idx="+index+", prominence="+prominence+", width="+width+"}";
        }
    }

    /**
     *
     * @param x signal
     * @return indices of local maxima, in increasing order. First and last samples are never peaks
     */
    public static int[] localMaxima(double[] x) {
        List<Integer> res = new ArrayList<>();
        int i = 1;
        int iMax = x.length - 1;
        while (i < iMax) {
            if (x[i-1] < x[i]) {
                int iAhead = i + 1;
                while (iAhead < iMax && x[iAhead] == x[i]) ++iAhead;
                if (x[iAhead] < x[i]) {
                    res.add((i + iAhead - 1) / 2);
                    i = iAhead;
                }
            }
            ++i;
        }
        return res.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     *
     * @param x signal
     * @param peak index of a local maximum
     * @param relHeight relative height at which width is measured: 0.5 for full width at half maximum, 1 for width at the higher base
     * @return peak description
     */
    public static Peak describePeak(double[] x, int peak, double relHeight) {
        // prominence
        int leftBase = peak;
        double leftMin = x[peak];
        int i = peak;
        while (i >= 0 && x[i] <= x[peak]) {
            if (x[i] < leftMin) {
                leftMin = x[i];
                leftBase = i;
            }
            --i;
        }
        int rightBase = peak;
        double rightMin = x[peak];
        i = peak;
        while (i < x.length && x[i] <= x[peak]) {
            if (x[i] < rightMin) {
                rightMin = x[i];
                rightBase = i;
            }
            ++i;
        }
        double prominence = x[peak] - Math.max(leftMin, rightMin);
        // width
        double height = x[peak] - prominence * relHeight;
        i = peak;
        while (leftBase < i && height < x[i]) --i;
        double leftPosition = i;
        if (x[i] < height) leftPosition += (height - x[i]) / (x[i+1] - x[i]);
        i = peak;
        while (i < rightBase && height < x[i]) ++i;
        double rightPosition = i;
        if (x[i] < height) rightPosition -= (height - x[i]) / (x[i-1] - x[i]);
        return new Peak(peak, prominence, leftBase, rightBase, rightPosition - leftPosition, height, leftPosition, rightPosition);
    }

    /**
     *
     * @param x signal
     * @param minWidth minimal width (included), measured at {@param selectionRelHeight}
     * @param selectionRelHeight relative height at which widths are measured for selection
     * @return peaks of {@param x} whose width is at least {@param minWidth}
     */
    public static List<Peak> findPeaks(double[] x, double minWidth, double selectionRelHeight) {
        List<Peak> res = new ArrayList<>();
        for (int p : localMaxima(x)) {
            Peak peak = describePeak(x, p, selectionRelHeight);
            if (peak.width >= minWidth) res.add(peak);
        }
        return res;
    }

    /**
     *
     * @param x signal
     * @param peaks peaks of {@param x}
     * @param relHeight
     * @return width of each peak measured at {@param relHeight}
     */
    public static double[] getWidths(double[] x, List<Peak> peaks, double relHeight) {
        return peaks.stream().mapToDouble(p -> describePeak(x, p.index, relHeight).width).toArray();
    }
}
