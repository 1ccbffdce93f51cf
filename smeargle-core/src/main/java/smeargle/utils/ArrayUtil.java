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

import java.util.Arrays;
import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

/**
 *
 * @author SMEARGLE developers
 */
public class ArrayUtil {
    public static DoubleStream stream(float[] array) {
        return IntStream.range(0, array.length).mapToDouble(i -> array[i]);
    }
    public static DoubleStream stream(double[] array) {
        return Arrays.stream(array);
    }
    public static DoubleStream stream(byte[] array) {
        return IntStream.range(0, array.length).mapToDouble(i -> array[i] & 0xff);
    }

    public static int max(double[] array) {
        return max(array, 0, array.length);
    }
    /**
     * 
     * @param array 
     * @param start start of search index, inclusive
     * @param stop end of search index, exclusive
     * @return index of maximum value (first one in case of ties)
     */
    public static int max(double[] array, int start, int stop) {
        if (start<0) start=0;
        if (stop>array.length) stop=array.length;
        if (stop<start) throw new IllegalArgumentException("Stop before start");
        int idxMax = start;
        for (int i = start+1; i<stop; ++i) if (array[i]>array[idxMax]) idxMax=i;
        return idxMax;
    }
    public static int min(double[] array) {
        int idxMin = 0;
        for (int i = 1; i<array.length; ++i) if (array[i]<array[idxMin]) idxMin=i;
        return idxMin;
    }

    /**
     * 
     * @param data
     * @return mean and population standard deviation
     */
    public static double[] getMeanAndSigma(double[] data) {
        double mean = 0;
        for (double d : data) mean += d;
        mean /= data.length;
        double var = 0;
        for (double d : data) var += (d - mean) * (d - mean);
        var /= data.length;
        return new double[]{mean, Math.sqrt(var)};
    }

    /**
     * 
     * @param start
     * @param stop included
     * @param count number of values
     * @return {@param count} evenly spaced values from {@param start} to {@param stop}
     */
    public static double[] linspace(double start, double stop, int count) {
        if (count<=0) return new double[0];
        if (count==1) return new double[]{start};
        double step = (stop - start) / (count - 1);
        double[] res = new double[count];
        for (int i = 0; i<count; ++i) res[i] = start + i * step;
        res[count-1] = stop;
        return res;
    }

    public static double[] select(double[] array, int[] indices) {
        double[] res = new double[indices.length];
        for (int i = 0; i<indices.length; ++i) res[i] = array[indices[i]];
        return res;
    }

    public static double[] sortedCopy(double[] array) {
        double[] res = Arrays.copyOf(array, array.length);
        Arrays.sort(res);
        return res;
    }
}
