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

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import smeargle.core.DataShapeException;
import smeargle.utils.JSONSerializable;
import smeargle.utils.JSONUtils;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Histogram with explicit bin edges. Bin i covers [edges[i], edges[i+1]), the last bin being closed.
 * With fixed-width binning all bins have width {@link #getBinSize()} except possibly the last one, which ends at the maximum value.
 * @author SMEARGLE developers
 */
public class Histogram implements JSONSerializable {

    private long[] data;
    private double[] edges;
    private double binSize;

    public Histogram(long[] data, double[] edges, double binSize) {
        if (edges.length!=data.length+1) throw new DataShapeException("Histogram with "+data.length+" bins needs "+(data.length+1)+" edges, got: "+edges.length);
        this.data = data;
        this.edges = edges;
        this.binSize = binSize;
    }

    public long[] getData() {
        return data;
    }

    public double[] getEdges() {
        return edges;
    }

    public double[] getBinCenters() {
        return IntStream.range(0, data.length).mapToDouble(i -> (edges[i] + edges[i+1]) / 2).toArray();
    }

    public double[] getCounts() {
        return Arrays.stream(data).mapToDouble(l -> l).toArray();
    }

    public double getBinSize() {
        return binSize;
    }

    public double getMin() {
        return edges[0];
    }

    public double getMax() {
        return edges[edges.length-1];
    }

    /**
     *
     * @param value
     * @return index of the bin containing {@param value}, -1 if outside the histogram range
     */
    public int getIdxFromValue(double value) {
        if (Double.isNaN(value) || value<edges[0] || value>edges[edges.length-1]) return -1;
        int idx = Arrays.binarySearch(edges, value);
        if (idx>=0) return Math.min(idx, data.length-1);
        return -idx - 2;
    }

    public long count() {
        long sum = 0;
        for (long i : data) sum+=i;
        return sum;
    }

    public Histogram duplicate() {
        return new Histogram(Arrays.copyOf(data, data.length), Arrays.copyOf(edges, edges.length), binSize);
    }

    @Override
    public String toString() {
        return "Histogram: bins="+data.length+" range=["+getMin()+"; "+getMax()+"] binSize="+binSize;
    }

    @Override
    public Object toJSONEntry() {
        JSONObject res= new JSONObject();
        res.put("data", JSONUtils.toJSONArray(data));
        res.put("edges", JSONUtils.toJSONArray(edges));
        res.put("binSize", binSize);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        JSONObject o = (JSONObject) jsonEntry;
        data = JSONUtils.fromLongArray((JSONArray)o.get("data"));
        edges = JSONUtils.fromDoubleArray((JSONArray)o.get("edges"));
        binSize = ((Number)o.get("binSize")).doubleValue();
    }
}
