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
package smeargle.configuration.parameters;

import org.json.simple.JSONArray;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static smeargle.configuration.parameters.IntervalParameter.compare;

/**
 * Variable length list of numbers. A single number is accepted as a one-element list.
 * @author SMEARGLE developers
 */
public class ArrayNumberParameter extends ParameterImpl<ArrayNumberParameter> {
    List<Number> values = new ArrayList<>();
    final int minLength, maxLength, decimalPlaces;
    final Number lowerBound, upperBound;

    /**
     *
     * @param name
     * @param minLength minimal number of values
     * @param maxLength maximal number of values, negative for no limit
     * @param decimalPlaces 0 for integer values
     * @param lowerBound bound on each value, may be null
     * @param upperBound bound on each value, may be null
     * @param defaultValues
     */
    public ArrayNumberParameter(String name, int minLength, int maxLength, int decimalPlaces, Number lowerBound, Number upperBound, Number... defaultValues) {
        super(name);
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.decimalPlaces = decimalPlaces;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.values.addAll(Arrays.asList(defaultValues));
    }

    public ArrayNumberParameter setValue(Number... values) {
        this.values = new ArrayList<>(Arrays.asList(values));
        return this;
    }

    public ArrayNumberParameter setValue(double... values) {
        this.values = Arrays.stream(values).mapToObj(v -> (Number)v).collect(Collectors.toList());
        return this;
    }

    public ArrayNumberParameter setValue(int... values) {
        this.values = Arrays.stream(values).mapToObj(v -> (Number)v).collect(Collectors.toList());
        return this;
    }

    public int[] getArrayInt() {
        return values.stream().mapToInt(p -> (int)Math.round(p.doubleValue())).toArray();
    }
    public double[] getArrayDouble() {
        return values.stream().mapToDouble(Number::doubleValue).toArray();
    }

    @Override
    public boolean isValid() {
        if (values.size()<minLength || (maxLength>=0 && values.size()>maxLength)) return false;
        for (Number v : values) {
            if (v==null) return false;
            if (decimalPlaces==0 && !NumberParameter.isInteger(v)) return false;
            if (lowerBound!=null && compare(v, lowerBound)<0) return false;
            if (upperBound!=null && compare(v, upperBound)>0) return false;
        }
        return super.isValid();
    }

    @Override
    public boolean sameContent(Parameter other) {
        if (other instanceof ArrayNumberParameter) return Arrays.equals(getArrayDouble(), ((ArrayNumberParameter)other).getArrayDouble());
        return false;
    }

    @Override
    public void setContentFrom(Parameter other) {
        if (other instanceof ArrayNumberParameter) {
            this.values = new ArrayList<>(((ArrayNumberParameter)other).values);
        } else if (other instanceof NumberParameter) {
            setValue(((NumberParameter) other).getValue());
        } else throw new IllegalArgumentException("wrong parameter type");
    }

    @Override
    public ArrayNumberParameter duplicate() {
        ArrayNumberParameter res = new ArrayNumberParameter(name, minLength, maxLength, decimalPlaces, lowerBound, upperBound, values.toArray(new Number[0]));
        copyAttributesTo(res);
        return res;
    }

    @Override
    public Object toJSONEntry() {
        JSONArray res = new JSONArray();
        res.addAll(values);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof Number) setValue((Number)jsonEntry);
        else if (jsonEntry instanceof List) {
            List<Number> newValues = new ArrayList<>();
            for (Object o : (List)jsonEntry) {
                if (o instanceof Number) newValues.add((Number)o);
                else throw new IllegalArgumentException("Parameter "+name+": not a number: "+o);
            }
            this.values = newValues;
        } else throw new IllegalArgumentException("Could not initialize parameter "+name+" from: "+jsonEntry);
    }

    @Override
    public String toString() {
        return name+": "+values.stream().map(n-> n==null ? "null" : NumberParameter.trimDecimalPlaces(n, decimalPlaces)).collect(Collectors.joining("; ", "[", "]"));
    }
}
