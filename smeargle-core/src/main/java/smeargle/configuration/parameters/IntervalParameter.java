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

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Ordered values, e.g. an inclusive index range {first, last}. Values are not reordered: unordered values make the parameter invalid.
 * @author SMEARGLE developers
 */
public class IntervalParameter extends ParameterImpl<IntervalParameter> {
    Number[] values;
    Number lowerBound, upperBound;
    int decimalPlaces;

    public IntervalParameter(String name, int decimalPlaces, Number lowerBound, Number upperBound, Number... values) {
        super(name);
        if (lowerBound!=null && upperBound!=null && compare(lowerBound, upperBound)>0) throw new IllegalArgumentException("lower bound should be inferior to upper bound");
        if (values.length==0) throw new IllegalArgumentException("value number should be >=1");
        this.values = Arrays.copyOf(values, values.length);
        this.lowerBound=lowerBound;
        this.upperBound=upperBound;
        this.decimalPlaces = decimalPlaces;
    }

    @Override
    public boolean sameContent(Parameter other) {
        if (other instanceof IntervalParameter) {
            return Arrays.equals(getValuesAsDouble(), ((IntervalParameter)other).getValuesAsDouble());
        }
        else return false;
    }

    public double[] getValuesAsDouble() {
        return Arrays.stream(values).mapToDouble(Number::doubleValue).toArray();
    }

    public int[] getValuesAsInt() {
        return Arrays.stream(values).mapToInt(Number::intValue).toArray();
    }

    @Override
    public void setContentFrom(Parameter other) {
        if (other instanceof IntervalParameter) {
            setValues(((IntervalParameter)other).values);
        } else throw new IllegalArgumentException("wrong parameter type");
    }

    @Override
    public IntervalParameter duplicate() {
        IntervalParameter res = new IntervalParameter(name, decimalPlaces, lowerBound, upperBound, values);
        copyAttributesTo(res);
        return res;
    }

    @Override
    public boolean isValid() {
        for (Number v : values) if (v==null) return false;
        if (decimalPlaces==0) for (Number v : values) if (!NumberParameter.isInteger(v)) return false;
        // check that is sorted
        for (int i = 1; i<values.length; ++i) if (compare(values[i], values[i-1])<0) return false;
        // check bounds
        if (lowerBound!=null && compare(values[0], lowerBound)<0) return false;
        if (upperBound!=null && compare(values[values.length-1], upperBound)>0) return false;
        return super.isValid();
    }

    @Override
    public Object toJSONEntry() {
        JSONArray list= new JSONArray();
        list.addAll(Arrays.asList(values));
        return list;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof JSONArray) {
            JSONArray list = (JSONArray) jsonEntry;
            if (list.size()!=values.length) throw new IllegalArgumentException("Parameter "+name+": expected "+values.length+" values, got: "+list);
            values = new Number[list.size()];
            for (int i = 0; i < values.length; ++i) values[i] = (Number) list.get(i);
        } else throw new IllegalArgumentException("Could not initialize parameter "+name+" from: "+jsonEntry);
    }

    public IntervalParameter setValues(Number... values) {
        if (values.length!=this.values.length) throw new IllegalArgumentException("Parameter "+name+": expected "+this.values.length+" values, got: "+values.length);
        this.values = Arrays.copyOf(values, values.length);
        return this;
    }

    public Number[] getValues() {
        return values;
    }

    public Number getLowerBound() {
        return lowerBound;
    }

    public Number getUpperBound() {
        return upperBound;
    }

    @Override
    public String toString() {
        return name +(name.length()>0?": ":"")+ Arrays.stream(values).map(n-> n==null ? "null" : NumberParameter.trimDecimalPlaces(n, decimalPlaces)).collect(Collectors.joining("; ", "[", "]"));
    }

    public static int compare(Number a, Number b){
        return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
    }
}
