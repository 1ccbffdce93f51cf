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

import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

/**
 *
 * @author SMEARGLE developers
 */
public class NumberParameter<P extends NumberParameter<P>> extends ParameterImpl<P> {
    Number value;
    int decimalPlaces;
    public NumberParameter(String name, int decimalPlaces) {
        super(name);
        this.decimalPlaces=decimalPlaces;
    }
    
    public NumberParameter(String name, int decimalPlaces, Number defaultValue) {
        this(name, decimalPlaces);
        this.value=defaultValue;
    }

    public Number getValue() {
        return value;
    }
    public int getIntValue() {return value.intValue();}

    public double getDoubleValue() {return value.doubleValue();}

    public P setValue(Number value) {
        this.value=value;
        return (P)this;
    }
    @Override 
    public boolean isValid() {
        if (value==null) return false;
        if (decimalPlaces==0 && value.doubleValue()!=Math.rint(value.doubleValue())) return false;
        return super.isValid();
    }
    @Override
    public String toString() {
        return name+": "+ (value==null? "":trimDecimalPlaces(value, decimalPlaces));
    }
    
    @Override
    public boolean sameContent(Parameter other) {
        if (other instanceof NumberParameter) {
            Number otherValue = ((NumberParameter)other).getValue();
            if (value==null || otherValue==null) return value==otherValue;
            if (otherValue.doubleValue()!=value.doubleValue()) {
                logger.trace("Number: {}!={} value: {} vs {}", this, other, value, otherValue);
                return false;
            } else return true;
        }
        else return false;
    }
    @Override 
    public void setContentFrom(Parameter other) {
        if (other instanceof NumberParameter) {
            this.value=((NumberParameter)other).getValue();
        } else throw new IllegalArgumentException("wrong parameter type");
    }
    
    @Override public P duplicate() {
        NumberParameter res =  new NumberParameter(name, decimalPlaces, value);
        copyAttributesTo(res);
        return (P)res;
    }

    @Override
    public Object toJSONEntry() {
        return value;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof Number) this.value = decimalPlaces==0 && isInteger((Number)jsonEntry) ? (Number)((Number)jsonEntry).longValue() : (Number)jsonEntry;
        else throw new IllegalArgumentException("Parameter "+name+": JSON entry is not a number: "+jsonEntry);
    }

    static boolean isInteger(Number n) {
        return n.doubleValue()==Math.rint(n.doubleValue());
    }

    public static String trimDecimalPlaces(Number n, int digits) {
        DecimalFormat df = (DecimalFormat)NumberFormat.getInstance(Locale.US);
        df.setMaximumFractionDigits(digits);
        return df.format(n);
    }
}
