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

import static smeargle.configuration.parameters.IntervalParameter.compare;

/**
 *
 * @author SMEARGLE developers
 */
public class BoundedNumberParameter extends NumberParameter<BoundedNumberParameter> {
    Number lowerBound, upperBound;

    public BoundedNumberParameter(String name, int decimalPlaces, Number defaultValue) {
        this(name, decimalPlaces, defaultValue, null, null);
    }

    public BoundedNumberParameter(String name, int decimalPlaces, Number defaultValue, Number lowerBound, Number upperBound) {
        super(name, decimalPlaces, defaultValue);
        this.lowerBound=lowerBound;
        this.upperBound=upperBound;
    }

    public Number getLowerBound() {
        return lowerBound;
    }

    public Number getUpperBound() {
        return upperBound;
    }
    @Override 
    public boolean isValid() {
        if (!super.isValid()) return false;
        return (lowerBound==null || compare(value, lowerBound)>=0) && (upperBound==null || compare(value, upperBound)<=0);
    }
    @Override public BoundedNumberParameter duplicate() {
        BoundedNumberParameter res = new BoundedNumberParameter(name, decimalPlaces, value, lowerBound, upperBound);
        copyAttributesTo(res);
        return res;
    }
}
