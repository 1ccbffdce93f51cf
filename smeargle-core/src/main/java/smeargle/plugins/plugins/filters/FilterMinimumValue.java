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
package smeargle.plugins.plugins.filters;

import smeargle.configuration.parameters.BoundedNumberParameter;
import smeargle.configuration.parameters.Parameter;
import smeargle.image.Image;
import smeargle.image.ImageByte;
import smeargle.plugins.Hint;
import smeargle.plugins.ValueFilter;
import smeargle.processing.ValueFilters;

/**
 *
 * @author SMEARGLE developers
 */
public class FilterMinimumValue implements ValueFilter, Hint {
    BoundedNumberParameter minimumValue = new BoundedNumberParameter("minimum_value", 8, null).setHint("Pixels with a value strictly below this threshold are masked");
    Parameter[] parameters = new Parameter[]{minimumValue};
    public FilterMinimumValue() {}
    public FilterMinimumValue(double minimumValue) {
        this.minimumValue.setValue(minimumValue);
    }
    @Override
    public ImageByte computeMask(Image data) {
        checkParameters();
        return ValueFilters.filterMinimumValue(data, minimumValue.getDoubleValue());
    }
    @Override
    public Parameter[] getParameters() {
        return parameters;
    }
    @Override
    public String getHintText() {
        return "Masks pixels whose value is below a minimum value";
    }
}
