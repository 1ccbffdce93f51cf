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

import smeargle.configuration.RuntimeConfiguration;
import smeargle.configuration.parameters.BoundedNumberParameter;
import smeargle.configuration.parameters.Parameter;
import smeargle.image.Image;
import smeargle.image.ImageByte;
import smeargle.plugins.Hint;
import smeargle.plugins.RuntimeConfigurable;
import smeargle.plugins.ValueFilter;
import smeargle.processing.ValueFilters;

/**
 * Masks pixels equal to a given value, up to the float equality tolerance of the {@link RuntimeConfiguration}
 * @author SMEARGLE developers
 */
public class FilterExactValue implements ValueFilter, RuntimeConfigurable, Hint {
    BoundedNumberParameter exactValue = new BoundedNumberParameter("exact_value", 8, null).setHint("Value to mask");
    Parameter[] parameters = new Parameter[]{exactValue};
    RuntimeConfiguration runtimeConfiguration = new RuntimeConfiguration();
    public FilterExactValue() {}
    public FilterExactValue(double exactValue) {
        this.exactValue.setValue(exactValue);
    }
    @Override
    public void setRuntimeConfiguration(RuntimeConfiguration configuration) {
        this.runtimeConfiguration = configuration;
    }
    @Override
    public ImageByte computeMask(Image data) {
        checkParameters();
        return ValueFilters.filterExactValue(data, exactValue.getDoubleValue(), runtimeConfiguration.getFloatEqualityTolerance());
    }
    @Override
    public Parameter[] getParameters() {
        return parameters;
    }
    @Override
    public String getHintText() {
        return "Masks pixels equal to a specific value, such as a fill value written by the readout electronics";
    }
}
