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

import smeargle.configuration.parameters.ArrayNumberParameter;
import smeargle.configuration.parameters.Parameter;
import smeargle.data_structure.SigmaMultiple;
import smeargle.image.Image;
import smeargle.image.ImageByte;
import smeargle.plugins.Hint;
import smeargle.plugins.ValueFilter;
import smeargle.processing.ValueFilters;

/**
 * Masks pixels far from the robust mean, in units of robust standard deviation
 * @author SMEARGLE developers
 */
public class FilterSigmaValue implements ValueFilter, Hint {
    ArrayNumberParameter sigmaMultiple = new ArrayNumberParameter("sigma_multiple", 1, 2, 5, 0, null).setHint("One value for a symmetric range, two values for the lower and upper multiples");
    Parameter[] parameters = new Parameter[]{sigmaMultiple};
    public FilterSigmaValue() {}
    public FilterSigmaValue(SigmaMultiple sigmaMultiple) {
        this.sigmaMultiple.setValue(sigmaMultiple.toArray());
    }
    public SigmaMultiple getSigmaMultiple() {
        return SigmaMultiple.of(sigmaMultiple.getArrayDouble());
    }
    @Override
    public ImageByte computeMask(Image data) {
        checkParameters();
        return ValueFilters.filterSigmaValue(data, getSigmaMultiple());
    }
    @Override
    public Parameter[] getParameters() {
        return parameters;
    }
    @Override
    public String getHintText() {
        return "Masks pixels outside [mean - low x stddev ; mean + high x stddev], where mean and stddev are computed after rejection of outliers by interquartile fences";
    }
}
