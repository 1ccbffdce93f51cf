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
import smeargle.configuration.parameters.BoundedNumberParameter;
import smeargle.configuration.parameters.Parameter;
import smeargle.data_structure.SigmaMultiple;
import smeargle.image.Image;
import smeargle.image.ImageByte;
import smeargle.plugins.Hint;
import smeargle.plugins.ValueFilter;
import smeargle.processing.ValueFilters;

/**
 *
 * @author SMEARGLE developers
 */
public class FilterGaussianTruncation implements ValueFilter, Hint {
    ArrayNumberParameter sigmaMultiple = new ArrayNumberParameter("sigma_multiple", 1, 2, 5, 0, null).setHint("One value for a symmetric range, two values for the lower and upper multiples");
    BoundedNumberParameter binWidth = new BoundedNumberParameter("bin_width", 8, 1, 0, null).addValidationFunction(p -> p.getDoubleValue()>0).setHint("Width of the histogram bins, in pixel value units");
    Parameter[] parameters = new Parameter[]{sigmaMultiple, binWidth};
    public FilterGaussianTruncation() {}
    public FilterGaussianTruncation(SigmaMultiple sigmaMultiple, double binWidth) {
        this.sigmaMultiple.setValue(sigmaMultiple.toArray());
        this.binWidth.setValue(binWidth);
    }
    @Override
    public ImageByte computeMask(Image data) {
        checkParameters();
        return ValueFilters.filterGaussianTruncation(data, SigmaMultiple.of(sigmaMultiple.getArrayDouble()), binWidth.getDoubleValue());
    }
    @Override
    public Parameter[] getParameters() {
        return parameters;
    }
    @Override
    public String getHintText() {
        return "Fits a Gaussian to the histogram of pixel values and masks pixels outside [mean - low x stddev ; mean + high x stddev] of the fitted curve";
    }
}
