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
public class FilterPixelTruncation implements ValueFilter, Hint {
    BoundedNumberParameter topCount = new BoundedNumberParameter("top_count", 0, 0, 0, null).setHint("Number of highest pixels to mask. 0: no truncation");
    BoundedNumberParameter bottomCount = new BoundedNumberParameter("bottom_count", 0, 0, 0, null).setHint("Number of lowest pixels to mask. 0: no truncation");
    Parameter[] parameters = new Parameter[]{topCount, bottomCount};
    public FilterPixelTruncation() {}
    public FilterPixelTruncation(int topCount, int bottomCount) {
        this.topCount.setValue(topCount);
        this.bottomCount.setValue(bottomCount);
    }
    @Override
    public ImageByte computeMask(Image data) {
        checkParameters();
        return ValueFilters.filterPixelTruncation(data, topCount.getIntValue(), bottomCount.getIntValue());
    }
    @Override
    public Parameter[] getParameters() {
        return parameters;
    }
    @Override
    public String getHintText() {
        return "Masks a fixed number of the highest and lowest pixels. Pixels sharing the threshold value are kept";
    }
}
