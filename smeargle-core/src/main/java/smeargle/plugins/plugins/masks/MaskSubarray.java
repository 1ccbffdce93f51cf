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
package smeargle.plugins.plugins.masks;

import smeargle.configuration.parameters.IntervalParameter;
import smeargle.configuration.parameters.Parameter;
import smeargle.image.ImageByte;
import smeargle.image.ImageProperties;
import smeargle.plugins.GeometricMask;
import smeargle.plugins.Hint;
import smeargle.processing.GeometricMasks;

/**
 * Keeps only a rectangular subarray of the detector
 * @author SMEARGLE developers
 */
public class MaskSubarray implements GeometricMask, Hint {
    IntervalParameter columnRange = new IntervalParameter("column_range", 0, 0, null, new Number[]{null, null}).setHint("First and last column of the subarray (inclusive)");
    IntervalParameter rowRange = new IntervalParameter("row_range", 0, 0, null, new Number[]{null, null}).setHint("First and last row of the subarray (inclusive)");
    Parameter[] parameters = new Parameter[]{columnRange, rowRange};
    public MaskSubarray() {}
    public MaskSubarray(int[] columnRange, int[] rowRange) {
        this.columnRange.setValues(columnRange[0], columnRange[1]);
        this.rowRange.setValues(rowRange[0], rowRange[1]);
    }
    @Override
    public ImageByte computeMask(ImageProperties properties) {
        checkParameters();
        return GeometricMasks.maskSubarray(properties, columnRange.getValuesAsInt(), rowRange.getValuesAsInt());
    }
    @Override
    public Parameter[] getParameters() {
        return parameters;
    }
    @Override
    public String getHintText() {
        return "Masks all pixels outside a rectangular subarray";
    }
}
