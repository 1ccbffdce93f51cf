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

import smeargle.configuration.parameters.ArrayNumberParameter;
import smeargle.configuration.parameters.Parameter;
import smeargle.image.ImageByte;
import smeargle.image.ImageProperties;
import smeargle.plugins.GeometricMask;
import smeargle.plugins.Hint;
import smeargle.processing.GeometricMasks;

/**
 *
 * @author SMEARGLE developers
 */
public class MaskSinglePixels implements GeometricMask, Hint {
    ArrayNumberParameter rows = new ArrayNumberParameter("rows", 1, -1, 0, 0, null).setHint("Row of each pixel");
    ArrayNumberParameter columns = new ArrayNumberParameter("columns", 1, -1, 0, 0, null).setHint("Column of each pixel, same length as rows");
    Parameter[] parameters = new Parameter[]{rows, columns};
    public MaskSinglePixels() {}
    public MaskSinglePixels(int[] rows, int[] columns) {
        this.rows.setValue(rows);
        this.columns.setValue(columns);
    }
    @Override
    public ImageByte computeMask(ImageProperties properties) {
        checkParameters();
        return GeometricMasks.maskSinglePixels(properties, rows.getArrayInt(), columns.getArrayInt());
    }
    @Override
    public Parameter[] getParameters() {
        return parameters;
    }
    @Override
    public String getHintText() {
        return "Masks individual pixels given by their (row, column) coordinates";
    }
}
