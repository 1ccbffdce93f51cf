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
import smeargle.configuration.parameters.ListParameter;
import smeargle.configuration.parameters.Parameter;
import smeargle.core.ConfigurationException;
import smeargle.image.ImageByte;
import smeargle.image.ImageProperties;
import smeargle.plugins.GeometricMask;
import smeargle.plugins.Hint;
import smeargle.processing.GeometricMasks;

/**
 * Union of several rectangles. The i-th column range is paired with the i-th row range.
 * @author SMEARGLE developers
 */
public class MaskRectangles implements GeometricMask, Hint {
    ListParameter<IntervalParameter> columnRanges = new ListParameter<>("column_ranges", new IntervalParameter("column_range", 0, 0, null, new Number[]{null, null})).setHint("Column range (inclusive) of each rectangle");
    ListParameter<IntervalParameter> rowRanges = new ListParameter<>("row_ranges", new IntervalParameter("row_range", 0, 0, null, new Number[]{null, null})).setHint("Row range (inclusive) of each rectangle");
    Parameter[] parameters = new Parameter[]{columnRanges, rowRanges};
    public MaskRectangles() {}
    public MaskRectangles(int[][] columnRanges, int[][] rowRanges) {
        for (int[] r : columnRanges) this.columnRanges.addChild().setValues(r[0], r[1]);
        for (int[] r : rowRanges) this.rowRanges.addChild().setValues(r[0], r[1]);
    }
    @Override
    public ImageByte computeMask(ImageProperties properties) {
        checkParameters();
        if (columnRanges.getChildCount()!=rowRanges.getChildCount()) throw new ConfigurationException("Column ranges ("+columnRanges.getChildCount()+") and row ranges ("+rowRanges.getChildCount()+") should have the same number of elements");
        int[][] columns = columnRanges.getChildren().stream().map(IntervalParameter::getValuesAsInt).toArray(int[][]::new);
        int[][] rows = rowRanges.getChildren().stream().map(IntervalParameter::getValuesAsInt).toArray(int[][]::new);
        return GeometricMasks.maskRectangles(properties, columns, rows);
    }
    @Override
    public Parameter[] getParameters() {
        return parameters;
    }
    @Override
    public String getHintText() {
        return "Masks all pixels within several rectangles";
    }
}
