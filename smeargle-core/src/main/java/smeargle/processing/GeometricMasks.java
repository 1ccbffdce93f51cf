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
package smeargle.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.core.ConfigurationException;
import smeargle.image.ImageByte;
import smeargle.image.ImageProperties;

import java.util.Arrays;

/**
 * Masks computed from pixel coordinates only. Ranges are {first, last}, both ends included. Masks apply to every plane.
 * @author SMEARGLE developers
 */
public class GeometricMasks {
    public final static Logger logger = LoggerFactory.getLogger(GeometricMasks.class);

    public static ImageByte maskRectangle(ImageProperties props, int[] columnRange, int[] rowRange) {
        return checkEmpty(rectangle(props, "mask_rectangle", columnRange, rowRange));
    }

    /**
     * Union of rectangles, rectangle i spanning {@param columnRanges}[i] x {@param rowRanges}[i]
     * @param props
     * @param columnRanges
     * @param rowRanges
     * @return mask
     */
    public static ImageByte maskRectangles(ImageProperties props, int[][] columnRanges, int[][] rowRanges) {
        if (columnRanges.length!=rowRanges.length) throw new ConfigurationException("As many column ranges as row ranges are required, got "+columnRanges.length+" and "+rowRanges.length);
        ImageByte res = new ImageByte("mask_rectangles", props);
        for (int i = 0; i<columnRanges.length; ++i) res.or(rectangle(props, "", columnRanges[i], rowRanges[i]));
        return checkEmpty(res);
    }

    /**
     * Rejects everything except the rectangle
     * @param props
     * @param columnRange
     * @param rowRange
     * @return mask
     */
    public static ImageByte maskSubarray(ImageProperties props, int[] columnRange, int[] rowRange) {
        ImageByte res = rectangle(props, "mask_subarray", columnRange, rowRange);
        res.invert();
        return checkEmpty(res);
    }

    /**
     * Rejects pixels (rows[i], columns[i])
     * @param props
     * @param rows
     * @param columns
     * @return mask
     */
    public static ImageByte maskSinglePixels(ImageProperties props, int[] rows, int[] columns) {
        if (rows.length!=columns.length) throw new ConfigurationException("Row and column lists must have the same length, got "+rows.length+" and "+columns.length);
        ImageByte res = new ImageByte("mask_single_pixels", props);
        for (int i = 0; i<rows.length; ++i) {
            checkIndex(rows[i], props.sizeY(), "row");
            checkIndex(columns[i], props.sizeX(), "column");
            for (int z = 0; z<props.sizeZ(); ++z) res.setInsideMask(columns[i], rows[i], z, true);
        }
        return checkEmpty(res);
    }

    public static ImageByte maskColumns(ImageProperties props, int... columns) {
        ImageByte res = new ImageByte("mask_columns", props);
        for (int x : columns) {
            checkIndex(x, props.sizeX(), "column");
            for (int z = 0; z<props.sizeZ(); ++z) {
                for (int y = 0; y<props.sizeY(); ++y) res.setInsideMask(x, y, z, true);
            }
        }
        return checkEmpty(res);
    }

    public static ImageByte maskRows(ImageProperties props, int... rows) {
        ImageByte res = new ImageByte("mask_rows", props);
        for (int y : rows) {
            checkIndex(y, props.sizeY(), "row");
            for (int z = 0; z<props.sizeZ(); ++z) {
                for (int x = 0; x<props.sizeX(); ++x) res.setInsideMask(x, y, z, true);
            }
        }
        return checkEmpty(res);
    }

    /**
     *
     * @param props
     * @return mask that rejects no pixel
     */
    public static ImageByte maskNothing(ImageProperties props) {
        return new ImageByte("mask_nothing", props);
    }

    /**
     *
     * @param props
     * @return mask that rejects all pixels
     */
    public static ImageByte maskEverything(ImageProperties props) {
        ImageByte res = new ImageByte("mask_everything", props);
        res.invert();
        return checkEmpty(res);
    }

    private static ImageByte rectangle(ImageProperties props, String name, int[] columnRange, int[] rowRange) {
        checkRange(columnRange, props.sizeX(), "column");
        checkRange(rowRange, props.sizeY(), "row");
        ImageByte res = new ImageByte(name, props);
        for (int z = 0; z<props.sizeZ(); ++z) {
            for (int y = rowRange[0]; y<=rowRange[1]; ++y) {
                for (int x = columnRange[0]; x<=columnRange[1]; ++x) res.setInsideMask(x, y, z, true);
            }
        }
        return res;
    }

    private static void checkRange(int[] range, int size, String axis) {
        if (range==null || range.length!=2) throw new ConfigurationException("A "+axis+" range must be {first, last}, got: "+Arrays.toString(range));
        if (range[0]>range[1]) throw new ConfigurationException("Invalid "+axis+" range "+Arrays.toString(range)+": first index is greater than last index");
        checkIndex(range[0], size, axis);
        checkIndex(range[1], size, axis);
    }

    private static void checkIndex(int idx, int size, String axis) {
        if (idx<0 || idx>=size) throw new ConfigurationException(axis+" index "+idx+" is outside the array (size: "+size+")");
    }

    private static ImageByte checkEmpty(ImageByte mask) {
        if (mask.count()==0) logger.info("{} rejects no pixel; check its configuration", mask.getName());
        return mask;
    }
}
