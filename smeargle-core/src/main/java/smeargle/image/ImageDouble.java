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
package smeargle.image;

import smeargle.core.DataShapeException;
import smeargle.utils.ArrayUtil;

import java.util.stream.DoubleStream;

public class ImageDouble extends Image<ImageDouble> {

    final private double[][] pixels;

    /**
     * Builds a new blank image with same properties as {@param properties}
     * @param name name of the new image
     * @param properties properties of the new image
     */
    public ImageDouble(String name, ImageProperties properties) {
        super(name, properties);
        this.pixels=new double[sizeZ][sizeXY];
    }

    public ImageDouble(String name, int sizeX, double[][] pixels) {
        super(name, pixels.length==1 ? new int[]{sizeX>0?pixels[0].length/sizeX:0, sizeX} : new int[]{pixels.length, sizeX>0?pixels[0].length/sizeX:0, sizeX});
        this.pixels=pixels;
    }

    public ImageDouble(String name, int sizeX, double[] pixels) {
        this(name, sizeX, new double[][]{pixels});
    }

    /**
     *
     * @param name
     * @param rows 2D array indexed [row][column]
     * @return single plane image
     */
    public static ImageDouble fromRows(String name, double[][] rows) {
        int sizeX = rows.length==0 ? 0 : rows[0].length;
        double[] flat = new double[rows.length * sizeX];
        for (int y = 0; y<rows.length; ++y) {
            if (rows[y].length!=sizeX) throw new DataShapeException("Ragged rows: row "+y+" has "+rows[y].length+" columns instead of "+sizeX);
            System.arraycopy(rows[y], 0, flat, y*sizeX, sizeX);
        }
        return fromFlatArray(name, flat, rows.length, sizeX);
    }

    public static ImageDouble fromFlatArray(String name, double[] flat, int... shape) {
        ImageDouble res = new ImageDouble(name, new SimpleImageProperties(name, shape));
        checkLength(flat.length, res);
        for (int z = 0; z<res.sizeZ; ++z) System.arraycopy(flat, z*res.sizeXY, res.pixels[z], 0, res.sizeXY);
        return res;
    }

    @Override public DoubleStream streamPlane(int z) {
        return ArrayUtil.stream(pixels[z]);
    }

    @Override
    public double getPixel(int x, int y, int z) {
        return pixels[z][x + y * sizeX];
    }

    @Override
    public double getPixel(int xy, int z) {
        return pixels[z][xy];
    }

    @Override
    public void setPixel(int x, int y, int z, double value) {
        pixels[z][x + y * sizeX] = value;
    }

    @Override
    public void setPixel(int xy, int z, double value) {
        pixels[z][xy] = value;
    }

    @Override
    public double[][] getPixelArray() {
        return pixels;
    }

    @Override
    public ImageDouble newImage(String name, ImageProperties properties) {
        return new ImageDouble(name, properties);
    }
}
