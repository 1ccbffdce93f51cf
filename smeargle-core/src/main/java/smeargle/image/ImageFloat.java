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

import smeargle.utils.ArrayUtil;

import java.util.stream.DoubleStream;

public class ImageFloat extends Image<ImageFloat> {

    final private float[][] pixels;

    public ImageFloat(String name, ImageProperties properties) {
        super(name, properties);
        this.pixels=new float[sizeZ][sizeXY];
    }

    public ImageFloat(String name, int sizeX, float[][] pixels) {
        super(name, pixels.length==1 ? new int[]{sizeX>0?pixels[0].length/sizeX:0, sizeX} : new int[]{pixels.length, sizeX>0?pixels[0].length/sizeX:0, sizeX});
        this.pixels=pixels;
    }

    public ImageFloat(String name, int sizeX, float[] pixels) {
        this(name, sizeX, new float[][]{pixels});
    }

    public static ImageFloat fromFlatArray(String name, float[] flat, int... shape) {
        ImageFloat res = new ImageFloat(name, new SimpleImageProperties(name, shape));
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
        pixels[z][x + y * sizeX] = (float)value;
    }

    @Override
    public void setPixel(int xy, int z, double value) {
        pixels[z][xy] = (float)value;
    }

    @Override
    public float[][] getPixelArray() {
        return pixels;
    }

    @Override
    public ImageFloat newImage(String name, ImageProperties properties) {
        return new ImageFloat(name, properties);
    }
}
