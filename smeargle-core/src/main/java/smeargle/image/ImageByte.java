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

/**
 * Bad-pixel mask: a non-zero pixel is inside the mask, i.e. rejected.
 */
public class ImageByte extends Image<ImageByte> implements ImageMask {

    private final byte[][] pixels;

    /**
     * Builds a new blank mask (nothing rejected) with same properties as {@param properties}
     * @param name name of the new image
     * @param properties properties of the new image
     */
    public ImageByte(String name, ImageProperties properties) {
        super(name, properties);
        this.pixels=new byte[sizeZ][sizeXY];
    }

    public ImageByte(String name, int sizeX, byte[][] pixels) {
        super(name, pixels.length==1 ? new int[]{sizeX>0?pixels[0].length/sizeX:0, sizeX} : new int[]{pixels.length, sizeX>0?pixels[0].length/sizeX:0, sizeX});
        this.pixels=pixels;
    }

    public ImageByte(String name, int sizeX, byte[] pixels) {
        this(name, sizeX, new byte[][]{pixels});
    }

    public static ImageByte fromFlatArray(String name, byte[] flat, int... shape) {
        ImageByte res = new ImageByte(name, new SimpleImageProperties(name, shape));
        checkLength(flat.length, res);
        for (int z = 0; z<res.sizeZ; ++z) System.arraycopy(flat, z*res.sizeXY, res.pixels[z], 0, res.sizeXY);
        return res;
    }

    public static ImageByte fromBooleans(String name, boolean[] flat, int... shape) {
        ImageByte res = new ImageByte(name, new SimpleImageProperties(name, shape));
        checkLength(flat.length, res);
        for (int i = 0; i<flat.length; ++i) if (flat[i]) res.pixels[i/res.sizeXY][i%res.sizeXY] = 1;
        return res;
    }

    @Override public DoubleStream streamPlane(int z) {
        return ArrayUtil.stream(pixels[z]);
    }

    @Override
    public double getPixel(int x, int y, int z) {
        return pixels[z][x + y * sizeX] & 0xff;
    }

    @Override
    public double getPixel(int xy, int z) {
        return pixels[z][xy] & 0xff;
    }

    @Override
    public void setPixel(int x, int y, int z, double value) {
        pixels[z][x + y * sizeX] = value<=0?0:(value>=255?(byte)255:(byte)value);
    }

    @Override
    public void setPixel(int xy, int z, double value) {
        pixels[z][xy] = value<=0?0:(value>=255?(byte)255:(byte)value);
    }

    public void setInsideMask(int xy, int z, boolean inside) {
        pixels[z][xy] = inside ? (byte)1 : 0;
    }

    public void setInsideMask(int x, int y, int z, boolean inside) {
        pixels[z][x + y * sizeX] = inside ? (byte)1 : 0;
    }

    @Override public boolean insideMask(int x, int y, int z) {
        return pixels[z][x+y*sizeX]!=0;
    }

    @Override public boolean insideMask(int xy, int z) {
        return pixels[z][xy]!=0;
    }

    @Override public int count() {
        int count = 0;
        for (int z = 0; z< sizeZ; ++z) {
            for (int xy=0; xy<sizeXY; ++xy) {
                if (pixels[z][xy]!=0) ++count;
            }
        }
        return count;
    }

    @Override
    public ImageByte duplicateMask() {
        return duplicate(name);
    }

    /**
     * Adds pixels inside {@param other} to this mask
     * @param other mask with same dimensions
     * @return this instance
     */
    public ImageByte or(ImageMask other) {
        ImageMask.loop(other, (xy, z) -> pixels[z][xy] = 1);
        return this;
    }

    /**
     * Swaps rejected and valid pixels
     */
    public void invert() {
        for (int z = 0; z < sizeZ; z++) {
            for (int xy = 0; xy<sizeXY; ++xy) {
                pixels[z][xy] = pixels[z][xy]==0 ? (byte)1 : 0;
            }
        }
    }

    /**
     *
     * @return 0/1 values in row-major order of {@link #getShape()}
     */
    public int[] toIntArray() {
        int[] res = new int[sizeXYZ];
        for (int z = 0; z<sizeZ; ++z) {
            for (int xy = 0; xy<sizeXY; ++xy) res[xy + z * sizeXY] = pixels[z][xy]!=0 ? 1 : 0;
        }
        return res;
    }

    public boolean[] toBooleanArray() {
        boolean[] res = new boolean[sizeXYZ];
        for (int z = 0; z<sizeZ; ++z) {
            for (int xy = 0; xy<sizeXY; ++xy) res[xy + z * sizeXY] = pixels[z][xy]!=0;
        }
        return res;
    }

    @Override
    public byte[][] getPixelArray() {
        return pixels;
    }

    @Override
    public ImageByte newImage(String name, ImageProperties properties) {
        return new ImageByte(name, properties);
    }
}
