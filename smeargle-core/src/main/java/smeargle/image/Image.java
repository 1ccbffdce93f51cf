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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.core.DataShapeException;

import java.util.stream.DoubleStream;
import java.util.stream.IntStream;

/**
 * Pixel array stored plane by plane: pixel (x, y, z) is at index {@code x + y * sizeX} of plane z.
 * An image may carry a mask of pixels already known to be invalid. Those pixels are excluded from statistics and stay rejected in every filter result.
 * @author SMEARGLE developers
 */
public abstract class Image<I extends Image<I>> extends SimpleImageProperties {
    public final static Logger logger = LoggerFactory.getLogger(Image.class);
    protected ImageMask mask;

    protected Image(String name, int... shape) {
        super(name, shape);
    }

    protected Image(String name, ImageProperties properties) {
        super(name, properties.getShape());
    }

    /**
     * Builds an image from a flat pixel array in row-major order
     * @param name
     * @param pixelArray double[], float[] or byte[]
     * @param shape last two axes are rows and columns
     * @return image of the type matching {@param pixelArray}
     */
    public static Image createImage(String name, Object pixelArray, int... shape) {
        if (pixelArray instanceof double[]) return ImageDouble.fromFlatArray(name, (double[])pixelArray, shape);
        else if (pixelArray instanceof float[]) return ImageFloat.fromFlatArray(name, (float[])pixelArray, shape);
        else if (pixelArray instanceof byte[]) return ImageByte.fromFlatArray(name, (byte[])pixelArray, shape);
        else throw new IllegalArgumentException("Pixel Array should be of type double, float or byte");
    }

    protected static void checkLength(int length, ImageProperties props) {
        if (length!=props.sizeXYZ()) throw new DataShapeException("Pixel array of length "+length+" does not match shape "+props+" ("+props.sizeXYZ()+" elements)");
    }

    public I setName(String name) {
        this.name=name;
        return (I)this;
    }

    public SimpleImageProperties getProperties() {return new SimpleImageProperties(this);}

    /**
     *
     * @return mask of pixels already known to be invalid, or null
     */
    public ImageMask getMask() {
        return mask;
    }

    public I setMask(ImageMask mask) {
        if (mask!=null && !sameDimensions(mask)) throw new DataShapeException("Mask "+mask+" does not match image "+this);
        this.mask = mask;
        return (I)this;
    }

    public boolean isMasked(int xy, int z) {
        return mask!=null && mask.insideMask(xy, z);
    }

    public abstract double getPixel(int x, int y, int z);
    public abstract double getPixel(int xy, int z);
    public abstract void setPixel(int x, int y, int z, double value);
    public abstract void setPixel(int xy, int z, double value);
    public abstract I newImage(String name, ImageProperties properties);
    public abstract Object[] getPixelArray();
    public abstract DoubleStream streamPlane(int z);

    public I duplicate() {
        return duplicate(name);
    }

    public I duplicate(String name) {
        I res = newImage(name, this);
        for (int z = 0; z<sizeZ; ++z) System.arraycopy(getPixelArray()[z], 0, res.getPixelArray()[z], 0, sizeXY);
        if (mask!=null) res.setMask(mask.duplicateMask());
        return res;
    }

    /**
     *
     * @return all pixel values, plane after plane
     */
    public DoubleStream stream() {
        return IntStream.range(0, sizeZ).mapToObj(this::streamPlane).flatMapToDouble(s -> s);
    }

    /**
     *
     * @return values of pixels that are not masked and are finite
     */
    public DoubleStream streamValid() {
        return streamOutside(mask).filter(Double::isFinite);
    }

    /**
     *
     * @param excluded may be null
     * @return values of pixels outside {@param excluded}
     */
    public DoubleStream streamOutside(ImageMask excluded) {
        if (excluded==null) return stream();
        if (!sameDimensions(excluded)) throw new DataShapeException("Mask "+excluded+" does not match image "+this);
        return IntStream.range(0, sizeXYZ).filter(i -> !excluded.insideMask(i%sizeXY, i/sizeXY)).mapToDouble(i -> getPixel(i%sizeXY, i/sizeXY));
    }
}
