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

import java.util.Arrays;

/**
 *
 * @author SMEARGLE developers
 */
public class SimpleImageProperties implements ImageProperties {
    protected int sizeX, sizeY, sizeZ, sizeXY, sizeXYZ;
    protected int[] shape;
    protected String name;

    public SimpleImageProperties(ImageProperties properties) {
        this(properties.getName(), properties.getShape());
    }

    public SimpleImageProperties(String name, int sizeX, int sizeY, int sizeZ) {
        this(name, sizeZ==1 ? new int[]{sizeY, sizeX} : new int[]{sizeZ, sizeY, sizeX});
    }

    /**
     * Leading axes of {@param shape} are collapsed into planes
     * @param name
     * @param shape at least two axes, the last two being rows and columns
     */
    public SimpleImageProperties(String name, int... shape) {
        if (shape==null || shape.length<2) throw new DataShapeException("Pixel arrays need at least two spatial axes, got shape: "+Arrays.toString(shape));
        for (int s : shape) if (s<0) throw new DataShapeException("Negative axis length in shape: "+Arrays.toString(shape));
        this.name= name==null ? "" : name;
        this.shape = Arrays.copyOf(shape, shape.length);
        this.sizeX = shape[shape.length-1];
        this.sizeY = shape[shape.length-2];
        int z = 1;
        for (int i = 0; i<shape.length-2; ++i) z*=shape[i];
        this.sizeZ = z;
        this.sizeXY = sizeX * sizeY;
        this.sizeXYZ = sizeXY * sizeZ;
    }

    public static SimpleImageProperties fromShape(int... shape) {
        return new SimpleImageProperties("", shape);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int sizeX() {
        return sizeX;
    }

    @Override
    public int sizeY() {
        return sizeY;
    }

    @Override
    public int sizeZ() {
        return sizeZ;
    }

    @Override
    public int sizeXY() {
        return sizeXY;
    }

    @Override
    public int sizeXYZ() {
        return sizeXYZ;
    }

    @Override
    public int[] getShape() {
        return Arrays.copyOf(shape, shape.length);
    }

    @Override
    public boolean sameDimensions(ImageProperties other) {
        return sizeX == other.sizeX() && sizeY == other.sizeY() && sizeZ == other.sizeZ() && sizeXYZ == other.sizeXYZ() && Arrays.equals(shape, other.getShape());
    }

    @Override
    public String toString() {
        return name+Arrays.toString(shape);
    }
}
