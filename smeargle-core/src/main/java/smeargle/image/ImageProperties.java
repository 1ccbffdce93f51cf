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

/**
 * Geometry of a pixel array: {@code sizeZ} planes of {@code sizeY} rows by {@code sizeX} columns.
 * The original N-dimensional shape is kept so that results can be handed back with the shape they came in.
 * @author SMEARGLE developers
 */
public interface ImageProperties {
    public String getName();
    public int sizeX();
    public int sizeY();
    public int sizeZ();
    public int sizeXY();
    public int sizeXYZ();
    /**
     *
     * @return original shape, last two axes being rows and columns
     */
    public int[] getShape();
    public boolean sameDimensions(ImageProperties other);
}
