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
 * Boolean classification of pixels: a pixel inside the mask is rejected.
 */
public interface ImageMask extends ImageProperties {

    public boolean insideMask(int x, int y, int z);
    public boolean insideMask(int xy, int z);
    public int count();
    public ImageMask duplicateMask();

    public interface LoopFunction {
        public void loop(int xy, int z);
    }

    public static void loop(ImageMask mask, LoopFunction function) {
        for (int z = 0; z<mask.sizeZ(); ++z) {
            for (int xy = 0; xy<mask.sizeXY(); ++xy) {
                if (mask.insideMask(xy, z)) function.loop(xy, z);
            }
        }
    }
}
