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

import smeargle.configuration.parameters.Parameter;
import smeargle.image.ImageByte;
import smeargle.image.ImageProperties;
import smeargle.plugins.GeometricMask;
import smeargle.processing.GeometricMasks;

/**
 *
 * @author SMEARGLE developers
 */
public class MaskNothing implements GeometricMask {
    @Override
    public ImageByte computeMask(ImageProperties properties) {
        return GeometricMasks.maskNothing(properties);
    }
    @Override
    public Parameter[] getParameters() {
        return new Parameter[0];
    }
}
