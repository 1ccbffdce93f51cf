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
import smeargle.core.DataShapeException;
import smeargle.image.ImageByte;
import smeargle.image.ImageMask;

import java.util.Arrays;
import java.util.Collection;

/**
 * Combination of masks by logical OR: a pixel is rejected if any input mask rejects it.
 * @author SMEARGLE developers
 */
public class MaskSynthesis {
    public final static Logger logger = LoggerFactory.getLogger(MaskSynthesis.class);

    /**
     *
     * @param masks at least one mask; all masks must have the shape and element count of the first one
     * @return new mask, never one of the inputs
     */
    public static ImageByte synthesize(ImageMask... masks) {
        if (masks==null || masks.length==0) throw new IllegalArgumentException("At least one mask is required for synthesis");
        ImageMask first = masks[0];
        if (first==null) throw new IllegalArgumentException("Mask at index 0 is null");
        for (int i = 1; i<masks.length; ++i) {
            if (masks[i]==null) throw new IllegalArgumentException("Mask at index "+i+" is null");
            if (!Arrays.equals(masks[i].getShape(), first.getShape())) throw new DataShapeException("Mask at index "+i+" has shape "+Arrays.toString(masks[i].getShape())+", expected "+Arrays.toString(first.getShape()));
            if (masks[i].sizeXYZ()!=first.sizeXYZ()) throw new DataShapeException("Mask at index "+i+" has "+masks[i].sizeXYZ()+" elements, expected "+first.sizeXYZ());
        }
        ImageByte res = new ImageByte("synthesized", first);
        if (masks.length==1) logger.debug("only one mask: nothing to synthesize, returning a copy");
        for (ImageMask m : masks) res.or(m);
        return res;
    }

    public static ImageByte synthesize(Collection<? extends ImageMask> masks) {
        return synthesize(masks.toArray(new ImageMask[0]));
    }
}
