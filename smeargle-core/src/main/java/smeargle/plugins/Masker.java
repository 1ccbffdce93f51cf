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
package smeargle.plugins;

import smeargle.data_structure.MaskCollection;
import smeargle.image.Image;
import smeargle.image.ImageByte;

/**
 * Plugin producing a bad-pixel mask from a pixel array
 * @author SMEARGLE developers
 */
public interface Masker extends Plugin {
    /**
     *
     * @param data not modified
     * @return new mask with the shape of {@param data}
     */
    public ImageByte computeMask(Image data);

    /**
     * Computes the mask of {@param data} and stores it in {@param collection} under the registry name of this plugin
     * @param collection
     * @param data
     * @return key of the new mask in {@param collection}
     */
    public default String addTo(MaskCollection collection, Image data) {
        ImageByte mask = computeMask(data);
        return collection.put(PluginFactory.getPluginName(getClass()), mask);
    }
}
