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
package smeargle.data_structure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.core.DataShapeException;
import smeargle.image.ImageByte;
import smeargle.image.ImageProperties;
import smeargle.processing.MaskSynthesis;

import java.util.*;

/**
 * Masks indexed by the name of the filter or mask that produced them, in insertion order. All masks share one shape.
 * @author SMEARGLE developers
 */
public class MaskCollection {
    public final static Logger logger = LoggerFactory.getLogger(MaskCollection.class);
    private final LinkedHashMap<String, ImageByte> masks = new LinkedHashMap<>();

    public MaskCollection() {}

    /**
     * Seeds the collection with existing masks
     * @param masks
     */
    public MaskCollection(Map<String, ImageByte> masks) {
        masks.forEach(this::put);
    }

    /**
     *
     * @param name
     * @param mask
     * @return key under which {@param mask} is stored: {@param name}, with a numeric suffix if it is already used
     */
    public String put(String name, ImageByte mask) {
        if (mask==null) throw new IllegalArgumentException("Cannot add null mask");
        ImageProperties props = getProperties();
        if (props!=null && !props.sameDimensions(mask)) throw new DataShapeException("Mask "+name+" has shape "+Arrays.toString(mask.getShape())+" whereas collection shape is "+Arrays.toString(props.getShape()));
        String key = name;
        int idx = 2;
        while (masks.containsKey(key)) key = name+"_"+(idx++);
        if (!key.equals(name)) logger.debug("mask name {} already used, stored as {}", name, key);
        masks.put(key, mask);
        return key;
    }

    public ImageByte get(String name) {
        return masks.get(name);
    }

    public boolean containsKey(String name) {
        return masks.containsKey(name);
    }

    public List<String> getNames() {
        return new ArrayList<>(masks.keySet());
    }

    public Collection<ImageByte> getMasks() {
        return Collections.unmodifiableCollection(masks.values());
    }

    public int size() {
        return masks.size();
    }

    public boolean isEmpty() {
        return masks.isEmpty();
    }

    /**
     *
     * @return shape shared by the masks, null if the collection is empty
     */
    public ImageProperties getProperties() {
        if (masks.isEmpty()) return null;
        return masks.values().iterator().next();
    }

    /**
     *
     * @return union of all masks
     */
    public ImageByte synthesize() {
        if (masks.isEmpty()) throw new IllegalArgumentException("Cannot synthesize an empty mask collection");
        return MaskSynthesis.synthesize(masks.values()).setName("synthesized");
    }

    @Override
    public String toString() {
        return "MaskCollection"+masks.keySet();
    }
}
