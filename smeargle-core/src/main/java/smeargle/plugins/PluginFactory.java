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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.plugins.plugins.filters.*;
import smeargle.plugins.plugins.masks.*;

import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Registry of maskers, filled once when the class is loaded and read-only afterwards
 * @author SMEARGLE developers
 */
public class PluginFactory {

    private final static TreeMap<String, Class<? extends Plugin>> PLUGIN_NAMES_MAP_CLASS = new TreeMap<>();
    private final static Map<Class<? extends Plugin>, String> CLASS_MAP_PLUGIN_NAME = new HashMap<>();
    private final static Logger logger = LoggerFactory.getLogger(PluginFactory.class);

    static {
        addPlugin("filter_minimum_value", FilterMinimumValue.class);
        addPlugin("filter_maximum_value", FilterMaximumValue.class);
        addPlugin("filter_exact_value", FilterExactValue.class);
        addPlugin("filter_invalid_value", FilterInvalidValue.class);
        addPlugin("filter_sigma_value", FilterSigmaValue.class);
        addPlugin("filter_pixel_truncation", FilterPixelTruncation.class);
        addPlugin("filter_percent_truncation", FilterPercentTruncation.class);
        addPlugin("filter_gaussian_truncation", FilterGaussianTruncation.class);
        addPlugin("mask_rectangle", MaskRectangle.class);
        addPlugin("mask_rectangles", MaskRectangles.class);
        addPlugin("mask_subarray", MaskSubarray.class);
        addPlugin("mask_single_pixels", MaskSinglePixels.class);
        addPlugin("mask_columns", MaskColumns.class);
        addPlugin("mask_rows", MaskRows.class);
        addPlugin("mask_nothing", MaskNothing.class);
        addPlugin("mask_everything", MaskEverything.class);
        logger.debug("total plugins registered #{}", PLUGIN_NAMES_MAP_CLASS.size());
    }

    private static void addPlugin(String name, Class<? extends Plugin> c) {
        if (PLUGIN_NAMES_MAP_CLASS.containsKey(name)) throw new IllegalStateException("Duplicate plugin name: "+name);
        if (CLASS_MAP_PLUGIN_NAME.containsKey(c)) throw new IllegalStateException("Duplicate name for class: "+c+" -> "+name+" & "+CLASS_MAP_PLUGIN_NAME.get(c));
        PLUGIN_NAMES_MAP_CLASS.put(name, c);
        CLASS_MAP_PLUGIN_NAME.put(c, name);
    }

    /**
     *
     * @param name registry name
     * @return new instance of the plugin registered under {@param name}, null if the name is unknown
     */
    public static Plugin getPlugin(String name) {
        if (name==null) return null;
        Class<? extends Plugin> plugClass = PLUGIN_NAMES_MAP_CLASS.get(name);
        if (plugClass==null) return null;
        return instantiate(plugClass, name);
    }

    public static Class<? extends Plugin> getPluginClass(String name) {
        return PLUGIN_NAMES_MAP_CLASS.get(name);
    }

    /**
     *
     * @param clazz expected plugin type
     * @param name registry name
     * @return new instance, null if the name is unknown or does not designate a plugin of type {@param clazz}
     */
    public static <T extends Plugin> T getPlugin(Class<T> clazz, String name) {
        Class<? extends Plugin> plugClass = PLUGIN_NAMES_MAP_CLASS.get(name);
        if (plugClass==null || !clazz.isAssignableFrom(plugClass)) {
            logger.info("plugin: {} of class: {} not found", name, clazz.getSimpleName());
            return null;
        }
        return clazz.cast(instantiate(plugClass, name));
    }

    private static Plugin instantiate(Class<? extends Plugin> plugClass, String name) {
        try {
            return plugClass.getDeclaredConstructor().newInstance();
        } catch (InstantiationException | InvocationTargetException | NoSuchMethodException | IllegalAccessException ex) {
            throw new IllegalStateException("plugin: "+name+" could not be instantiated, missing null constructor?", ex);
        }
    }

    public static <T extends Plugin> List<String> getPluginNames(Class<T> clazz) {
        return PLUGIN_NAMES_MAP_CLASS.entrySet().stream().filter(e -> clazz.isAssignableFrom(e.getValue())).map(Map.Entry::getKey).sorted().collect(Collectors.toList());
    }

    public static SortedSet<String> getPluginNames() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(PLUGIN_NAMES_MAP_CLASS.keySet()));
    }

    public static <T extends Plugin> String getPluginName(Class<T> clazz) {
        return CLASS_MAP_PLUGIN_NAME.get(clazz);
    }
}
