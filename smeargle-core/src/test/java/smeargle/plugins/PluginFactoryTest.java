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

import org.junit.Assert;
import org.junit.Test;
import smeargle.plugins.plugins.filters.FilterMinimumValue;
import smeargle.plugins.plugins.masks.MaskRectangle;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author SMEARGLE developers
 */
public class PluginFactoryTest {

    @Test
    public void testRegistry() {
        List<String> filters = Arrays.asList("filter_exact_value", "filter_gaussian_truncation", "filter_invalid_value", "filter_maximum_value", "filter_minimum_value", "filter_percent_truncation", "filter_pixel_truncation", "filter_sigma_value");
        List<String> masks = Arrays.asList("mask_columns", "mask_everything", "mask_nothing", "mask_rectangle", "mask_rectangles", "mask_rows", "mask_single_pixels", "mask_subarray");
        assertEquals(filters, PluginFactory.getPluginNames(ValueFilter.class));
        assertEquals(masks, PluginFactory.getPluginNames(GeometricMask.class));
        assertEquals(16, PluginFactory.getPluginNames(Masker.class).size());
        assertEquals(16, PluginFactory.getPluginNames().size());
    }

    @Test
    public void testInstantiation() {
        Plugin p = PluginFactory.getPlugin("filter_minimum_value");
        Assert.assertTrue("filter found", p instanceof FilterMinimumValue);
        assertNotSame("new instance each time", p, PluginFactory.getPlugin("filter_minimum_value"));
        assertTrue(PluginFactory.getPlugin(GeometricMask.class, "mask_rectangle") instanceof MaskRectangle);
        assertNull("wrong type", PluginFactory.getPlugin(ValueFilter.class, "mask_rectangle"));
        assertNull("unknown", PluginFactory.getPlugin("filter_everything"));
        assertEquals("mask_rectangle", PluginFactory.getPluginName(MaskRectangle.class));
        assertEquals(MaskRectangle.class, PluginFactory.getPluginClass("mask_rectangle"));
    }

    @Test
    public void testParameterNames() {
        assertEquals("minimum_value", PluginFactory.getPlugin("filter_minimum_value").getParameters()[0].getName());
        Plugin truncation = PluginFactory.getPlugin("filter_gaussian_truncation");
        assertTrue(truncation.getParameter("sigma_multiple")!=null && truncation.getParameter("bin_width")!=null);
        for (String name : PluginFactory.getPluginNames()) {
            Plugin plugin = PluginFactory.getPlugin(name);
            if (plugin instanceof Hint) assertTrue(name+" hint", ((Hint)plugin).getHintText().length()>0);
        }
    }
}
