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
package smeargle.plugins.plugins;

import org.junit.Test;
import smeargle.configuration.RuntimeConfiguration;
import smeargle.core.ConfigurationException;
import smeargle.data_structure.MaskCollection;
import smeargle.data_structure.SigmaMultiple;
import smeargle.image.ImageByte;
import smeargle.image.ImageDouble;
import smeargle.plugins.plugins.filters.*;
import smeargle.plugins.plugins.masks.*;
import smeargle.processing.GeometricMasks;
import smeargle.processing.ValueFilters;
import smeargle.test_utils.TestUtils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static smeargle.test_utils.TestUtils.assertMask;
import static smeargle.test_utils.TestUtils.assertSameMask;

/**
 *
 * @author SMEARGLE developers
 */
public class MaskersTest {
    final ImageDouble primes = TestUtils.primeImage(7, 7);

    @Test
    public void testFilters() {
        assertSameMask("minimum", ValueFilters.filterMinimumValue(primes, 101), new FilterMinimumValue(101).computeMask(primes));
        assertSameMask("maximum", ValueFilters.filterMaximumValue(primes, 113), new FilterMaximumValue(113).computeMask(primes));
        assertSameMask("sigma", ValueFilters.filterSigmaValue(primes, 1, 0.5), new FilterSigmaValue(SigmaMultiple.asymmetric(1, 0.5)).computeMask(primes));
        assertSameMask("pixel truncation", ValueFilters.filterPixelTruncation(primes, 13, 9), new FilterPixelTruncation(13, 9).computeMask(primes));
        assertSameMask("percent truncation", ValueFilters.filterPixelTruncation(primes, 18, 9), new FilterPercentTruncation(0.35, 0.2).computeMask(primes));
        assertEquals("invalid", 0, new FilterInvalidValue().computeMask(primes).count());
    }

    @Test
    public void testExactValueTolerance() {
        ImageDouble data = ImageDouble.fromFlatArray("", new double[]{1, 1.0005, 1.01}, 1, 3);
        FilterExactValue filter = new FilterExactValue(1);
        assertMask("default tolerance", new boolean[]{true, false, false}, filter.computeMask(data));
        filter.setRuntimeConfiguration(new RuntimeConfiguration().setFloatEqualityTolerance(1e-3));
        assertMask("configured tolerance", new boolean[]{true, true, false}, filter.computeMask(data));
    }

    @Test
    public void testGeometricMasks() {
        assertSameMask("rectangle", GeometricMasks.maskRectangle(primes, new int[]{2, 4}, new int[]{1, 3}), new MaskRectangle(new int[]{2, 4}, new int[]{1, 3}).computeMask(primes));
        assertSameMask("subarray", GeometricMasks.maskSubarray(primes, new int[]{2, 4}, new int[]{1, 3}), new MaskSubarray(new int[]{2, 4}, new int[]{1, 3}).computeMask(primes));
        assertEquals("rectangles", 3 + 4, new MaskRectangles(new int[][]{{0, 2}, {5, 6}}, new int[][]{{0, 0}, {3, 4}}).computeMask(primes).count());
        assertEquals("single pixels", 2, new MaskSinglePixels(new int[]{0, 6}, new int[]{6, 0}).computeMask(primes).count());
        assertEquals("columns", 14, new MaskColumns(0, 3).computeMask(primes).count());
        assertEquals("rows", 7, new MaskRows(5).computeMask(primes).count());
        assertEquals("nothing", 0, new MaskNothing().computeMask(primes).count());
        assertEquals("everything", 49, new MaskEverything().computeMask(primes).count());
    }

    @Test
    public void testGeometricMasksIgnorePriorMask() {
        ImageDouble data = primes.duplicate();
        data.setMask(GeometricMasks.maskEverything(data));
        assertEquals(7, new MaskRows(0).computeMask(data).count());
    }

    @Test
    public void testAddTo() {
        MaskCollection collection = new MaskCollection();
        assertEquals("filter_minimum_value", new FilterMinimumValue(101).addTo(collection, primes));
        assertEquals("filter_minimum_value_2", new FilterMinimumValue(3).addTo(collection, primes));
        assertEquals("mask_columns", new MaskColumns(0).addTo(collection, primes));
        ImageByte minimum = collection.get("filter_minimum_value");
        assertEquals(25, minimum.count());
        assertEquals(1, collection.get("filter_minimum_value_2").count());
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingParameter() {
        new FilterMinimumValue().computeMask(primes);
    }

    @Test(expected = ConfigurationException.class)
    public void testInvalidRange() {
        new MaskRectangle(new int[]{4, 2}, new int[]{1, 3}).computeMask(primes);
    }

    @Test
    public void testMismatchedRectangles() {
        try {
            new MaskRectangles(new int[][]{{0, 2}}, new int[][]{{0, 0}, {3, 4}}).computeMask(primes);
            throw new AssertionError("rectangle count mismatch should be detected");
        } catch (ConfigurationException e) {
            assertTrue(e.getMessage().contains("same number"));
        }
    }
}
