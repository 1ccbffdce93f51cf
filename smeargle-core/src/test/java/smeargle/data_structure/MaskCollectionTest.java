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

import org.junit.Test;
import smeargle.core.DataShapeException;
import smeargle.image.ImageByte;
import smeargle.image.SimpleImageProperties;
import smeargle.processing.GeometricMasks;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static smeargle.test_utils.TestUtils.assertMask;
import static smeargle.test_utils.TestUtils.mask;

/**
 *
 * @author SMEARGLE developers
 */
public class MaskCollectionTest {

    @Test
    public void testPutAndSynthesize() {
        MaskCollection collection = new MaskCollection();
        assertNull(collection.getProperties());
        ImageByte columns = GeometricMasks.maskColumns(SimpleImageProperties.fromShape(2, 3), 0);
        assertEquals("mask_columns", collection.put("mask_columns", columns));
        assertEquals("mask_columns_2", collection.put("mask_columns", GeometricMasks.maskColumns(columns, 2)));
        assertEquals("mask_rows", collection.put("mask_rows", GeometricMasks.maskRows(columns, 1)));
        assertEquals(Arrays.asList("mask_columns", "mask_columns_2", "mask_rows"), collection.getNames());
        assertSame(columns, collection.get("mask_columns"));
        assertMask("union", new boolean[]{true, false, true, true, true, true}, collection.synthesize());
    }

    @Test(expected = DataShapeException.class)
    public void testShapeMismatch() {
        MaskCollection collection = new MaskCollection();
        collection.put("a", mask(new boolean[6], 2, 3));
        collection.put("b", mask(new boolean[6], 3, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptySynthesis() {
        new MaskCollection().synthesize();
    }
}
