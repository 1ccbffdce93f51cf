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

import org.junit.Test;
import smeargle.core.DataShapeException;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author SMEARGLE developers
 */
public class ImageTest {

    @Test
    public void testShape() {
        ImageDouble image = ImageDouble.fromFlatArray("stack", new double[24], 2, 3, 4);
        assertEquals(4, image.sizeX());
        assertEquals(3, image.sizeY());
        assertEquals(2, image.sizeZ());
        assertArrayEquals(new int[]{2, 3, 4}, image.getShape());
        ImageDouble rows = ImageDouble.fromRows("rows", new double[][]{{1, 2, 3}, {4, 5, 6}});
        assertEquals(6, rows.getPixel(2, 1, 0), 0);
        assertEquals(4, rows.getPixel(3, 0), 0);
    }

    @Test
    public void testCreateImage() {
        assertTrue(Image.createImage("", new float[]{1, 2, 3, 4}, 2, 2) instanceof ImageFloat);
        assertTrue(Image.createImage("", new byte[]{1, 0, 0, 1}, 2, 2) instanceof ImageByte);
        assertEquals(3, Image.createImage("", new double[]{1, 2, 3, 4}, 2, 2).getPixel(0, 1, 0), 0);
    }

    @Test
    public void testMaskExport() {
        ImageByte mask = ImageByte.fromBooleans("", new boolean[]{true, false, false, true, true, false}, 2, 3);
        assertArrayEquals(new int[]{1, 0, 0, 1, 1, 0}, mask.toIntArray());
        assertEquals(3, mask.count());
        mask.invert();
        assertArrayEquals(new boolean[]{false, true, true, false, false, true}, mask.toBooleanArray());
    }

    @Test
    public void testDuplicateKeepsMask() {
        ImageDouble image = ImageDouble.fromFlatArray("", new double[]{1, 2, 3, 4}, 2, 2);
        image.setMask(ImageByte.fromBooleans("", new boolean[]{true, false, false, false}, 2, 2));
        ImageDouble dup = image.duplicate();
        dup.setPixel(0, 0, 10);
        assertEquals(1, image.getPixel(0, 0), 0);
        assertTrue(dup.isMasked(0, 0));
        assertArrayEquals(new double[]{2, 3, 4}, image.streamValid().toArray(), 0);
    }

    @Test(expected = DataShapeException.class)
    public void testLengthMismatch() {
        ImageDouble.fromFlatArray("", new double[5], 2, 3);
    }

    @Test(expected = DataShapeException.class)
    public void testRaggedRows() {
        ImageDouble.fromRows("", new double[][]{{1, 2}, {3}});
    }

    @Test(expected = DataShapeException.class)
    public void testMaskShapeMismatch() {
        ImageDouble.fromFlatArray("", new double[6], 2, 3).setMask(new ImageByte("", new SimpleImageProperties("", 3, 2)));
    }

    @Test(expected = DataShapeException.class)
    public void testOneDimensionalShape() {
        new SimpleImageProperties("", 5);
    }
}
