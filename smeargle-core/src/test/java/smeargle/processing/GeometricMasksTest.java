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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.Test;
import smeargle.core.ConfigurationException;
import smeargle.image.ImageByte;
import smeargle.image.ImageProperties;
import smeargle.image.SimpleImageProperties;
import smeargle.test_utils.TestUtils;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static smeargle.test_utils.TestUtils.assertMask;

/**
 *
 * @author SMEARGLE developers
 */
public class GeometricMasksTest {
    // 5 rows x 6 columns
    final ImageProperties props = new SimpleImageProperties("", 5, 6);

    @Test
    public void testRectangleBoundsIncluded() {
        ImageByte res = GeometricMasks.maskRectangle(props, new int[]{2, 4}, new int[]{1, 3});
        assertEquals("count", 3 * 3, res.count());
        for (int y = 0; y<props.sizeY(); ++y) {
            for (int x = 0; x<props.sizeX(); ++x) {
                boolean expected = x>=2 && x<=4 && y>=1 && y<=3;
                assertEquals("row "+y+" column "+x, expected, res.insideMask(x, y, 0));
            }
        }
    }

    @Test
    public void testSubarrayIsComplement() {
        ImageByte rect = GeometricMasks.maskRectangle(props, new int[]{2, 4}, new int[]{1, 3});
        ImageByte sub = GeometricMasks.maskSubarray(props, new int[]{2, 4}, new int[]{1, 3});
        assertEquals(props.sizeXYZ() - rect.count(), sub.count());
        for (int xy = 0; xy<props.sizeXY(); ++xy) assertTrue(rect.insideMask(xy, 0) != sub.insideMask(xy, 0));
    }

    @Test
    public void testRectangles() {
        ImageByte res = GeometricMasks.maskRectangles(props, new int[][]{{0, 0}, {0, 1}}, new int[][]{{0, 1}, {0, 0}});
        assertEquals(3, res.count());
        assertTrue(res.insideMask(0, 0, 0));
        assertTrue(res.insideMask(0, 1, 0));
        assertTrue(res.insideMask(1, 0, 0));
    }

    @Test
    public void testSinglePixels() {
        ImageByte res = GeometricMasks.maskSinglePixels(new SimpleImageProperties("", 2, 3), new int[]{0, 1}, new int[]{2, 0});
        assertMask("pixels (0,2) and (1,0)", new boolean[]{false, false, true, true, false, false}, res);
    }

    @Test
    public void testColumnsAndRows() {
        ImageProperties small = new SimpleImageProperties("", 2, 3);
        assertMask("column 1", new boolean[]{false, true, false, false, true, false}, GeometricMasks.maskColumns(small, 1));
        assertMask("row 1", new boolean[]{false, false, false, true, true, true}, GeometricMasks.maskRows(small, 1));
    }

    @Test
    public void testVacuousMasks() {
        assertEquals("nothing", 0, GeometricMasks.maskNothing(props).count());
        assertEquals("everything", props.sizeXYZ(), GeometricMasks.maskEverything(props).count());
    }

    @Test
    public void testAllPlanes() {
        ImageProperties stack = SimpleImageProperties.fromShape(3, 2, 2);
        ImageByte res = GeometricMasks.maskColumns(stack, 0);
        assertEquals(3 * 2, res.count());
        for (int z = 0; z<stack.sizeZ(); ++z) assertTrue("plane "+z, res.insideMask(0, 1, z));
    }

    @Test(expected = ConfigurationException.class)
    public void testReversedRange() {
        GeometricMasks.maskRectangle(props, new int[]{4, 2}, new int[]{1, 3});
    }

    @Test(expected = ConfigurationException.class)
    public void testRangeOutOfBounds() {
        GeometricMasks.maskRectangle(props, new int[]{2, 6}, new int[]{1, 3});
    }

    @Test(expected = ConfigurationException.class)
    public void testRangeLength() {
        GeometricMasks.maskSubarray(props, new int[]{2}, new int[]{1, 3});
    }

    @Test(expected = ConfigurationException.class)
    public void testSinglePixelsLengthMismatch() {
        GeometricMasks.maskSinglePixels(props, new int[]{0, 1}, new int[]{0});
    }

    @Test(expected = ConfigurationException.class)
    public void testColumnOutOfBounds() {
        GeometricMasks.maskColumns(props, 6);
    }

    @Test
    public void testEmptyMaskNote() {
        ListAppender<ILoggingEvent> logs = TestUtils.captureLogs(GeometricMasks.class);
        try {
            GeometricMasks.maskRectangles(props, new int[0][], new int[0][]);
            List<String> notes = TestUtils.messages(logs, Level.INFO);
            assertEquals(1, notes.size());
            assertTrue(notes.get(0).startsWith("mask_rectangles rejects no pixel"));
            logs.list.clear();
            GeometricMasks.maskNothing(props);
            assertTrue("rejecting nothing is the purpose of mask_nothing", logs.list.isEmpty());
            GeometricMasks.maskColumns(props, 0);
            assertTrue("non empty mask", logs.list.isEmpty());
        } finally {
            TestUtils.releaseLogs(GeometricMasks.class, logs);
        }
    }
}
