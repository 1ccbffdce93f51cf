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
package smeargle.processing.gaussian_fit;

import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

/**
 *
 * @author SMEARGLE developers
 */
public class PeakFinderTest {
    final double[] signal = new double[]{0, 1, 3, 1, 0, 2, 2, 2, 0};

    @Test
    public void testLocalMaxima() {
        // plateau 5-7 is reported at its middle
        assertArrayEquals(new int[]{2, 6}, PeakFinder.localMaxima(signal));
        assertArrayEquals("borders are never peaks", new int[0], PeakFinder.localMaxima(new double[]{3, 2, 1, 2, 3}));
        assertArrayEquals("flat", new int[0], PeakFinder.localMaxima(new double[]{1, 1, 1, 1}));
    }

    @Test
    public void testProminenceAndWidth() {
        PeakFinder.Peak p = PeakFinder.describePeak(signal, 2, 0.5);
        assertEquals(3, p.prominence, 1e-12);
        assertEquals(0, p.leftBase);
        assertEquals(4, p.rightBase);
        assertEquals(1.25, p.leftPosition, 1e-12);
        assertEquals(2.75, p.rightPosition, 1e-12);
        assertEquals(1.5, p.width, 1e-12);
        PeakFinder.Peak plateau = PeakFinder.describePeak(signal, 6, 0.5);
        assertEquals(2, plateau.prominence, 1e-12);
        assertEquals(3, plateau.width, 1e-12);
        assertEquals("width at base", 4, PeakFinder.describePeak(signal, 2, 1).width, 1e-12);
    }

    @Test
    public void testWidthSelection() {
        List<PeakFinder.Peak> peaks = PeakFinder.findPeaks(signal, 2, 0.5);
        assertEquals(1, peaks.size());
        assertEquals(6, peaks.get(0).index);
        assertEquals(2, PeakFinder.findPeaks(signal, 1, 0.5).size());
        assertArrayEquals(new double[]{4, 4}, PeakFinder.getWidths(signal, PeakFinder.findPeaks(signal, 1, 0.5), 1), 1e-12);
    }
}
