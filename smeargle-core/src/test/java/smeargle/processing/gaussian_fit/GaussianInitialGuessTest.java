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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.Test;
import smeargle.image.Histogram;
import smeargle.test_utils.TestUtils;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author SMEARGLE developers
 */
public class GaussianInitialGuessTest {

    private static Histogram histogram(long[] counts, double start, double binSize) {
        double[] edges = IntStream.rangeClosed(0, counts.length).mapToDouble(i -> start + i * binSize).toArray();
        return new Histogram(counts, edges, binSize);
    }

    @Test
    public void testFWHMSelection() {
        assertEquals(5, GaussianInitialGuess.extractFWHM(new double[]{3, 5}, 10), 0);
        assertEquals("largest width above count std", 3, GaussianInitialGuess.extractFWHM(new double[]{12, 3}, 10), 0);
        assertNull("single width above count std", GaussianInitialGuess.extractFWHM(new double[]{12}, 10));
        assertNull("no peak", GaussianInitialGuess.extractFWHM(new double[0], 10));
    }

    @Test
    public void testNonNoiseBins() {
        assertArrayEquals(new int[]{1, 2, 3}, GaussianInitialGuess.getNonNoiseBins(new double[]{0, 10, 20, 10, 0}));
        assertArrayEquals("constant counts", new int[]{0, 1, 2}, GaussianInitialGuess.getNonNoiseBins(new double[]{4, 4, 4}));
    }

    @Test
    public void testGaussianProfile() {
        // sigma = 3 bins, bin width 2, peak in bin 20
        long[] counts = IntStream.range(0, 41).mapToLong(i -> Math.round(100 * Math.exp(-Math.pow(i - 20, 2) / 18))).toArray();
        GaussianInitialGuess guess = GaussianInitialGuess.estimate(histogram(counts, 0, 2));
        assertTrue(guess.isPeakFound());
        assertEquals("mean", 41, guess.getMean(), 1e-12);
        assertEquals("amplitude", 100, guess.getAmplitude(), 1e-12);
        assertEquals("stddev", 6, guess.getStddev(), 0.3);
    }

    @Test
    public void testFlatProfile() {
        GaussianInitialGuess guess = GaussianInitialGuess.estimate(histogram(new long[]{5, 5, 5, 5, 5}, 0, 1));
        assertFalse(guess.isPeakFound());
        assertEquals("unit stddev", 1, guess.getStddev(), 1e-12);
        assertEquals("first bin", 0.5, guess.getMean(), 1e-12);
        assertEquals(5, guess.getAmplitude(), 1e-12);
    }

    @Test
    public void testNarrowPeak() {
        // kept bins 3..7: {10, 30, 40, 30, 10}, half prominence width 2.5 bins
        Histogram histogram = histogram(new long[]{0, 0, 0, 10, 30, 40, 30, 10, 0, 0, 0}, 0, 2);
        ListAppender<ILoggingEvent> logs = TestUtils.captureLogs(GaussianInitialGuess.class);
        try {
            GaussianInitialGuess guess = GaussianInitialGuess.estimate(histogram);
            assertTrue(guess.isPeakFound());
            assertEquals("fwhm", 2.5, guess.getFWHM(), 1e-12);
            assertEquals("stddev", 2.5 / GaussianInitialGuess.FWHM_TO_SIGMA * 2, guess.getStddev(), 1e-12);
            assertEquals("mean", 11, guess.getMean(), 1e-12);
            assertEquals("amplitude", 40, guess.getAmplitude(), 1e-12);
            assertTrue("width 2 level", TestUtils.messages(logs, Level.WARN).isEmpty());
        } finally {
            TestUtils.releaseLogs(GaussianInitialGuess.class, logs);
        }
    }

    @Test
    public void testSingleBinPeak() {
        // kept bins 4..6: {10, 40, 10}, half prominence width 1 bin, full prominence width 2 bins
        Histogram histogram = histogram(new long[]{0, 0, 0, 0, 10, 40, 10, 0, 0, 0, 0}, 0, 1);
        ListAppender<ILoggingEvent> logs = TestUtils.captureLogs(GaussianInitialGuess.class);
        try {
            GaussianInitialGuess guess = GaussianInitialGuess.estimate(histogram);
            assertTrue(guess.isPeakFound());
            assertEquals("fwhm", 1, guess.getFWHM(), 1e-12);
            assertEquals("stddev", 1 / GaussianInitialGuess.FWHM_TO_SIGMA, guess.getStddev(), 1e-12);
            assertEquals("mean", 5.5, guess.getMean(), 1e-12);
            assertEquals("amplitude", 40, guess.getAmplitude(), 1e-12);
            List<String> warnings = TestUtils.messages(logs, Level.WARN);
            assertEquals("width 1 level", 1, warnings.size());
            assertTrue(warnings.get(0).contains("wide peaks for estimates"));
        } finally {
            TestUtils.releaseLogs(GaussianInitialGuess.class, logs);
        }
    }
}
