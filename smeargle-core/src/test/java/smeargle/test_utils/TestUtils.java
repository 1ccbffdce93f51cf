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
package smeargle.test_utils;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smeargle.image.Image;
import smeargle.image.ImageByte;
import smeargle.image.ImageDouble;
import smeargle.image.ImageMask;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author SMEARGLE developers
 */
public class TestUtils {
    public static final Logger logger = LoggerFactory.getLogger(TestUtils.class);

    /**
     *
     * @param count
     * @return the first {@param count} prime numbers
     */
    public static double[] primes(int count) {
        double[] res = new double[count];
        int found = 0;
        for (int k = 2; found<count; ++k) {
            boolean prime = true;
            for (int i = 0; i<found && res[i]*res[i]<=k; ++i) {
                if (k % (int)res[i] == 0) {
                    prime = false;
                    break;
                }
            }
            if (prime) res[found++] = k;
        }
        return res;
    }

    /**
     *
     * @param rows
     * @param columns
     * @return image filled row by row with the first rows x columns primes
     */
    public static ImageDouble primeImage(int rows, int columns) {
        return ImageDouble.fromFlatArray("primes", primes(rows * columns), rows, columns);
    }

    /**
     *
     * @param image
     * @param mask
     * @return sum of log10 of pixels of {@param image} that {@param mask} does not reject
     */
    public static double sumLog10Unmasked(Image image, ImageMask mask) {
        double sum = 0;
        for (int z = 0; z<image.sizeZ(); ++z) {
            for (int xy = 0; xy<image.sizeXY(); ++xy) {
                if (!mask.insideMask(xy, z)) sum += Math.log10(image.getPixel(xy, z));
            }
        }
        return sum;
    }

    /**
     * Values whose histogram with unit bins follows round(100 exp(-(k-50)^2/50)) plus a random count in [0; 2], for k in [20; 80].
     * Values of bin k are spread evenly within [k; k+1), so the underlying distribution has mean 50.5 and standard deviation close to 5
     * @param seed
     * @return values
     */
    public static double[] gaussianSample(long seed) {
        Random random = new Random(seed);
        List<Double> values = new ArrayList<>();
        for (int k = 20; k<=80; ++k) {
            int count = (int)Math.round(100 * Math.exp(-Math.pow(k - 50, 2) / 50)) + random.nextInt(3);
            for (int j = 0; j<count; ++j) values.add(k + (j + 0.5) / count);
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public static ImageByte mask(boolean[] values, int... shape) {
        return ImageByte.fromBooleans("mask", values, shape);
    }

    public static void assertMask(String message, boolean[] expected, ImageMask actual) {
        boolean[] act = new boolean[actual.sizeXYZ()];
        ImageMask.loop(actual, (xy, z) -> act[xy + z * actual.sizeXY()] = true);
        assertArrayEquals(message, expected, act);
    }

    public static void assertSameMask(String message, ImageMask expected, ImageMask actual) {
        assertTrue(message+": shape", expected.sameDimensions(actual));
        for (int z = 0; z<expected.sizeZ(); ++z) {
            for (int xy = 0; xy<expected.sizeXY(); ++xy) assertEquals(message+": pixel "+xy+" plane "+z, expected.insideMask(xy, z), actual.insideMask(xy, z));
        }
    }

    /**
     * Records events logged by the logger of {@param clazz} until {@link #releaseLogs(Class, ListAppender)} is called
     * @param clazz
     * @return started appender
     */
    public static ListAppender<ILoggingEvent> captureLogs(Class<?> clazz) {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        ((ch.qos.logback.classic.Logger)LoggerFactory.getLogger(clazz)).addAppender(appender);
        return appender;
    }

    public static void releaseLogs(Class<?> clazz, ListAppender<ILoggingEvent> appender) {
        ((ch.qos.logback.classic.Logger)LoggerFactory.getLogger(clazz)).detachAppender(appender);
        appender.stop();
    }

    public static List<String> messages(ListAppender<ILoggingEvent> appender, Level level) {
        return appender.list.stream().filter(e -> e.getLevel().equals(level)).map(ILoggingEvent::getFormattedMessage).collect(Collectors.toList());
    }
}
