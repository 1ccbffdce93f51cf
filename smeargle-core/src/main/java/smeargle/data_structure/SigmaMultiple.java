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

import smeargle.core.ConfigurationException;

import java.util.Arrays;

/**
 * Multiple of the standard deviation defining an acceptance range around a mean: either the same below and above ({@link Symmetric}) or distinct ({@link Asymmetric}).
 * @author SMEARGLE developers
 */
public abstract class SigmaMultiple {

    private SigmaMultiple() {}

    public abstract double getLow();
    public abstract double getHigh();
    /**
     *
     * @return values accepted by {@link #of(double...)} to rebuild this instance
     */
    public abstract double[] toArray();

    /**
     *
     * @param mean
     * @param stddev
     * @return accepted range [mean - low * stddev ; mean + high * stddev]
     */
    public double[] getRange(double mean, double stddev) {
        return new double[]{mean - getLow() * stddev, mean + getHigh() * stddev};
    }

    public static Symmetric symmetric(double value) {
        return new Symmetric(value);
    }

    public static Asymmetric asymmetric(double low, double high) {
        return new Asymmetric(low, high);
    }

    /**
     *
     * @param values one value (symmetric) or two values (low, high)
     * @return sigma multiple
     */
    public static SigmaMultiple of(double... values) {
        if (values==null) throw new ConfigurationException("Sigma multiple cannot be null");
        switch (values.length) {
            case 1:
                return symmetric(values[0]);
            case 2:
                return asymmetric(values[0], values[1]);
            default:
                throw new ConfigurationException("Sigma multiple should have one (symmetric) or two (low, high) values, got: "+Arrays.toString(values));
        }
    }

    private static void check(double value) {
        if (!Double.isFinite(value) || value<0) throw new ConfigurationException("Sigma multiple must be finite and positive, got: "+value);
    }

    public static final class Symmetric extends SigmaMultiple {
        private final double value;
        private Symmetric(double value) {
            check(value);
            this.value = value;
        }
        public double getValue() {
            return value;
        }
        @Override
        public double getLow() {
            return value;
        }
        @Override
        public double getHigh() {
            return value;
        }
        @Override
        public double[] toArray() {
            return new double[]{value};
        }
        @Override
        public boolean equals(Object o) {
            return o instanceof Symmetric && ((Symmetric)o).value==value;
        }
        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }
        @Override
        public String toString() {
            return "Symmetric("+value+")";
        }
    }

    public static final class Asymmetric extends SigmaMultiple {
        private final double low, high;
        private Asymmetric(double low, double high) {
            check(low);
            check(high);
            this.low = low;
            this.high = high;
        }
        @Override
        public double getLow() {
            return low;
        }
        @Override
        public double getHigh() {
            return high;
        }
        @Override
        public double[] toArray() {
            return new double[]{low, high};
        }
        @Override
        public boolean equals(Object o) {
            return o instanceof Asymmetric && ((Asymmetric)o).low==low && ((Asymmetric)o).high==high;
        }
        @Override
        public int hashCode() {
            return 31 * Double.hashCode(low) + Double.hashCode(high);
        }
        @Override
        public String toString() {
            return "Asymmetric("+low+", "+high+")";
        }
    }
}
