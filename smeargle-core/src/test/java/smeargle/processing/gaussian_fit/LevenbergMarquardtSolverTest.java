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

import org.apache.commons.math3.analysis.function.Gaussian;
import org.junit.Test;

import java.util.stream.IntStream;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 *
 * @author SMEARGLE developers
 */
public class LevenbergMarquardtSolverTest {

    @Test
    public void testExactGaussian() {
        Gaussian g = new Gaussian(10, 20, 4);
        double[] x = IntStream.range(0, 41).mapToDouble(i -> i).toArray();
        double[] y = IntStream.range(0, 41).mapToDouble(i -> g.value(i)).toArray();
        LevenbergMarquardtSolver.Solution solution = new LevenbergMarquardtSolver().solve(x, y, new double[]{8, 18, 5}, new Gaussian.Parametric());
        assertTrue("converged", solution.converged);
        assertArrayEquals(new double[]{10, 20, 4}, solution.parameters, 1e-5);
        assertEquals(0, solution.chiSquared, 1e-10);
    }

    @Test
    public void testRejectedSteps() {
        Gaussian g = new Gaussian(5, 2, 1);
        double[] x = IntStream.range(0, 11).mapToDouble(i -> i * 0.5).toArray();
        double[] y = IntStream.range(0, 11).mapToDouble(i -> g.value(i * 0.5)).toArray();
        LevenbergMarquardtSolver.Solution solution = new LevenbergMarquardtSolver().solve(x, y, new double[]{4, 2.5, 1.5}, new Gaussian.Parametric(), a -> a[2] > 0);
        assertTrue("sigma stays positive", solution.parameters[2] > 0);
        assertArrayEquals(new double[]{5, 2, 1}, solution.parameters, 1e-5);
    }

    @Test
    public void testIterationLimit() {
        Gaussian g = new Gaussian(10, 20, 4);
        double[] x = IntStream.range(0, 41).mapToDouble(i -> i).toArray();
        double[] y = IntStream.range(0, 41).mapToDouble(i -> g.value(i)).toArray();
        LevenbergMarquardtSolver.Solution solution = new LevenbergMarquardtSolver(2, 1e-3, 1e-10).solve(x, y, new double[]{8, 18, 5}, new Gaussian.Parametric());
        assertEquals(2, solution.iterations);
        assertTrue("not converged", !solution.converged);
        assertTrue("never worse", solution.chiSquared <= LevenbergMarquardtSolver.chiSquared(x, new double[]{8, 18, 5}, y, new Gaussian.Parametric()));
    }
}
