package org.streamingml.statespace;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class CentralDifferenceGradientTest {

    private static final MultivariateFunction QUADRATIC = x -> 3 * x[0] * x[0] + x[0] * x[1] - 2 * x[1];

    @Test
    void matchesAnalyticGradientOfQuadratic() {
        double[] grad = new CentralDifferenceGradient(1e-5).gradient(QUADRATIC, new double[]{1.5, -2.0});

        assertEquals(6 * 1.5 - 2.0, grad[0], 1e-6);
        assertEquals(1.5 - 2.0, grad[1], 1e-6);
    }

    @Test
    void fallsBackToOneSidedDifferenceAtFeasibilityEdge() {
        MultivariateFunction wall = x -> x[0] < 1.0 ? x[0] * x[0] : Double.POSITIVE_INFINITY;

        double[] grad = new CentralDifferenceGradient(1e-5).gradient(wall, new double[]{1.0 - 1e-6});

        assertEquals(2.0, grad[0], 1e-3);
    }

    @Test
    void reportsZeroWhenNoProbeIsFeasible() {
        MultivariateFunction nowhere = x -> Double.POSITIVE_INFINITY;

        double[] grad = new CentralDifferenceGradient(1e-5).gradient(nowhere, new double[]{0.3, 0.4});

        assertArrayEquals(new double[]{0.0, 0.0}, grad, 0.0);
    }

    @Test
    void parallelProbesGiveTheSameGradient() {
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            double[] point = {0.7, 1.1};
            double[] sequential = new CentralDifferenceGradient(1e-5).gradient(QUADRATIC, point);
            double[] parallel = new CentralDifferenceGradient(1e-5, executor).gradient(QUADRATIC, point);

            assertArrayEquals(sequential, parallel, 0.0);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void gradientOfLikelihoodVanishesNearTheOptimum() {
        double[] series = new ArmaSimulator(new double[]{0.5}, new double[0], 1.0, 17L).simulate(500);
        ArmaObjectiveFunction f = new ArmaObjectiveFunction(
                new EstimationContext(new ArmaOrder(1, 0), series), EstimatorConfig.load());
        CentralDifferenceGradient gradient = new CentralDifferenceGradient(1e-5);

        // the slope points downhill towards the estimate from both sides
        assertTrue(gradient.gradient(f, new double[]{-0.2})[0] < 0.0);
        assertTrue(gradient.gradient(f, new double[]{0.95})[0] > 0.0);
    }

    @Test
    void rejectsNonPositiveStep() {
        assertThrows(ConstructionException.class, () -> new CentralDifferenceGradient(0.0));
    }
}
