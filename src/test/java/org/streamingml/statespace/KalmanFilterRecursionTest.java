package org.streamingml.statespace;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;
import org.ejml.simple.SimpleMatrix;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KalmanFilterRecursionTest {

    private static final double[] HALVING = {1.0, 0.5, 0.25, 0.125};

    private final KalmanFilterRecursion recursion = new KalmanFilterRecursion(100.0, 1e-12);

    @Test
    void innovationsVanishAfterFirstStepForExactAutoregression() {
        StateSpaceModel model = StateSpaceBuilder.build(1, 0, new double[]{0.5}, new double[0]);

        InnovationSequence out = recursion.filter(model, HALVING);

        assertEquals(4, out.length());
        // diffuse prior: nothing is predicted for the first value
        assertEquals(1.0, out.innovation(0), 0.0);
        assertEquals(0.5 * 100.0 * 0.5 + 1.0, out.variance(0), 1e-12);
        for (int t = 1; t < out.length(); t++) {
            assertEquals(0.0, out.innovation(t), 1e-12, "step " + t);
            assertEquals(1.0, out.variance(t), 1e-12, "step " + t);
        }
    }

    @Test
    void innovationsFollowOneStepForecastErrorsForWrongCoefficient() {
        StateSpaceModel model = StateSpaceBuilder.build(1, 0, new double[]{0.2}, new double[0]);

        InnovationSequence out = recursion.filter(model, HALVING);

        for (int t = 1; t < HALVING.length; t++) {
            assertEquals(HALVING[t] - 0.2 * HALVING[t - 1], out.innovation(t), 1e-12);
        }
    }

    @Test
    void everyCallStartsFromTheDiffusePrior() {
        StateSpaceModel model = StateSpaceBuilder.build(3, 2, new double[]{0.5, -0.3, 0.1}, new double[]{0.4, 0.2});
        double[] series = new ArmaSimulator(new double[]{0.5, -0.3, 0.1}, new double[]{0.4, 0.2}, 1.0, 11L).simulate(200);

        InnovationSequence first = recursion.filter(model, series);
        InnovationSequence second = recursion.filter(model, series);

        assertArrayEquals(first.getInnovations(), second.getInnovations(), 0.0);
        assertArrayEquals(first.getVariances(), second.getVariances(), 0.0);
    }

    @Test
    void predictedCovarianceStaysSymmetricPositiveSemiDefinite() {
        assertCovarianceValid(new double[]{0.5, 0.3}, new double[0], 500);
        assertCovarianceValid(new double[]{0.5, -0.3, 0.1}, new double[]{0.4, 0.2}, 500);
        assertCovarianceValid(new double[]{0.9}, new double[0], 50);
    }

    private void assertCovarianceValid(double[] ar, double[] ma, int length) {
        StateSpaceModel model = StateSpaceBuilder.build(ar.length, ma.length, ar, ma);
        double[] series = new ArmaSimulator(ar, ma, 1.0, 3L).simulate(length);
        List<SimpleMatrix> predicted = new ArrayList<>();

        recursion.filter(model, series, (step, covariance) -> predicted.add(covariance));

        assertEquals(length, predicted.size());
        for (int t = 0; t < predicted.size(); t++) {
            SimpleMatrix v = predicted.get(t);
            double scale = Math.max(1.0, v.elementMaxAbs());
            for (int i = 0; i < v.numRows(); i++) {
                for (int j = 0; j < i; j++) {
                    assertEquals(v.get(i, j), v.get(j, i), 1e-9 * scale, "asymmetric at step " + t);
                }
            }
            DMatrixRMaj symmetric = v.plus(v.transpose()).scale(0.5).getDDRM().copy();
            EigenDecomposition_F64<DMatrixRMaj> evd = DecompositionFactory_DDRM.eig(v.numRows(), false);
            assertTrue(evd.decompose(symmetric));
            for (int i = 0; i < evd.getNumberOfEigenvalues(); i++) {
                assertTrue(evd.getEigenvalue(i).getReal() > -1e-9 * scale, "negative eigenvalue at step " + t);
            }
        }
    }

    @Test
    void overflowingCovarianceIsReportedAsInstability() {
        StateSpaceModel model = StateSpaceBuilder.build(1, 0, new double[]{1e200}, new double[0]);

        NumericalInstabilityException e = assertThrows(NumericalInstabilityException.class,
                () -> recursion.filter(model, HALVING));

        assertEquals(0, e.getStep());
    }

    @Test
    void varianceAtOrBelowEpsilonIsRejected() {
        KalmanFilterRecursion strict = new KalmanFilterRecursion(100.0, 1e6);
        StateSpaceModel model = StateSpaceBuilder.build(1, 0, new double[]{0.5}, new double[0]);

        NumericalInstabilityException e = assertThrows(NumericalInstabilityException.class,
                () -> strict.filter(model, HALVING));

        assertEquals(0, e.getStep());
        assertEquals(26.0, e.getVariance(), 1e-12);
    }

    @Test
    void rejectsNonPositiveDiffuseScale() {
        assertThrows(ConstructionException.class, () -> new KalmanFilterRecursion(0.0, 1e-12));
    }

    @Test
    void rejectsNegativeOrUndefinedVarianceEpsilon() {
        assertThrows(ConstructionException.class, () -> new KalmanFilterRecursion(100.0, -1e-12));
        assertThrows(ConstructionException.class, () -> new KalmanFilterRecursion(100.0, Double.NaN));
        assertThrows(ConstructionException.class, () -> new KalmanFilterRecursion(100.0, Double.POSITIVE_INFINITY));
        new KalmanFilterRecursion(100.0, 0.0);
    }
}
