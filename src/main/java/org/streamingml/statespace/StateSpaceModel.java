package org.streamingml.statespace;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;
import org.ejml.simple.SimpleMatrix;

/**
 * State-space form of an ARMA(p,q) model:
 * <pre>
 *   x[t] = F x[t-1] + G eps[t]
 *   y[t] = H x[t]
 * </pre>
 * The matrices are never exposed directly, getters hand out copies.
 */
public final class StateSpaceModel {

    private final ArmaOrder order;
    private final SimpleMatrix transition;   // F, k x k
    private final SimpleMatrix noiseLoading; // G, k x 1
    private final SimpleMatrix observation;  // H, 1 x k

    StateSpaceModel(ArmaOrder order, SimpleMatrix transition, SimpleMatrix noiseLoading, SimpleMatrix observation) {
        int k = order.getStateDimension();
        if (transition.numRows() != k || transition.numCols() != k
                || noiseLoading.numRows() != k || noiseLoading.numCols() != 1
                || observation.numRows() != 1 || observation.numCols() != k) {
            throw new ConstructionException("State-space matrices disagree on dimension " + k);
        }
        this.order = order;
        this.transition = transition;
        this.noiseLoading = noiseLoading;
        this.observation = observation;
    }

    public ArmaOrder getOrder() {
        return order;
    }

    public int getDimension() {
        return transition.numRows();
    }

    public SimpleMatrix getTransition() {
        return transition.copy();
    }

    public SimpleMatrix getNoiseLoading() {
        return noiseLoading.copy();
    }

    public SimpleMatrix getObservation() {
        return observation.copy();
    }

    // package-private views for the recursion, which never writes to them
    SimpleMatrix transition() {
        return transition;
    }

    SimpleMatrix noiseLoading() {
        return noiseLoading;
    }

    SimpleMatrix observation() {
        return observation;
    }

    // Largest eigenvalue modulus of F. The AR part is stationary when this is below one.
    public double spectralRadius() {
        int k = getDimension();
        DMatrixRMaj f = transition.getDDRM().copy();

        EigenDecomposition_F64<DMatrixRMaj> evd = DecompositionFactory_DDRM.eig(k, false);
        if (!evd.decompose(f)) {
            throw new IllegalStateException("Eigen decomposition of the transition matrix failed");
        }
        double radius = 0.0;
        for (int i = 0; i < evd.getNumberOfEigenvalues(); i++) {
            radius = Math.max(radius, evd.getEigenvalue(i).getMagnitude());
        }
        return radius;
    }

    public boolean isStationary() {
        return spectralRadius() < 1.0;
    }
}
