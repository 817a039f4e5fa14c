package org.streamingml.statespace;

import org.ejml.simple.SimpleMatrix;

// Maps AR coefficients a and MA coefficients b to the companion-form matrices (F, G, H).
//
// With k = max(p, q + 1):
//  F: column 0 holds a (rows 0..p-1), F[i][i+1] = 1 for i < k - 1, zero elsewhere
//  G: G[0] = 1, G[i+1] = -b[i] for i < q, zero elsewhere
//  H: H[0] = 1, zero elsewhere
//
// which represents y[t] = sum a[i] y[t-1-i] + eps[t] - sum b[j] eps[t-1-j].
public final class StateSpaceBuilder {

    private StateSpaceBuilder() {}

    public static StateSpaceModel build(int p, int q, double[] ar, double[] ma) {
        if (p < 0 || q < 0) {
            throw new ConstructionException("ARMA orders must be non-negative, got p=" + p + ", q=" + q);
        }
        if (ar == null || ar.length != p) {
            throw new ConstructionException("Expected " + p + " AR coefficients, got " + (ar == null ? "null" : ar.length));
        }
        if (ma == null || ma.length != q) {
            throw new ConstructionException("Expected " + q + " MA coefficients, got " + (ma == null ? "null" : ma.length));
        }
        ArmaOrder order = new ArmaOrder(p, q);
        int k = order.getStateDimension();

        SimpleMatrix f = new SimpleMatrix(k, k);
        for (int i = 0; i < p; i++) {
            f.set(i, 0, ar[i]);
        }
        for (int i = 0; i < k - 1; i++) {
            f.set(i, i + 1, 1.0);
        }

        SimpleMatrix g = new SimpleMatrix(k, 1);
        g.set(0, 0, 1.0);
        for (int i = 0; i < q; i++) {
            g.set(i + 1, 0, -ma[i]);
        }

        SimpleMatrix h = new SimpleMatrix(1, k);
        h.set(0, 0, 1.0);

        return new StateSpaceModel(order, f, g, h);
    }

    public static StateSpaceModel build(ArmaOrder order, double[] theta) {
        double[][] parts = order.split(theta);
        return build(order.getArOrder(), order.getMaOrder(), parts[0], parts[1]);
    }
}
