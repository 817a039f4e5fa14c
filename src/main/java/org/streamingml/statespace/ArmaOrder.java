package org.streamingml.statespace;

// AR order p and MA order q of an ARMA(p,q) model.
public final class ArmaOrder {

    private final int arOrder;
    private final int maOrder;

    public ArmaOrder(int arOrder, int maOrder) {
        if (arOrder < 0 || maOrder < 0) {
            throw new ConstructionException("ARMA orders must be non-negative, got p=" + arOrder + ", q=" + maOrder);
        }
        this.arOrder = arOrder;
        this.maOrder = maOrder;
    }

    public int getArOrder() {
        return arOrder;
    }

    public int getMaOrder() {
        return maOrder;
    }

    // Length of the coefficient vector theta = (a, b)
    public int getParameterCount() {
        return arOrder + maOrder;
    }

    // Dimension of the state vector, the smallest one holding both the AR depth and the MA lags plus one
    public int getStateDimension() {
        return Math.max(arOrder, maOrder + 1);
    }

    // Split theta into its AR part (index 0) and MA part (index 1)
    public double[][] split(double[] theta) {
        if (theta == null || theta.length != getParameterCount()) {
            throw new ConstructionException("Coefficient vector must have length " + getParameterCount()
                    + ", got " + (theta == null ? "null" : theta.length));
        }
        double[] ar = new double[arOrder];
        double[] ma = new double[maOrder];
        System.arraycopy(theta, 0, ar, 0, arOrder);
        System.arraycopy(theta, arOrder, ma, 0, maOrder);
        return new double[][]{ar, ma};
    }

    // Inverse of split
    public double[] join(double[] ar, double[] ma) {
        if (ar == null || ar.length != arOrder || ma == null || ma.length != maOrder) {
            throw new ConstructionException("Expected " + arOrder + " AR and " + maOrder + " MA coefficients");
        }
        double[] theta = new double[getParameterCount()];
        System.arraycopy(ar, 0, theta, 0, arOrder);
        System.arraycopy(ma, 0, theta, arOrder, maOrder);
        return theta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArmaOrder)) return false;
        ArmaOrder other = (ArmaOrder) o;
        return arOrder == other.arOrder && maOrder == other.maOrder;
    }

    @Override
    public int hashCode() {
        return 31 * arOrder + maOrder;
    }

    @Override
    public String toString() {
        return "ARMA(" + arOrder + "," + maOrder + ")";
    }
}
