package org.streamingml.statespace;

// One-step-ahead forecast errors e[t] and their predictive variances r[t] from one forward pass.
public final class InnovationSequence {

    private final double[] innovations;
    private final double[] variances;

    InnovationSequence(double[] innovations, double[] variances) {
        if (innovations.length != variances.length) {
            throw new IllegalArgumentException("Innovation and variance sequences differ in length");
        }
        this.innovations = innovations;
        this.variances = variances;
    }

    public static InnovationSequence of(double[] innovations, double[] variances) {
        return new InnovationSequence(innovations.clone(), variances.clone());
    }

    public int length() {
        return innovations.length;
    }

    public double innovation(int t) {
        return innovations[t];
    }

    public double variance(int t) {
        return variances[t];
    }

    public double[] getInnovations() {
        return innovations.clone();
    }

    public double[] getVariances() {
        return variances.clone();
    }
}
