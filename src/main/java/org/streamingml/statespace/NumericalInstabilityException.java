package org.streamingml.statespace;

// The predictive variance of an innovation collapsed to (or below) zero during the recursion.
public class NumericalInstabilityException extends EvaluationException {

    private final int step;
    private final double variance;

    public NumericalInstabilityException(int step, double variance) {
        super("Non-positive innovation variance " + variance + " at step " + step);
        this.step = step;
        this.variance = variance;
    }

    public int getStep() {
        return step;
    }

    public double getVariance() {
        return variance;
    }
}
