package org.streamingml.statespace;

import org.apache.commons.math3.analysis.MultivariateFunction;

import java.util.concurrent.atomic.AtomicInteger;

// Passes evaluations through to an objective and remembers the lowest finite value seen.
// One tracker belongs to one fit; it lets an interrupted optimization still report its best point.
class BestPointTracker implements MultivariateFunction {

    private final MultivariateFunction objective;
    private final AtomicInteger evaluations = new AtomicInteger();

    private double[] bestPoint;
    private double bestValue = Double.POSITIVE_INFINITY;

    BestPointTracker(MultivariateFunction objective) {
        this.objective = objective;
    }

    @Override
    public double value(double[] point) {
        double value = objective.value(point);
        evaluations.incrementAndGet();
        offer(point, value);
        return value;
    }

    synchronized void offer(double[] point, double value) {
        if (Double.isFinite(value) && (bestPoint == null || value < bestValue)) {
            bestPoint = point.clone();
            bestValue = value;
        }
    }

    synchronized double[] getBestPoint() {
        return bestPoint == null ? null : bestPoint.clone();
    }

    synchronized double getBestValue() {
        return bestValue;
    }

    int getEvaluations() {
        return evaluations.get();
    }
}
