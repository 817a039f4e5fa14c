package org.streamingml.statespace;

import java.util.Arrays;

// Fixed inputs of one estimation run: the model orders and the observed series.
// Immutable, so any number of objective evaluations may share it across threads.
public final class EstimationContext {

    private final ArmaOrder order;
    private final double[] observations;

    public EstimationContext(ArmaOrder order, double[] observations) {
        if (order == null) {
            throw new ConstructionException("Model order is required");
        }
        if (observations == null || observations.length == 0) {
            throw new ConstructionException("Observation sequence must not be empty");
        }
        this.order = order;
        this.observations = observations.clone();
    }

    public ArmaOrder getOrder() {
        return order;
    }

    public int getLength() {
        return observations.length;
    }

    public double[] getObservations() {
        return observations.clone();
    }

    @Override
    public String toString() {
        return "EstimationContext{" + order + ", N=" + observations.length
                + ", head=" + Arrays.toString(Arrays.copyOf(observations, Math.min(3, observations.length))) + "}";
    }
}
