package org.streamingml.statespace;

import org.apache.commons.math3.analysis.MultivariateFunction;

// Supplies the gradient of an objective to a gradient-based optimizer.
public interface GradientStrategy {

    double[] gradient(MultivariateFunction objective, double[] point);
}
