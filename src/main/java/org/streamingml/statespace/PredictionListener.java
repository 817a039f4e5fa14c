package org.streamingml.statespace;

import org.ejml.simple.SimpleMatrix;

// Observes the predicted state covariance at every step of a forward pass.
@FunctionalInterface
public interface PredictionListener {

    PredictionListener NONE = (step, predictedCovariance) -> { };

    void onPrediction(int step, SimpleMatrix predictedCovariance);
}
