package org.streamingml.statespace;

import org.ejml.simple.SimpleMatrix;

/**
 * Forward Kalman pass over an observed series for a model in state-space form.
 *
 * <p>Every call starts from the diffuse prior {@code x = 0, V = scale * I} and allocates its own
 * state, so one instance can serve concurrent evaluations.
 */
public class KalmanFilterRecursion {

    private final double diffuseScale;
    private final double varianceEpsilon;

    public KalmanFilterRecursion(double diffuseScale, double varianceEpsilon) {
        if (!(diffuseScale > 0.0)) {
            throw new ConstructionException("Diffuse prior scale must be positive, got " + diffuseScale);
        }
        if (!(varianceEpsilon >= 0.0) || Double.isInfinite(varianceEpsilon)) {
            throw new ConstructionException("Variance epsilon must be a non-negative number, got " + varianceEpsilon);
        }
        this.diffuseScale = diffuseScale;
        this.varianceEpsilon = varianceEpsilon;
    }

    public KalmanFilterRecursion(EstimatorConfig config) {
        this(config.getDiffuseScale(), config.getVarianceEpsilon());
    }

    public InnovationSequence filter(StateSpaceModel model, double[] series) {
        return filter(model, series, PredictionListener.NONE);
    }

    // Runs the recursion
    //
    //  predict:    xPred = F x,            vPred = F V F' + G G'
    //  innovation: e[t] = y[t] - H xPred,  r[t] = H vPred H'
    //  gain:       K = vPred H' / r[t]
    //  update:     x = xPred + K e[t],     V = (I - K H) vPred
    //
    // and fails on the first step whose innovation variance is not positive.
    public InnovationSequence filter(StateSpaceModel model, double[] series, PredictionListener listener) {

        int k = model.getDimension();
        int len = series.length;

        SimpleMatrix f = model.transition();
        SimpleMatrix fT = f.transpose();
        SimpleMatrix h = model.observation();
        SimpleMatrix hT = h.transpose();
        SimpleMatrix gGt = model.noiseLoading().mult(model.noiseLoading().transpose());
        SimpleMatrix eye = SimpleMatrix.identity(k);

        // diffuse prior
        SimpleMatrix x = new SimpleMatrix(k, 1);
        SimpleMatrix v = SimpleMatrix.identity(k).scale(diffuseScale);

        double[] innovations = new double[len];
        double[] variances = new double[len];

        for (int t = 0; t < len; t++) {
            SimpleMatrix xPred = f.mult(x);
            SimpleMatrix vPred = f.mult(v).mult(fT).plus(gGt);
            if (listener != PredictionListener.NONE) {
                listener.onPrediction(t, vPred.copy());
            }

            double e = series[t] - h.mult(xPred).get(0);
            double r = h.mult(vPred).mult(hT).get(0);
            if (!(r > varianceEpsilon) || Double.isInfinite(r)) {
                throw new NumericalInstabilityException(t, r);
            }
            innovations[t] = e;
            variances[t] = r;

            SimpleMatrix gain = vPred.mult(hT).divide(r);
            x = xPred.plus(gain.scale(e));
            v = eye.minus(gain.mult(h)).mult(vPred);
        }
        return new InnovationSequence(innovations, variances);
    }
}
