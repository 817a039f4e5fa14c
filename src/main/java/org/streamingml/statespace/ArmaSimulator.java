package org.streamingml.statespace;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Generates synthetic ARMA(p,q) series
 * <pre>
 *   y[t] = sum a[i] y[t-1-i] + eps[t] - sum b[j] eps[t-1-j],   eps ~ N(0, sd^2)
 * </pre>
 * using the same sign convention as {@link StateSpaceBuilder}. A burn-in prefix is generated
 * and dropped so the returned series starts close to the stationary distribution.
 */
public class ArmaSimulator {

    public static final int DEFAULT_BURN_IN = 200;

    private final double[] ar;
    private final double[] ma;
    private final double noiseSd;
    private final RandomGenerator random;

    public ArmaSimulator(double[] ar, double[] ma, double noiseSd, long seed) {
        this(ar, ma, noiseSd, new Well19937c(seed));
    }

    public ArmaSimulator(double[] ar, double[] ma, double noiseSd, RandomGenerator random) {
        if (ar == null || ma == null) {
            throw new ConstructionException("AR and MA coefficients are required");
        }
        if (!(noiseSd >= 0.0)) {
            throw new ConstructionException("Noise standard deviation must not be negative, got " + noiseSd);
        }
        StateSpaceModel model = StateSpaceBuilder.build(ar.length, ma.length, ar, ma);
        if (ar.length > 0 && !model.isStationary()) {
            throw new ConstructionException("AR coefficients are not stationary, spectral radius "
                    + model.spectralRadius());
        }
        this.ar = ar.clone();
        this.ma = ma.clone();
        this.noiseSd = noiseSd;
        this.random = random;
    }

    public double[] simulate(int length) {
        return simulate(length, DEFAULT_BURN_IN);
    }

    public double[] simulate(int length, int burnIn) {
        if (length <= 0 || burnIn < 0) {
            throw new ConstructionException("Series length must be positive and burn-in non-negative");
        }
        int total = length + burnIn;
        double[] y = new double[total];
        double[] eps = new double[total];

        for (int t = 0; t < total; t++) {
            eps[t] = noiseSd * random.nextGaussian();
            double value = eps[t];
            for (int i = 0; i < ar.length && t - 1 - i >= 0; i++) {
                value += ar[i] * y[t - 1 - i];
            }
            for (int j = 0; j < ma.length && t - 1 - j >= 0; j++) {
                value -= ma[j] * eps[t - 1 - j];
            }
            y[t] = value;
        }

        double[] out = new double[length];
        System.arraycopy(y, burnIn, out, 0, length);
        return out;
    }
}
