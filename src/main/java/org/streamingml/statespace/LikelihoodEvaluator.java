package org.streamingml.statespace;

/**
 * Concentrated Gaussian likelihood of an innovation sequence. The noise variance is profiled
 * out analytically,
 * <pre>
 *   sigma2 = (1/N) sum e[t]^2 / r[t]
 *   log L  = -0.5 (N log 2pi + N log sigma2 + sum log r[t] + N)
 * </pre>
 * so only the shape of the model (its coefficients) is left to optimize.
 */
public class LikelihoodEvaluator {

    private static final double LOG_TWO_PI = Math.log(2.0 * Math.PI);

    public double profiledVariance(InnovationSequence innovations) {
        int n = innovations.length();
        if (n == 0) {
            throw new LikelihoodDomainException("Empty innovation sequence");
        }
        double sum = 0.0;
        for (int t = 0; t < n; t++) {
            double r = innovations.variance(t);
            if (!(r > 0.0)) {
                throw new LikelihoodDomainException("Non-positive innovation variance " + r + " at step " + t);
            }
            double e = innovations.innovation(t);
            sum += e * e / r;
        }
        return sum / n;
    }

    // Returns -log L, the minimization target
    public double negativeLogLikelihood(InnovationSequence innovations) {
        int n = innovations.length();
        double sigma2 = profiledVariance(innovations);
        if (!(sigma2 > 0.0) || Double.isInfinite(sigma2)) {
            throw new LikelihoodDomainException("Profiled noise variance " + sigma2 + " is outside the domain of log");
        }

        double sumLogVar = 0.0;
        for (int t = 0; t < n; t++) {
            sumLogVar += Math.log(innovations.variance(t));
        }
        double logLik = -0.5 * (n * LOG_TWO_PI + n * Math.log(sigma2) + sumLogVar + n);
        return -logLik;
    }
}
