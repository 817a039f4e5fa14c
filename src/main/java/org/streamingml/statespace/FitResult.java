package org.streamingml.statespace;

import java.util.Arrays;

/**
 * Outcome of one likelihood maximization: the estimated coefficients, the negative
 * log-likelihood there, and whether the optimizer actually converged.
 */
public final class FitResult {

    private final ArmaOrder order;
    private final double[] theta;
    private final double negativeLogLikelihood;
    private final double noiseVariance;
    private final int observations;
    private final FitStatus status;
    private final int evaluations;
    private final int iterations;

    public FitResult(ArmaOrder order, double[] theta, double negativeLogLikelihood, double noiseVariance,
                     int observations, FitStatus status, int evaluations, int iterations) {
        this.order = order;
        this.theta = theta.clone();
        this.negativeLogLikelihood = negativeLogLikelihood;
        this.noiseVariance = noiseVariance;
        this.observations = observations;
        this.status = status;
        this.evaluations = evaluations;
        this.iterations = iterations;
    }

    public ArmaOrder getOrder() {
        return order;
    }

    public double[] getTheta() {
        return theta.clone();
    }

    public double[] getArCoefficients() {
        return order.split(theta)[0];
    }

    public double[] getMaCoefficients() {
        return order.split(theta)[1];
    }

    public double getNegativeLogLikelihood() {
        return negativeLogLikelihood;
    }

    // Profiled estimate of the innovation noise variance at theta
    public double getNoiseVariance() {
        return noiseVariance;
    }

    public int getObservations() {
        return observations;
    }

    public FitStatus getStatus() {
        return status;
    }

    public boolean isConverged() {
        return status == FitStatus.CONVERGED;
    }

    // Objective evaluations made during the fit, gradient probes included
    public int getEvaluations() {
        return evaluations;
    }

    public int getIterations() {
        return iterations;
    }

    // Free parameters: p + q coefficients plus the profiled noise variance
    public int getFreeParameters() {
        return order.getParameterCount() + 1;
    }

    public double aic() {
        return 2.0 * negativeLogLikelihood + 2.0 * getFreeParameters();
    }

    public double bic() {
        return 2.0 * negativeLogLikelihood + Math.log(observations) * getFreeParameters();
    }

    @Override
    public String toString() {
        return "FitResult{" + order
                + ", status=" + status
                + ", ar=" + Arrays.toString(getArCoefficients())
                + ", ma=" + Arrays.toString(getMaCoefficients())
                + ", -logL=" + negativeLogLikelihood
                + ", sigma2=" + noiseVariance
                + ", evaluations=" + evaluations
                + ", iterations=" + iterations + "}";
    }
}
