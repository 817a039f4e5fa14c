package org.streamingml.statespace;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Negative concentrated log-likelihood of an ARMA(p,q) model as a function of its
 * coefficient vector {@code theta = (a, b)}, for one fixed observed series.
 *
 * <p>{@link #evaluate(double[])} reports failed evaluations as exceptions. {@link #value(double[])}
 * is the optimizer-facing variant: an infeasible candidate (unstable recursion, log of a
 * non-positive variance, overflow) evaluates to {@code +Infinity} so a line search simply
 * backs away from it.
 */
public class ArmaObjectiveFunction implements MultivariateFunction {

    private static final Logger LOG = LoggerFactory.getLogger(ArmaObjectiveFunction.class);

    private final EstimationContext context;
    private final KalmanFilterRecursion recursion;
    private final LikelihoodEvaluator likelihood;

    public ArmaObjectiveFunction(EstimationContext context, KalmanFilterRecursion recursion, LikelihoodEvaluator likelihood) {
        this.context = context;
        this.recursion = recursion;
        this.likelihood = likelihood;
    }

    public ArmaObjectiveFunction(EstimationContext context, EstimatorConfig config) {
        this(context, new KalmanFilterRecursion(config), new LikelihoodEvaluator());
    }

    public EstimationContext getContext() {
        return context;
    }

    public int getDimension() {
        return context.getOrder().getParameterCount();
    }

    public InnovationSequence innovations(double[] theta) {
        StateSpaceModel model = StateSpaceBuilder.build(context.getOrder(), theta);
        return recursion.filter(model, context.getObservations());
    }

    public double evaluate(double[] theta) {
        double nll = likelihood.negativeLogLikelihood(innovations(theta));
        if (!Double.isFinite(nll)) {
            throw new LikelihoodDomainException("Likelihood is not finite: " + nll);
        }
        return nll;
    }

    @Override
    public double value(double[] theta) {
        try {
            return evaluate(theta);
        } catch (EvaluationException e) {
            LOG.debug("Rejected candidate {}: {}", theta, e.getMessage());
            return Double.POSITIVE_INFINITY;
        }
    }

    public double profiledVariance(double[] theta) {
        return likelihood.profiledVariance(innovations(theta));
    }
}
