package org.streamingml.statespace;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Maximum-likelihood estimation of ARMA(p,q) coefficients. The negative concentrated
 * log-likelihood is minimized by the Commons Math non-linear conjugate-gradient optimizer
 * (Polak-Ribiere update with a line search), with gradients from a {@link GradientStrategy}.
 */
public class ArmaEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(ArmaEstimator.class);

    private final ArmaObjectiveFunction objective;
    private final GradientStrategy gradient;
    private final EstimatorConfig config;

    public ArmaEstimator(ArmaObjectiveFunction objective, GradientStrategy gradient, EstimatorConfig config) {
        this.objective = objective;
        this.gradient = gradient;
        this.config = config;
    }

    public ArmaEstimator(EstimationContext context, EstimatorConfig config) {
        this(new ArmaObjectiveFunction(context, config), new CentralDifferenceGradient(config.getGradientStep()), config);
    }

    public ArmaObjectiveFunction getObjective() {
        return objective;
    }

    // Fits the model starting from theta0.
    //
    // A theta0 of the wrong length raises ConstructionException. A theta0 at which the
    // likelihood cannot be evaluated raises the EvaluationException of that evaluation:
    // there is no feasible point to start from. Running out of budget is not an error, the
    // result is flagged UNCONVERGED and carries the best point seen.
    public FitResult fit(double[] theta0) {

        EstimationContext context = objective.getContext();
        ArmaOrder order = context.getOrder();
        order.split(theta0);

        double startValue = objective.evaluate(theta0);
        LOG.info("Fitting {} to {} observations from theta0={} (-logL={})",
                order, context.getLength(), Arrays.toString(theta0), startValue);

        if (order.getParameterCount() == 0) {
            return result(theta0, startValue, FitStatus.CONVERGED, 1, 0);
        }

        BestPointTracker tracker = new BestPointTracker(objective);
        tracker.offer(theta0, startValue);

        NonLinearConjugateGradientOptimizer optimizer = new NonLinearConjugateGradientOptimizer(
                NonLinearConjugateGradientOptimizer.Formula.POLAK_RIBIERE,
                new SimpleValueChecker(config.getRelativeTolerance(), config.getAbsoluteTolerance()));

        try {
            PointValuePair optimum = optimizer.optimize(
                    new MaxEval(config.getMaxEvaluations()),
                    new MaxIter(config.getMaxIterations()),
                    new ObjectiveFunction(tracker),
                    new ObjectiveFunctionGradient(point -> gradient.gradient(tracker, point)),
                    GoalType.MINIMIZE,
                    new InitialGuess(theta0.clone()));

            double[] point = optimum.getPoint();
            double value = optimum.getValue();
            if (!Double.isFinite(value) || tracker.getBestValue() < value) {
                point = tracker.getBestPoint();
                value = tracker.getBestValue();
            }
            FitResult fit = result(point, value, FitStatus.CONVERGED, tracker.getEvaluations(), optimizer.getIterations());
            LOG.info("Converged after {} iterations: {}", fit.getIterations(), fit);
            return fit;

        } catch (MaxCountExceededException e) {
            FitResult fit = result(tracker.getBestPoint(), tracker.getBestValue(), FitStatus.UNCONVERGED,
                    tracker.getEvaluations(), optimizer.getIterations());
            LOG.warn("Optimizer budget exhausted ({}), best point so far: {}", e.getMessage(), fit);
            return fit;
        } catch (MathIllegalStateException e) {
            FitResult fit = result(tracker.getBestPoint(), tracker.getBestValue(), FitStatus.UNCONVERGED,
                    tracker.getEvaluations(), optimizer.getIterations());
            LOG.warn("Optimizer stopped early ({}), best point so far: {}", e.getMessage(), fit);
            return fit;
        }
    }

    // Runs one fit per starting point on the executor and keeps the best converged one,
    // or the best unconverged one if none converged. Starting points whose likelihood cannot
    // be evaluated are skipped; if all of them fail, the last failure is rethrown.
    public FitResult fitMultiStart(List<double[]> starts, ExecutorService executor) {
        if (starts == null || starts.isEmpty()) {
            throw new ConstructionException("At least one starting point is required");
        }
        for (double[] start : starts) {
            objective.getContext().getOrder().split(start);
        }

        List<Callable<FitResult>> fits = new ArrayList<>(starts.size());
        for (double[] start : starts) {
            double[] theta0 = start.clone();
            fits.add(() -> fit(theta0));
        }

        FitResult best = null;
        EvaluationException lastFailure = null;
        try {
            List<Future<FitResult>> futures = executor.invokeAll(fits);
            for (Future<FitResult> future : futures) {
                FitResult candidate;
                try {
                    candidate = future.get();
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof EvaluationException) {
                        lastFailure = (EvaluationException) e.getCause();
                        LOG.warn("Skipping infeasible starting point: {}", lastFailure.getMessage());
                        continue;
                    }
                    if (e.getCause() instanceof RuntimeException) {
                        throw (RuntimeException) e.getCause();
                    }
                    throw new IllegalStateException("Fit failed", e.getCause());
                }
                if (best == null || isBetter(candidate, best)) {
                    best = candidate;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for restarts", e);
        }

        if (best == null) {
            throw lastFailure;
        }
        LOG.info("Best of {} restarts: {}", starts.size(), best);
        return best;
    }

    private static boolean isBetter(FitResult candidate, FitResult incumbent) {
        if (candidate.isConverged() != incumbent.isConverged()) {
            return candidate.isConverged();
        }
        return candidate.getNegativeLogLikelihood() < incumbent.getNegativeLogLikelihood();
    }

    private FitResult result(double[] theta, double value, FitStatus status, int evaluations, int iterations) {
        EstimationContext context = objective.getContext();
        return new FitResult(context.getOrder(), theta, value, objective.profiledVariance(theta),
                context.getLength(), status, evaluations, iterations);
    }
}
