package org.streamingml.statespace;

import org.apache.commons.math3.analysis.MultivariateFunction;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Central finite-difference gradient with step {@code h_i = step * max(1, |x_i|)}.
 *
 * <p>Near the edge of the feasible region one of the two probes may evaluate to
 * {@code +Infinity}. The coordinate then falls back to a one-sided difference against the
 * centre value, and to zero when neither side is usable.
 *
 * <p>With an executor the 2n probes are evaluated concurrently; the objective must be
 * thread-safe, which {@link ArmaObjectiveFunction} is.
 */
public class CentralDifferenceGradient implements GradientStrategy {

    private final double step;
    private final ExecutorService executor;

    public CentralDifferenceGradient(double step) {
        this(step, null);
    }

    public CentralDifferenceGradient(double step, ExecutorService executor) {
        if (!(step > 0.0)) {
            throw new ConstructionException("Finite-difference step must be positive, got " + step);
        }
        this.step = step;
        this.executor = executor;
    }

    @Override
    public double[] gradient(MultivariateFunction objective, double[] point) {
        int n = point.length;
        double[] steps = new double[n];
        List<Callable<Double>> probes = new ArrayList<>(2 * n);
        for (int i = 0; i < n; i++) {
            steps[i] = step * Math.max(1.0, Math.abs(point[i]));
            probes.add(probe(objective, point, i, steps[i]));
            probes.add(probe(objective, point, i, -steps[i]));
        }

        double[] values = evaluate(probes);

        double[] grad = new double[n];
        double centre = Double.NaN;
        for (int i = 0; i < n; i++) {
            double plus = values[2 * i];
            double minus = values[2 * i + 1];
            if (Double.isFinite(plus) && Double.isFinite(minus)) {
                grad[i] = (plus - minus) / (2.0 * steps[i]);
                continue;
            }
            if (Double.isNaN(centre)) {
                centre = objective.value(point.clone());
            }
            if (Double.isFinite(centre) && Double.isFinite(plus)) {
                grad[i] = (plus - centre) / steps[i];
            } else if (Double.isFinite(centre) && Double.isFinite(minus)) {
                grad[i] = (centre - minus) / steps[i];
            } else {
                grad[i] = 0.0;
            }
        }
        return grad;
    }

    private static Callable<Double> probe(MultivariateFunction objective, double[] point, int index, double delta) {
        return () -> {
            double[] shifted = point.clone();
            shifted[index] += delta;
            return objective.value(shifted);
        };
    }

    private double[] evaluate(List<Callable<Double>> probes) {
        double[] values = new double[probes.size()];
        try {
            if (executor == null) {
                for (int i = 0; i < values.length; i++) {
                    values[i] = probes.get(i).call();
                }
            } else {
                List<Future<Double>> futures = executor.invokeAll(probes);
                for (int i = 0; i < values.length; i++) {
                    values[i] = futures.get(i).get();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while evaluating gradient probes", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Gradient probe failed", e.getCause());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Gradient probe failed", e);
        }
        return values;
    }
}
