package org.streamingml.statespace;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Numerical settings of the estimator. Defaults come from {@code estimator.properties} on the
 * classpath; a run may override single values through the {@code with...} copies.
 *
 * <p>The diffuse prior scale (initial state covariance {@code scale * I}) is a plain large
 * multiple of the identity, not the stationary covariance of the model. It is kept at 100
 * by default so results match the reference calibration.
 */
public final class EstimatorConfig {

    public static final String RESOURCE = "estimator.properties";

    private final double diffuseScale;
    private final double varianceEpsilon;
    private final double gradientStep;
    private final int maxEvaluations;
    private final int maxIterations;
    private final double relativeTolerance;
    private final double absoluteTolerance;

    public EstimatorConfig(double diffuseScale, double varianceEpsilon, double gradientStep,
                           int maxEvaluations, int maxIterations,
                           double relativeTolerance, double absoluteTolerance) {
        if (!(diffuseScale > 0.0)) {
            throw new ConstructionException("Diffuse prior scale must be positive, got " + diffuseScale);
        }
        if (!(varianceEpsilon >= 0.0) || Double.isInfinite(varianceEpsilon)) {
            throw new ConstructionException("Variance epsilon must be a non-negative number, got " + varianceEpsilon);
        }
        if (!(gradientStep > 0.0)) {
            throw new ConstructionException("Gradient step must be positive, got " + gradientStep);
        }
        if (maxEvaluations <= 0 || maxIterations <= 0) {
            throw new ConstructionException("Optimizer budget must be positive");
        }
        this.diffuseScale = diffuseScale;
        this.varianceEpsilon = varianceEpsilon;
        this.gradientStep = gradientStep;
        this.maxEvaluations = maxEvaluations;
        this.maxIterations = maxIterations;
        this.relativeTolerance = relativeTolerance;
        this.absoluteTolerance = absoluteTolerance;
    }

    // Load the packaged defaults
    public static EstimatorConfig load() {
        Properties props = new Properties();
        try (InputStream in = EstimatorConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read " + RESOURCE, e);
        }
        return fromProperties(props);
    }

    public static EstimatorConfig fromProperties(Properties props) {
        try {
            return new EstimatorConfig(
                    Double.parseDouble(require(props, "filter.diffuseScale")),
                    Double.parseDouble(require(props, "filter.varianceEpsilon")),
                    Double.parseDouble(require(props, "gradient.relativeStep")),
                    Integer.parseInt(require(props, "optimizer.maxEvaluations")),
                    Integer.parseInt(require(props, "optimizer.maxIterations")),
                    Double.parseDouble(require(props, "optimizer.relativeTolerance")),
                    Double.parseDouble(require(props, "optimizer.absoluteTolerance")));
        } catch (NumberFormatException e) {
            throw new ConstructionException("Malformed estimator property: " + e.getMessage(), e);
        }
    }

    private static String require(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null) {
            throw new ConstructionException("Missing estimator property " + key);
        }
        return value.trim();
    }

    public double getDiffuseScale() {
        return diffuseScale;
    }

    public double getVarianceEpsilon() {
        return varianceEpsilon;
    }

    public double getGradientStep() {
        return gradientStep;
    }

    public int getMaxEvaluations() {
        return maxEvaluations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getRelativeTolerance() {
        return relativeTolerance;
    }

    public double getAbsoluteTolerance() {
        return absoluteTolerance;
    }

    public EstimatorConfig withDiffuseScale(double scale) {
        return new EstimatorConfig(scale, varianceEpsilon, gradientStep, maxEvaluations, maxIterations,
                relativeTolerance, absoluteTolerance);
    }

    public EstimatorConfig withMaxEvaluations(int evaluations) {
        return new EstimatorConfig(diffuseScale, varianceEpsilon, gradientStep, evaluations, maxIterations,
                relativeTolerance, absoluteTolerance);
    }

    public EstimatorConfig withMaxIterations(int iterations) {
        return new EstimatorConfig(diffuseScale, varianceEpsilon, gradientStep, maxEvaluations, iterations,
                relativeTolerance, absoluteTolerance);
    }

    @Override
    public String toString() {
        return "EstimatorConfig{diffuseScale=" + diffuseScale
                + ", varianceEpsilon=" + varianceEpsilon
                + ", gradientStep=" + gradientStep
                + ", maxEvaluations=" + maxEvaluations
                + ", maxIterations=" + maxIterations
                + ", relativeTolerance=" + relativeTolerance
                + ", absoluteTolerance=" + absoluteTolerance + "}";
    }
}
