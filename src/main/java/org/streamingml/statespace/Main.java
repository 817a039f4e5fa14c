package org.streamingml.statespace;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final int EXIT_CONVERGED = 0;
    static final int EXIT_UNCONVERGED = 1;
    static final int EXIT_EVALUATION_FAILED = 2;
    static final int EXIT_CONFIGURATION = 3;

    private static final String USAGE = String.join(System.lineSeparator(),
            "usage:",
            "  fit --ar-order P --ma-order Q --theta0 <csv> --input <path>",
            "      [--max-evaluations N] [--max-iterations N] [--diffuse-scale S] [--restarts R] [--seed S]",
            "  simulate --ar <csv> --ma <csv> --length N --output <path> [--seed S] [--noise-sd SD]");

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        if (args.length == 0) {
            out.println(USAGE);
            return EXIT_CONFIGURATION;
        }
        try {
            Map<String, String> options = parseOptions(args);
            switch (args[0]) {
                case "fit":
                    return fit(options, out);
                case "simulate":
                    return simulate(options, out);
                default:
                    out.println("Unknown command '" + args[0] + "'");
                    out.println(USAGE);
                    return EXIT_CONFIGURATION;
            }
        } catch (ConstructionException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            out.println("error: " + e.getMessage());
            return EXIT_CONFIGURATION;
        } catch (IOException e) {
            LOG.error("I/O failure", e);
            out.println("error: " + e.getMessage());
            return EXIT_CONFIGURATION;
        }
    }

    private static int fit(Map<String, String> options, PrintStream out) throws IOException {

        int p = intOption(options, "ar-order");
        int q = intOption(options, "ma-order");
        double[] theta0 = SeriesReader.parseCsv(required(options, "theta0"));
        Path input = Paths.get(required(options, "input"));

        EstimatorConfig config = EstimatorConfig.load();
        if (options.containsKey("max-evaluations")) {
            config = config.withMaxEvaluations(intOption(options, "max-evaluations"));
        }
        if (options.containsKey("max-iterations")) {
            config = config.withMaxIterations(intOption(options, "max-iterations"));
        }
        if (options.containsKey("diffuse-scale")) {
            config = config.withDiffuseScale(doubleOption(options, "diffuse-scale"));
        }
        LOG.info("Using {}", config);

        double[] series = SeriesReader.read(input);
        EstimationContext context = new EstimationContext(new ArmaOrder(p, q), series);
        ArmaEstimator estimator = new ArmaEstimator(context, config);

        FitResult fit;
        try {
            int restarts = options.containsKey("restarts") ? intOption(options, "restarts") : 1;
            if (restarts > 1) {
                fit = fitWithRestarts(estimator, theta0, restarts, longOption(options, "seed", 42L));
            } else {
                fit = estimator.fit(theta0);
            }
        } catch (EvaluationException e) {
            LOG.error("Likelihood cannot be evaluated at the starting point: {}", e.getMessage());
            out.println("error: likelihood cannot be evaluated at theta0: " + e.getMessage());
            return EXIT_EVALUATION_FAILED;
        }

        print(fit, out);
        return fit.isConverged() ? EXIT_CONVERGED : EXIT_UNCONVERGED;
    }

    // Restarts are theta0 plus uniform jitter in [-0.5, 0.5) per coefficient, the first one is theta0 itself
    private static FitResult fitWithRestarts(ArmaEstimator estimator, double[] theta0, int restarts, long seed) {
        RandomGenerator random = new Well19937c(seed);
        List<double[]> starts = new ArrayList<>(restarts);
        starts.add(theta0.clone());
        for (int i = 1; i < restarts; i++) {
            double[] start = theta0.clone();
            for (int j = 0; j < start.length; j++) {
                start[j] += random.nextDouble() - 0.5;
            }
            starts.add(start);
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(restarts, Runtime.getRuntime().availableProcessors()));
        try {
            return estimator.fitMultiStart(starts, executor);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void print(FitResult fit, PrintStream out) {
        out.println("Estimated AR coefficients:");
        for (double a : fit.getArCoefficients()) {
            out.printf("%f%n", a);
        }
        out.println("Estimated MA coefficients:");
        for (double b : fit.getMaCoefficients()) {
            out.printf("%f%n", b);
        }
        out.println("--------------------------");
        out.println("Status | -LogLik | Sigma2 | AIC | BIC");
        out.printf("%s | %f | %f | %f | %f%n", fit.getStatus(), fit.getNegativeLogLikelihood(),
                fit.getNoiseVariance(), fit.aic(), fit.bic());
        out.println("------------------------------------");
    }

    private static int simulate(Map<String, String> options, PrintStream out) throws IOException {

        double[] ar = SeriesReader.parseCsv(options.getOrDefault("ar", ""));
        double[] ma = SeriesReader.parseCsv(options.getOrDefault("ma", ""));
        int length = intOption(options, "length");
        long seed = longOption(options, "seed", 42L);
        double noiseSd = options.containsKey("noise-sd") ? doubleOption(options, "noise-sd") : 1.0;
        Path output = Paths.get(required(options, "output"));

        double[] series = new ArmaSimulator(ar, ma, noiseSd, seed).simulate(length);
        SeriesWriter.write(output, series);
        out.printf("Wrote %d samples of ARMA(%d,%d) to %s%n", length, ar.length, ma.length, output);
        return EXIT_CONVERGED;
    }

    static Map<String, String> parseOptions(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new ConstructionException("Unexpected argument '" + arg + "'");
            }
            if (i + 1 >= args.length) {
                throw new ConstructionException("Missing value for " + arg);
            }
            options.put(arg.substring(2), args[++i]);
        }
        return options;
    }

    private static String required(Map<String, String> options, String name) {
        String value = options.get(name);
        if (value == null) {
            throw new ConstructionException("Missing required option --" + name);
        }
        return value;
    }

    private static int intOption(Map<String, String> options, String name) {
        try {
            return Integer.parseInt(required(options, name).trim());
        } catch (NumberFormatException e) {
            throw new ConstructionException("Option --" + name + " expects an integer", e);
        }
    }

    private static long longOption(Map<String, String> options, String name, long fallback) {
        if (!options.containsKey(name)) {
            return fallback;
        }
        try {
            return Long.parseLong(options.get(name).trim());
        } catch (NumberFormatException e) {
            throw new ConstructionException("Option --" + name + " expects an integer", e);
        }
    }

    private static double doubleOption(Map<String, String> options, String name) {
        try {
            return Double.parseDouble(required(options, name).trim());
        } catch (NumberFormatException e) {
            throw new ConstructionException("Option --" + name + " expects a number", e);
        }
    }
}
