/*
 * Copyright 2026 Velora Contributors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.velora.ensemble.runner;

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import com.velora.ensemble.AnomalyEnsemble;
import com.velora.ensemble.config.EnsembleWeights;
import com.velora.ensemble.config.ImputationMethod;
import com.velora.ensemble.config.KernelType;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "anomaly-ensemble-1.0.0.jar";

    public static final String SCALE_GAMMA = "scale";

    public static final double DEFAULT_ALERT_THRESHOLD = 80.0;

    public static final long DEFAULT_RANDOM_SEED = 42;

    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final StringArgument input;
    private final StringArgument output;
    private final StringArgument timestampColumn;
    private final DoubleArgument trainFraction;
    private final IntegerArgument numberOfTrees;
    private final IntegerArgument subsampleSize;
    private final DoubleArgument contamination;
    private final DoubleArgument nu;
    private final StringArgument kernel;
    private final StringArgument gamma;
    private final DoubleArgument varianceRetained;
    private final DoubleArgument isolationWeight;
    private final DoubleArgument subspaceWeight;
    private final DoubleArgument boundaryWeight;
    private final IntegerArgument topFeatures;
    private final StringArgument imputation;
    private final LongArgument randomSeed;
    private final StringArgument delimiter;
    private final StringArgument outputFormat;
    private final BooleanArgument parallelExecution;
    private final DoubleArgument alertThreshold;

    /**
     * Create a new ArgumentParser. The runner class and runner description will
     * be used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        input = new StringArgument("-i", "--input", "File to read the input table from, or '-' for stdin.", "-");
        addArgument(input);

        output = new StringArgument("-o", "--output", "File to write the output table to, or '-' for stdout.", "-");
        addArgument(output);

        timestampColumn = new StringArgument("-t", "--timestamp-column", "Name of the column that orders records.",
                AnomalyEnsemble.DEFAULT_TIMESTAMP_COLUMN, s -> checkArgument(!s.isEmpty(),
                        "timestamp column should not be empty"));
        addArgument(timestampColumn);

        trainFraction = new DoubleArgument("-f", "--train-fraction",
                "Share of the oldest records used for training.", AnomalyEnsemble.DEFAULT_TRAIN_FRACTION,
                x -> checkArgument(x > 0 && x < 1, "train fraction should be between 0 and 1"));
        addArgument(trainFraction);

        numberOfTrees = new IntegerArgument("-n", "--number-of-trees", "Number of trees in the isolation forest.",
                AnomalyEnsemble.DEFAULT_NUMBER_OF_TREES,
                n -> checkArgument(n > 0, "number of trees should be greater than 0"));
        addArgument(numberOfTrees);

        subsampleSize = new IntegerArgument("-s", "--subsample-size",
                "Number of training records each isolation tree is grown on.", AnomalyEnsemble.DEFAULT_SUBSAMPLE_SIZE,
                n -> checkArgument(n > 0, "subsample size should be greater than 0"));
        addArgument(subsampleSize);

        contamination = new DoubleArgument("-c", "--contamination",
                "Expected share of anomalies, used for the isolation threshold.",
                AnomalyEnsemble.DEFAULT_CONTAMINATION,
                x -> checkArgument(x > 0 && x <= 0.5, "contamination should be in (0, 0.5]"));
        addArgument(contamination);

        nu = new DoubleArgument(null, "--nu", "Share of training records allowed outside the one-class boundary.",
                AnomalyEnsemble.DEFAULT_NU, x -> checkArgument(x > 0 && x < 1, "nu should be between 0 and 1"));
        addArgument(nu);

        kernel = new StringArgument("-k", "--kernel", "Kernel of the one-class boundary: rbf, linear, poly, sigmoid.",
                "rbf", s -> parseKernel(s));
        addArgument(kernel);

        gamma = new StringArgument(null, "--gamma", "Kernel coefficient, or 'scale' to derive it from the data.",
                SCALE_GAMMA, s -> parseGamma(s));
        addArgument(gamma);

        varianceRetained = new DoubleArgument(null, "--variance-retained",
                "Share of variance the principal subspace must explain.", AnomalyEnsemble.DEFAULT_VARIANCE_RETAINED,
                x -> checkArgument(x > 0 && x < 1, "variance retained should be between 0 and 1"));
        addArgument(varianceRetained);

        isolationWeight = new DoubleArgument(null, "--isolation-weight", "Weight of the isolation score.",
                EnsembleWeights.DEFAULT_ISOLATION_WEIGHT);
        addArgument(isolationWeight);

        subspaceWeight = new DoubleArgument(null, "--subspace-weight", "Weight of the subspace score.",
                EnsembleWeights.DEFAULT_SUBSPACE_WEIGHT);
        addArgument(subspaceWeight);

        boundaryWeight = new DoubleArgument(null, "--boundary-weight", "Weight of the boundary score.",
                EnsembleWeights.DEFAULT_BOUNDARY_WEIGHT);
        addArgument(boundaryWeight);

        topFeatures = new IntegerArgument(null, "--top-features", "Number of highest-variance features to copy.",
                AnomalyEnsemble.DEFAULT_TOP_FEATURES,
                n -> checkArgument(n >= 0, "top features should be greater than or equal to 0"));
        addArgument(topFeatures);

        imputation = new StringArgument(null, "--imputation",
                "Fill missing test cells with the partition-mean or the training-mean.", "partition-mean",
                s -> parseImputation(s));
        addArgument(imputation);

        randomSeed = new LongArgument(null, "--random-seed", "Random seed of the isolation forest.",
                DEFAULT_RANDOM_SEED);
        addArgument(randomSeed);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",", s -> checkArgument(!s.isEmpty(), "delimiter should not be empty"));
        addArgument(delimiter);

        outputFormat = new StringArgument(null, "--output-format", "Format of the output table: csv or json.", "csv",
                s -> checkArgument("csv".equals(s) || "json".equals(s), "output format should be csv or json"));
        addArgument(outputFormat);

        parallelExecution = new BooleanArgument("-p", "--parallel-execution",
                "Set to 'true' to fit and score the detectors in parallel.", false);
        addArgument(parallelExecution);

        alertThreshold = new DoubleArgument("-a", "--alert-threshold",
                "Composite score above which records are reported in the log.", DEFAULT_ALERT_THRESHOLD,
                x -> checkArgument(x >= 0 && x <= 100, "alert threshold should be between 0 and 100"));
        addArgument(alertThreshold);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (RuntimeException e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -jar %s [options] < input_file > output_file", ARCHIVE_NAME));
        System.out.println(String.format("       (main class %s)", runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    /**
     * @return a builder holding every pipeline option of the command line
     */
    public AnomalyEnsemble.Builder<?> toBuilder() {
        AnomalyEnsemble.Builder<?> builder = AnomalyEnsemble.builder().timestampColumn(getTimestampColumn())
                .trainFraction(getTrainFraction()).numberOfTrees(getNumberOfTrees())
                .subsampleSize(getSubsampleSize()).contamination(getContamination()).nu(getNu())
                .kernel(getKernel()).varianceRetained(getVarianceRetained()).weights(getWeights())
                .topFeatures(getTopFeatures()).imputationMethod(getImputationMethod())
                .parallelExecutionEnabled(getParallelExecution()).randomSeed(getRandomSeed());
        getGamma().ifPresent(builder::gamma);
        return builder;
    }

    static KernelType parseKernel(String value) {
        String name = value.trim().toUpperCase(Locale.ROOT);
        if ("POLY".equals(name)) {
            return KernelType.POLYNOMIAL;
        }
        return KernelType.valueOf(name);
    }

    static Optional<Double> parseGamma(String value) {
        if (SCALE_GAMMA.equals(value)) {
            return Optional.empty();
        }
        double gamma = Double.parseDouble(value);
        checkArgument(Double.isFinite(gamma) && gamma > 0, "gamma should be 'scale' or greater than 0");
        return Optional.of(gamma);
    }

    static ImputationMethod parseImputation(String value) {
        return ImputationMethod.valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }

    /**
     * @return the input file name, or '-' for stdin
     */
    public String getInput() {
        return input.getValue();
    }

    /**
     * @return the output file name, or '-' for stdout
     */
    public String getOutput() {
        return output.getValue();
    }

    public String getTimestampColumn() {
        return timestampColumn.getValue();
    }

    public double getTrainFraction() {
        return trainFraction.getValue();
    }

    public int getNumberOfTrees() {
        return numberOfTrees.getValue();
    }

    public int getSubsampleSize() {
        return subsampleSize.getValue();
    }

    public double getContamination() {
        return contamination.getValue();
    }

    public double getNu() {
        return nu.getValue();
    }

    public KernelType getKernel() {
        return parseKernel(kernel.getValue());
    }

    /**
     * @return the fixed gamma, or empty for the data-derived "scale" gamma
     */
    public Optional<Double> getGamma() {
        return parseGamma(gamma.getValue());
    }

    public double getVarianceRetained() {
        return varianceRetained.getValue();
    }

    /**
     * @return the detector weights
     * @throws com.velora.ensemble.exception.InvalidWeightsException if the three
     *                                                               weights do not
     *                                                               sum to 1
     */
    public EnsembleWeights getWeights() {
        return EnsembleWeights.of(isolationWeight.getValue(), subspaceWeight.getValue(), boundaryWeight.getValue());
    }

    public int getTopFeatures() {
        return topFeatures.getValue();
    }

    public ImputationMethod getImputationMethod() {
        return parseImputation(imputation.getValue());
    }

    public long getRandomSeed() {
        return randomSeed.getValue();
    }

    public String getDelimiter() {
        return delimiter.getValue();
    }

    public String getOutputFormat() {
        return outputFormat.getValue();
    }

    public boolean getParallelExecution() {
        return parallelExecution.getValue();
    }

    public double getAlertThreshold() {
        return alertThreshold.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue,
                Consumer<String> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, x -> x, validateFunction);
        }

        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }

        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt);
        }
    }

    public static class LongArgument extends Argument<Long> {
        public LongArgument(String shortFlag, String longFlag, String description, long defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Long::parseLong);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }

        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble);
        }
    }
}
