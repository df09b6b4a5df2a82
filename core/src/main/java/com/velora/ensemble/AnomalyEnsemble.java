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

package com.velora.ensemble;

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;
import static com.velora.ensemble.CommonUtils.checkOpenFraction;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import lombok.extern.slf4j.Slf4j;

import com.velora.ensemble.config.EnsembleWeights;
import com.velora.ensemble.config.ImputationMethod;
import com.velora.ensemble.config.KernelType;
import com.velora.ensemble.dataset.Dataset;
import com.velora.ensemble.dataset.TemporalSplit;
import com.velora.ensemble.dataset.TemporalSplitter;
import com.velora.ensemble.detector.BoundaryDensityDetector;
import com.velora.ensemble.detector.DetectorBank;
import com.velora.ensemble.detector.IAnomalyDetector;
import com.velora.ensemble.detector.IsolationForestDetector;
import com.velora.ensemble.detector.SubspaceReconstructionDetector;
import com.velora.ensemble.inspect.FeatureRanker;
import com.velora.ensemble.output.OutputAssembler;
import com.velora.ensemble.output.OutputTable;
import com.velora.ensemble.preprocessor.DataPreparer;
import com.velora.ensemble.preprocessor.FeatureMatrix;
import com.velora.ensemble.preprocessor.FeatureScaler;
import com.velora.ensemble.returntypes.EnsembleResult;
import com.velora.ensemble.returntypes.RawScores;
import com.velora.ensemble.scoring.Ensembler;
import com.velora.ensemble.scoring.Scorer;

/**
 * The AnomalyEnsemble class is the entry point of the pipeline. A call to
 * {@link #score(Dataset)} splits the dataset in time, prepares and scales the
 * numeric features, fits an isolation forest, a principal subspace model and a
 * one-class boundary on the training partition, and scores every test record
 * with a weighted combination of the three detectors on a 0 to 100 scale.
 * <p>
 * An AnomalyEnsemble holds configuration only. All fitted state is created
 * inside a call to {@code score} and discarded when it returns, so the same
 * instance can score any number of datasets, and the same dataset with the
 * same random seed always yields the same scores.
 */
@Slf4j
public class AnomalyEnsemble {

    /**
     * Default name of the column that orders the records in time.
     */
    public static final String DEFAULT_TIMESTAMP_COLUMN = TemporalSplitter.DEFAULT_TIMESTAMP_COLUMN;

    /**
     * Default share of the (time-ordered) records used for training.
     */
    public static final double DEFAULT_TRAIN_FRACTION = TemporalSplitter.DEFAULT_TRAIN_FRACTION;

    public static final int DEFAULT_NUMBER_OF_TREES = IsolationForestDetector.DEFAULT_NUMBER_OF_TREES;

    public static final int DEFAULT_SUBSAMPLE_SIZE = IsolationForestDetector.DEFAULT_SUBSAMPLE_SIZE;

    /**
     * Default expected share of anomalies, used by the isolation forest threshold.
     */
    public static final double DEFAULT_CONTAMINATION = IsolationForestDetector.DEFAULT_CONTAMINATION;

    public static final double DEFAULT_NU = BoundaryDensityDetector.DEFAULT_NU;

    public static final KernelType DEFAULT_KERNEL = BoundaryDensityDetector.DEFAULT_KERNEL;

    public static final double DEFAULT_VARIANCE_RETAINED = SubspaceReconstructionDetector.DEFAULT_VARIANCE_RETAINED;

    public static final int DEFAULT_TOP_FEATURES = FeatureRanker.DEFAULT_TOP_FEATURES;

    public static final ImputationMethod DEFAULT_IMPUTATION_METHOD = ImputationMethod.PARTITION_MEAN;

    /**
     * Detectors are fitted one after another unless parallel execution is enabled.
     */
    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = false;

    private final String timestampColumn;
    private final double trainFraction;
    private final int numberOfTrees;
    private final int subsampleSize;
    private final double contamination;
    private final double nu;
    private final KernelType kernel;
    private final Optional<Double> gamma;
    private final double varianceRetained;
    private final EnsembleWeights weights;
    private final int topFeatures;
    private final ImputationMethod imputationMethod;
    private final boolean parallelExecutionEnabled;
    private final int threadPoolSize;
    private final long randomSeed;

    protected AnomalyEnsemble(Builder<?> builder) {
        checkNotNull(builder.timestampColumn, "timestampColumn must not be null");
        checkArgument(!builder.timestampColumn.isEmpty(), "timestampColumn must not be empty");
        checkOpenFraction(builder.trainFraction, "trainFraction must be in (0, 1)");
        checkArgument(builder.numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(builder.subsampleSize > 0, "subsampleSize must be greater than 0");
        checkArgument(builder.contamination > 0 && builder.contamination <= 0.5, "contamination must be in (0, 0.5]");
        checkOpenFraction(builder.nu, "nu must be in (0, 1)");
        checkNotNull(builder.kernel, "kernel must not be null");
        builder.gamma.ifPresent(g -> checkArgument(Double.isFinite(g) && g > 0, "gamma must be greater than 0"));
        checkOpenFraction(builder.varianceRetained, "varianceRetained must be in (0, 1)");
        checkNotNull(builder.weights, "weights must not be null");
        checkArgument(builder.topFeatures >= 0, "topFeatures must be greater than or equal to 0");
        checkNotNull(builder.imputationMethod, "imputationMethod must not be null");
        builder.threadPoolSize.ifPresent(n -> checkArgument(n > 0, "threadPoolSize must be greater than 0"));

        timestampColumn = builder.timestampColumn;
        trainFraction = builder.trainFraction;
        numberOfTrees = builder.numberOfTrees;
        subsampleSize = builder.subsampleSize;
        contamination = builder.contamination;
        nu = builder.nu;
        kernel = builder.kernel;
        gamma = builder.gamma;
        varianceRetained = builder.varianceRetained;
        weights = builder.weights;
        topFeatures = builder.topFeatures;
        imputationMethod = builder.imputationMethod;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        randomSeed = builder.getRandom().nextLong();

        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize
                    .orElse(Math.max(1, Math.min(3, Runtime.getRuntime().availableProcessors() - 1)));
        } else {
            threadPoolSize = 0;
        }
    }

    /**
     * @return a new AnomalyEnsemble builder.
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Scores the most recent part of a dataset against a model of its earlier
     * part.
     *
     * @param dataset records with a timestamp column and at least one numeric
     *                column
     * @return the augmented test records and diagnostics
     * @throws com.velora.ensemble.exception.AnomalyEnsembleException if the data
     *                                                                cannot be
     *                                                                split,
     *                                                                prepared or
     *                                                                modelled
     */
    public EnsembleResult score(Dataset dataset) {
        checkNotNull(dataset, "dataset must not be null");

        TemporalSplit split = new TemporalSplitter(timestampColumn, trainFraction).split(dataset);
        Dataset train = split.getTrain();
        Dataset test = split.getTest();

        DataPreparer preparer = new DataPreparer(timestampColumn, imputationMethod);
        FeatureMatrix trainMatrix = preparer.prepare(train);
        FeatureMatrix testMatrix = preparer.prepare(test, trainMatrix);
        log.info("Using {} features: {}", trainMatrix.getNumberOfFeatures(), trainMatrix.getFeatureNames());

        FeatureScaler scaler = new FeatureScaler().fit(trainMatrix);
        FeatureMatrix scaledTrain = scaler.transform(trainMatrix);
        FeatureMatrix scaledTest = scaler.transform(testMatrix);

        IsolationForestDetector isolation = new IsolationForestDetector(numberOfTrees, subsampleSize, contamination,
                randomSeed);
        SubspaceReconstructionDetector subspace = new SubspaceReconstructionDetector(varianceRetained);
        BoundaryDensityDetector boundary = new BoundaryDensityDetector(nu, kernel, gamma);
        List<IAnomalyDetector> detectors = Arrays.asList(isolation, subspace, boundary);

        RawScores raw;
        try (DetectorBank bank = new DetectorBank(detectors, parallelExecutionEnabled, Math.max(1, threadPoolSize))) {
            bank.fit(scaledTrain);
            raw = new Scorer(bank).score(scaledTest);
        }
        log.info("Retained {} principal components; {} support vectors", subspace.getNumberOfComponents(),
                boundary.getNumberOfSupportVectors());

        double[] composite = new Ensembler(weights).combine(raw);
        List<String> ranked = new FeatureRanker(topFeatures).rank(scaledTrain);
        log.info("Top features by variance: {}", ranked);

        OutputTable table = new OutputAssembler().assemble(test, composite, raw, ranked);
        return EnsembleResult.builder().table(table).compositeScores(composite).rawScores(raw)
                .rankedFeatures(ranked).featureNames(trainMatrix.getFeatureNames()).trainSize(train.size())
                .testSize(test.size()).isolationThreshold(isolation.getThreshold())
                .retainedComponents(subspace.getNumberOfComponents())
                .numberOfSupportVectors(boundary.getNumberOfSupportVectors()).boundaryOffset(boundary.getRho())
                .build();
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public double getTrainFraction() {
        return trainFraction;
    }

    public int getNumberOfTrees() {
        return numberOfTrees;
    }

    public int getSubsampleSize() {
        return subsampleSize;
    }

    public double getContamination() {
        return contamination;
    }

    public double getNu() {
        return nu;
    }

    public KernelType getKernel() {
        return kernel;
    }

    public Optional<Double> getGamma() {
        return gamma;
    }

    public double getVarianceRetained() {
        return varianceRetained;
    }

    public EnsembleWeights getWeights() {
        return weights;
    }

    public int getTopFeatures() {
        return topFeatures;
    }

    public ImputationMethod getImputationMethod() {
        return imputationMethod;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public static class Builder<T extends Builder<T>> {

        private String timestampColumn = DEFAULT_TIMESTAMP_COLUMN;
        private double trainFraction = DEFAULT_TRAIN_FRACTION;
        private int numberOfTrees = DEFAULT_NUMBER_OF_TREES;
        private int subsampleSize = DEFAULT_SUBSAMPLE_SIZE;
        private double contamination = DEFAULT_CONTAMINATION;
        private double nu = DEFAULT_NU;
        private KernelType kernel = DEFAULT_KERNEL;
        private Optional<Double> gamma = Optional.empty();
        private double varianceRetained = DEFAULT_VARIANCE_RETAINED;
        private EnsembleWeights weights = EnsembleWeights.defaultWeights();
        private int topFeatures = DEFAULT_TOP_FEATURES;
        private ImputationMethod imputationMethod = DEFAULT_IMPUTATION_METHOD;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private Optional<Long> randomSeed = Optional.empty();

        public T timestampColumn(String timestampColumn) {
            this.timestampColumn = timestampColumn;
            return (T) this;
        }

        public T trainFraction(double trainFraction) {
            this.trainFraction = trainFraction;
            return (T) this;
        }

        public T numberOfTrees(int numberOfTrees) {
            this.numberOfTrees = numberOfTrees;
            return (T) this;
        }

        public T subsampleSize(int subsampleSize) {
            this.subsampleSize = subsampleSize;
            return (T) this;
        }

        public T contamination(double contamination) {
            this.contamination = contamination;
            return (T) this;
        }

        public T nu(double nu) {
            this.nu = nu;
            return (T) this;
        }

        public T kernel(KernelType kernel) {
            this.kernel = kernel;
            return (T) this;
        }

        public T gamma(double gamma) {
            this.gamma = Optional.of(gamma);
            return (T) this;
        }

        public T varianceRetained(double varianceRetained) {
            this.varianceRetained = varianceRetained;
            return (T) this;
        }

        public T weights(EnsembleWeights weights) {
            this.weights = weights;
            return (T) this;
        }

        public T topFeatures(int topFeatures) {
            this.topFeatures = topFeatures;
            return (T) this;
        }

        public T imputationMethod(ImputationMethod imputationMethod) {
            this.imputationMethod = imputationMethod;
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public AnomalyEnsemble build() {
            return new AnomalyEnsemble(this);
        }

        public Random getRandom() {
            // a fresh generator when no seed was given
            return randomSeed.map(Random::new).orElseGet(Random::new);
        }
    }
}
