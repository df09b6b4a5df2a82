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

package com.velora.ensemble.detector;

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.tree.IsolationTree;

/**
 * An isolation forest. Anomalies are few and different, so random cuts isolate
 * them after fewer splits than normal points. The score of a point is
 * {@code 2^(-E[h(x)] / c(psi))} where {@code E[h(x)]} is its mean path length
 * over the trees and {@code c(psi)} the average path length for the subsample
 * size; it lies in (0, 1] and grows as the path shortens.
 * <p>
 * The contamination only calibrates {@link #getThreshold()}, the training score
 * above which the expected fraction of anomalies lies. Scores are never clipped
 * against it.
 */
@Slf4j
public class IsolationForestDetector extends AbstractDetector {

    public static final int DEFAULT_NUMBER_OF_TREES = 200;

    public static final int DEFAULT_SUBSAMPLE_SIZE = 256;

    public static final double DEFAULT_CONTAMINATION = 0.05;

    private final int numberOfTrees;

    private final int subsampleSize;

    private final double contamination;

    private final long randomSeed;

    private List<IsolationTree> trees;

    private double normalizer;

    private double threshold;

    public IsolationForestDetector(long randomSeed) {
        this(DEFAULT_NUMBER_OF_TREES, DEFAULT_SUBSAMPLE_SIZE, DEFAULT_CONTAMINATION, randomSeed);
    }

    public IsolationForestDetector(int numberOfTrees, int subsampleSize, double contamination, long randomSeed) {
        super(DetectorType.ISOLATION);
        checkArgument(numberOfTrees > 0, "numberOfTrees must be greater than 0");
        checkArgument(subsampleSize > 0, "subsampleSize must be greater than 0");
        checkArgument(contamination > 0 && contamination <= 0.5, "contamination must be in (0, 0.5]");
        this.numberOfTrees = numberOfTrees;
        this.subsampleSize = subsampleSize;
        this.contamination = contamination;
        this.randomSeed = randomSeed;
    }

    @Override
    protected void fitModel(double[][] rows) {
        int psi = Math.min(subsampleSize, rows.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));
        Random rng = new Random(randomSeed);
        List<IsolationTree> grown = new ArrayList<>(numberOfTrees);
        for (int t = 0; t < numberOfTrees; t++) {
            Random treeRng = new Random(rng.nextLong());
            grown.add(IsolationTree.grow(subsample(rows, psi, treeRng), maxDepth, treeRng));
        }
        trees = Collections.unmodifiableList(grown);
        double c = IsolationTree.averagePathLength(psi);
        normalizer = (c > 0) ? c : 1.0;

        double[] trainingScores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            trainingScores[i] = scorePoint(rows[i]);
        }
        Percentile percentile = new Percentile().withEstimationType(EstimationType.R_7);
        threshold = percentile.evaluate(trainingScores, 100.0 * (1.0 - contamination));
        log.debug("grew {} trees on subsamples of {} points, depth limit {}, contamination threshold {}",
                numberOfTrees, psi, maxDepth, threshold);
    }

    @Override
    protected double scorePoint(double[] point) {
        double sum = 0;
        for (IsolationTree tree : trees) {
            sum += tree.pathLength(point);
        }
        return Math.pow(2.0, -(sum / trees.size()) / normalizer);
    }

    /**
     * Draws {@code size} distinct rows with a partial Fisher-Yates shuffle.
     */
    static double[][] subsample(double[][] rows, int size, Random rng) {
        int[] positions = new int[rows.length];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + rng.nextInt(rows.length - i);
            int swap = positions[i];
            positions[i] = positions[j];
            positions[j] = swap;
            sample[i] = rows[positions[i]];
        }
        return sample;
    }

    /**
     * @return the training score exceeded by a {@code contamination} share of the
     *         training points
     */
    public double getThreshold() {
        checkState(isFitted(), "the forest has not been fitted");
        return threshold;
    }

    public List<IsolationTree> getTrees() {
        checkState(isFitted(), "the forest has not been fitted");
        return trees;
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
}
