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
import static com.velora.ensemble.CommonUtils.checkNotNull;
import static com.velora.ensemble.CommonUtils.checkState;
import static com.velora.ensemble.CommonUtils.saturate;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.exception.DetectorFitException;
import com.velora.ensemble.preprocessor.FeatureMatrix;

/**
 * Shared fit/score bookkeeping. Subclasses implement {@link #fitModel} and
 * {@link #scorePoint}; this class guarantees that a model is fitted once, on a
 * matrix with at least as many rows as features, and only scored against
 * matrices of the same width. Scores that overflow are clamped to
 * {@code Double.MAX_VALUE}.
 */
public abstract class AbstractDetector implements IAnomalyDetector {

    private final DetectorType type;

    private int dimensions = -1;

    protected AbstractDetector(DetectorType type) {
        this.type = type;
    }

    @Override
    public DetectorType getType() {
        return type;
    }

    @Override
    public final void fit(FeatureMatrix train) {
        checkNotNull(train, "train must not be null");
        checkState(!isFitted(), type + " detector has already been fitted");
        int rows = train.getNumberOfRows();
        int features = train.getNumberOfFeatures();
        if (rows == 0 || rows < features) {
            throw new DetectorFitException(String.format(
                    "%s detector needs at least as many training rows as features, found %d rows and %d features",
                    type, rows, features));
        }
        fitModel(train.toArray());
        dimensions = features;
    }

    @Override
    public boolean isFitted() {
        return dimensions >= 0;
    }

    @Override
    public double[] score(FeatureMatrix matrix) {
        checkNotNull(matrix, "matrix must not be null");
        checkState(isFitted(), type + " detector must be fitted before scoring");
        checkArgument(matrix.getNumberOfFeatures() == dimensions,
                String.format("expected %d features, found %d", dimensions, matrix.getNumberOfFeatures()));
        double[] scores = new double[matrix.getNumberOfRows()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = saturate(scorePoint(matrix.getRow(i)));
        }
        return scores;
    }

    public int getDimensions() {
        return dimensions;
    }

    /**
     * @param rows the scaled training rows; never empty, at least as many rows as
     *             columns
     */
    protected abstract void fitModel(double[][] rows);

    protected abstract double scorePoint(double[] point);
}
