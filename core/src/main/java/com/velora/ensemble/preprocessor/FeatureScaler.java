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

package com.velora.ensemble.preprocessor;

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;
import static com.velora.ensemble.CommonUtils.checkState;
import static com.velora.ensemble.CommonUtils.saturate;

import java.util.Arrays;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.velora.ensemble.exception.ScalerNotFittedException;
import com.velora.ensemble.statistics.Deviation;

/**
 * Standardizes features with statistics taken from the training matrix only.
 * The statistics are fixed by {@link #fit} and then applied unchanged to every
 * matrix passed to {@link #transform}, including the training matrix itself.
 */
@Slf4j
public class FeatureScaler {

    /**
     * deviations at or below this multiple of the mean's ulp are rounding noise
     * and are treated as zero
     */
    static final double NEGLIGIBLE_DEVIATION_ULPS = 10;

    private List<String> featureNames;

    private double[] means;

    private double[] scales;

    /**
     * Computes the per-feature mean and population standard deviation. A feature
     * without variance gets a scale of 1, so it maps to zeros in training and
     * never produces NaN or infinity.
     *
     * @param train the training matrix
     * @return this scaler
     * @throws IllegalStateException if the scaler was already fitted
     */
    public FeatureScaler fit(FeatureMatrix train) {
        checkNotNull(train, "train must not be null");
        checkState(means == null, "the scaler has already been fitted");
        checkArgument(train.getNumberOfRows() > 0, "cannot fit on an empty matrix");
        int features = train.getNumberOfFeatures();
        double[] fittedMeans = new double[features];
        double[] fittedScales = new double[features];
        for (int j = 0; j < features; j++) {
            Deviation deviation = new Deviation();
            deviation.update(train.getColumn(j));
            fittedMeans[j] = deviation.getMean();
            double std = deviation.getDeviation();
            double noise = NEGLIGIBLE_DEVIATION_ULPS * Math.ulp(Math.max(1.0, Math.abs(fittedMeans[j])));
            fittedScales[j] = (std > noise) ? std : 1.0;
        }
        featureNames = train.getFeatureNames();
        means = fittedMeans;
        scales = fittedScales;
        log.debug("scaler means {} scales {}", Arrays.toString(means), Arrays.toString(scales));
        return this;
    }

    public boolean isFitted() {
        return means != null;
    }

    /**
     * @param matrix a matrix with the training feature names in training order
     * @return a new matrix holding {@code (value - mean) / scale}
     * @throws ScalerNotFittedException if {@link #fit} has not been called
     */
    public FeatureMatrix transform(FeatureMatrix matrix) {
        checkNotNull(matrix, "matrix must not be null");
        if (!isFitted()) {
            throw new ScalerNotFittedException("transform requested before fit");
        }
        checkArgument(featureNames.equals(matrix.getFeatureNames()),
                "feature names " + matrix.getFeatureNames() + " differ from fitted " + featureNames);
        double[][] values = matrix.toArray();
        for (double[] row : values) {
            for (int j = 0; j < row.length; j++) {
                row[j] = saturate((row[j] - means[j]) / scales[j]);
            }
        }
        return new FeatureMatrix(featureNames, values, matrix.getFillValues());
    }

    public double[] getMeans() {
        checkFitted();
        return Arrays.copyOf(means, means.length);
    }

    public double[] getScales() {
        checkFitted();
        return Arrays.copyOf(scales, scales.length);
    }

    private void checkFitted() {
        if (!isFitted()) {
            throw new ScalerNotFittedException("the scaler has not been fitted");
        }
    }
}
