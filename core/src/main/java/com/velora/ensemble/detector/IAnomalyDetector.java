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

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.preprocessor.FeatureMatrix;

/**
 * An unsupervised anomaly detector. A detector is fitted exactly once and its
 * fitted state is never changed afterwards, so {@link #score} may be called
 * from any thread once {@link #fit} has returned.
 */
public interface IAnomalyDetector {

    DetectorType getType();

    /**
     * Fits the detector on the scaled training matrix.
     *
     * @param train the scaled training matrix
     * @throws com.velora.ensemble.exception.DetectorFitException if the matrix is
     *                                                           too small or
     *                                                           degenerate
     */
    void fit(FeatureMatrix train);

    boolean isFitted();

    /**
     * @param matrix a scaled matrix with the training features
     * @return one score per row, higher means more anomalous
     */
    double[] score(FeatureMatrix matrix);
}
