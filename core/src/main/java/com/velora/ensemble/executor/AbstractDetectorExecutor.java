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

package com.velora.ensemble.executor;

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.velora.ensemble.detector.IAnomalyDetector;
import com.velora.ensemble.preprocessor.FeatureMatrix;
import com.velora.ensemble.returntypes.RawScores;

public abstract class AbstractDetectorExecutor implements AutoCloseable {

    protected final List<IAnomalyDetector> detectors;

    protected AbstractDetectorExecutor(List<IAnomalyDetector> detectors) {
        checkNotNull(detectors, "detectors must not be null");
        checkArgument(!detectors.isEmpty(), "there must be at least one detector");
        this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
    }

    /**
     * Fit every detector on the same training matrix. The matrix is only read, so
     * detectors may be fitted concurrently.
     *
     * @param train the scaled training matrix
     */
    public abstract void fit(FeatureMatrix train);

    /**
     * Score a matrix with every detector and collect the results by detector type.
     * The result does not depend on the order in which detectors are visited.
     *
     * @param matrix the scaled matrix to score
     * @return the raw scores of every detector
     */
    public abstract RawScores score(FeatureMatrix matrix);

    public List<IAnomalyDetector> getDetectors() {
        return detectors;
    }

    /**
     * Release any threads held by the executor.
     */
    @Override
    public void close() {
    }
}
