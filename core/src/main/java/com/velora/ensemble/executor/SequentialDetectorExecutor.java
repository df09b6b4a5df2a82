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

import java.util.EnumMap;
import java.util.List;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.detector.IAnomalyDetector;
import com.velora.ensemble.preprocessor.FeatureMatrix;
import com.velora.ensemble.returntypes.RawScores;

/**
 * Fit and score the detectors one after another on the calling thread.
 */
public class SequentialDetectorExecutor extends AbstractDetectorExecutor {

    public SequentialDetectorExecutor(List<IAnomalyDetector> detectors) {
        super(detectors);
    }

    @Override
    public void fit(FeatureMatrix train) {
        for (IAnomalyDetector detector : detectors) {
            detector.fit(train);
        }
    }

    @Override
    public RawScores score(FeatureMatrix matrix) {
        EnumMap<DetectorType, double[]> scores = new EnumMap<>(DetectorType.class);
        for (IAnomalyDetector detector : detectors) {
            scores.put(detector.getType(), detector.score(matrix));
        }
        return new RawScores(scores);
    }
}
