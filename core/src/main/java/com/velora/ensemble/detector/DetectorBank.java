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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.executor.AbstractDetectorExecutor;
import com.velora.ensemble.executor.ParallelDetectorExecutor;
import com.velora.ensemble.executor.SequentialDetectorExecutor;
import com.velora.ensemble.preprocessor.FeatureMatrix;

/**
 * Holds exactly one detector of every {@link DetectorType} and fits them
 * together on the scaled training matrix, sequentially or on a private thread
 * pool.
 */
@Slf4j
public class DetectorBank implements AutoCloseable {

    private final EnumMap<DetectorType, IAnomalyDetector> detectors;

    private final AbstractDetectorExecutor executor;

    private boolean fitted = false;

    public DetectorBank(List<IAnomalyDetector> detectors) {
        this(detectors, false, 1);
    }

    public DetectorBank(List<IAnomalyDetector> detectors, boolean parallelExecutionEnabled, int threadPoolSize) {
        checkNotNull(detectors, "detectors must not be null");
        this.detectors = new EnumMap<>(DetectorType.class);
        for (IAnomalyDetector detector : detectors) {
            checkNotNull(detector, "detectors must not contain null");
            checkArgument(this.detectors.put(detector.getType(), detector) == null,
                    "more than one detector of type " + detector.getType());
        }
        for (DetectorType type : DetectorType.values()) {
            checkArgument(this.detectors.containsKey(type), "missing a detector of type " + type);
        }
        List<IAnomalyDetector> ordered = new ArrayList<>(this.detectors.values());
        if (parallelExecutionEnabled) {
            executor = new ParallelDetectorExecutor(ordered, threadPoolSize);
        } else {
            executor = new SequentialDetectorExecutor(ordered);
        }
    }

    public void fit(FeatureMatrix train) {
        checkState(!fitted, "the detector bank has already been fitted");
        executor.fit(train);
        fitted = true;
        log.debug("fitted {} detectors on {} rows", detectors.size(), train.getNumberOfRows());
    }

    public boolean isFitted() {
        return fitted;
    }

    public IAnomalyDetector getDetector(DetectorType type) {
        return detectors.get(type);
    }

    public AbstractDetectorExecutor getExecutor() {
        return executor;
    }

    @Override
    public void close() {
        executor.close();
    }
}
