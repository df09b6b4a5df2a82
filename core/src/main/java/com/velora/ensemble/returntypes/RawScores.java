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

package com.velora.ensemble.returntypes;

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import com.velora.ensemble.config.DetectorType;

/**
 * The raw scores of every detector for the same sequence of records. Each
 * detector contributes one finite value per record, higher meaning more
 * anomalous; scales differ between detectors.
 */
public class RawScores {

    private final EnumMap<DetectorType, double[]> scores;

    private final int size;

    public RawScores(Map<DetectorType, double[]> scores) {
        checkNotNull(scores, "scores must not be null");
        this.scores = new EnumMap<>(DetectorType.class);
        int expected = -1;
        for (DetectorType type : DetectorType.values()) {
            double[] values = scores.get(type);
            checkArgument(values != null, "missing scores for " + type);
            if (expected < 0) {
                expected = values.length;
            }
            checkArgument(values.length == expected, String.format(
                    "%s produced %d scores, expected %d", type, values.length, expected));
            for (double value : values) {
                checkArgument(Double.isFinite(value), type + " produced a non-finite score");
            }
            this.scores.put(type, Arrays.copyOf(values, values.length));
        }
        this.size = expected;
    }

    /**
     * @param type a detector
     * @return a copy of the detector's scores in record order
     */
    public double[] get(DetectorType type) {
        double[] values = scores.get(type);
        return Arrays.copyOf(values, values.length);
    }

    public double get(DetectorType type, int record) {
        return scores.get(type)[record];
    }

    /**
     * @return the number of scored records
     */
    public int size() {
        return size;
    }
}
