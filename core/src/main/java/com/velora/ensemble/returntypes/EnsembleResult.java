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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.Getter;

import com.velora.ensemble.output.OutputTable;

/**
 * Everything one run of the ensemble produces: the augmented output table, the
 * scores behind it and the calibration diagnostics of each detector.
 */
@Getter
@Builder
public class EnsembleResult {

    private final OutputTable table;

    /**
     * composite scores in [0, 100], in test order
     */
    private final double[] compositeScores;

    private final RawScores rawScores;

    /**
     * the highest-variance features, highest first
     */
    private final List<String> rankedFeatures;

    /**
     * all features used by the detectors, in column order
     */
    private final List<String> featureNames;

    private final int trainSize;

    private final int testSize;

    /**
     * the training isolation score above which the contamination share lies
     */
    private final double isolationThreshold;

    private final int retainedComponents;

    private final int numberOfSupportVectors;

    /**
     * the offset rho of the one-class boundary
     */
    private final double boundaryOffset;

    public double[] getCompositeScores() {
        return Arrays.copyOf(compositeScores, compositeScores.length);
    }

    public double getCompositeScore(int record) {
        return compositeScores[record];
    }

    /**
     * Lists the test records whose composite score exceeds a threshold. The output
     * table is not filtered.
     *
     * @param threshold a score in [0, 100]
     * @return the test positions above the threshold, most anomalous first, equal
     *         scores in test order
     */
    public List<Integer> getRecordsAbove(double threshold) {
        checkArgument(threshold >= 0 && threshold <= 100, "threshold must be in [0, 100]");
        List<Integer> records = new ArrayList<>();
        for (int i = 0; i < compositeScores.length; i++) {
            if (compositeScores[i] > threshold) {
                records.add(i);
            }
        }
        records.sort((a, b) -> Double.compare(compositeScores[b], compositeScores[a]));
        return Collections.unmodifiableList(records);
    }
}
