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

package com.velora.ensemble.inspect;

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.velora.ensemble.preprocessor.FeatureMatrix;
import com.velora.ensemble.statistics.Deviation;

/**
 * Ranks features by their variance in the scaled training matrix. The ranking
 * is a diagnostic; it does not influence any score.
 */
public class FeatureRanker {

    public static final int DEFAULT_TOP_FEATURES = 7;

    private final int topFeatures;

    public FeatureRanker() {
        this(DEFAULT_TOP_FEATURES);
    }

    public FeatureRanker(int topFeatures) {
        checkArgument(topFeatures >= 0, "topFeatures must be non-negative");
        this.topFeatures = topFeatures;
    }

    /**
     * @param matrix the scaled training matrix
     * @return up to {@code topFeatures} feature names, highest variance first;
     *         equal variances keep column order
     */
    public List<String> rank(FeatureMatrix matrix) {
        checkNotNull(matrix, "matrix must not be null");
        int features = matrix.getNumberOfFeatures();
        double[] variances = new double[features];
        for (int f = 0; f < features; f++) {
            variances[f] = (matrix.getNumberOfRows() == 0) ? 0.0 : Deviation.variance(matrix.getColumn(f));
        }
        Integer[] order = new Integer[features];
        for (int f = 0; f < features; f++) {
            order[f] = f;
        }
        // stable, so ties stay in column order
        Arrays.sort(order, (a, b) -> Double.compare(variances[b], variances[a]));
        List<String> names = matrix.getFeatureNames();
        List<String> ranked = new ArrayList<>();
        for (int i = 0; i < Math.min(topFeatures, features); i++) {
            ranked.add(names.get(order[i]));
        }
        return Collections.unmodifiableList(ranked);
    }

    public int getTopFeatures() {
        return topFeatures;
    }
}
