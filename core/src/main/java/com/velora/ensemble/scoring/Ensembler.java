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

package com.velora.ensemble.scoring;

import static com.velora.ensemble.CommonUtils.checkNotNull;
import static com.velora.ensemble.CommonUtils.saturate;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.config.EnsembleWeights;
import com.velora.ensemble.returntypes.RawScores;

/**
 * Combines raw detector scores into a composite score on a 0 to 100 scale. The
 * weighted sum of the raw scores is min-max normalized over the scored
 * records, so the least anomalous record scores 0 and the most anomalous 100.
 * When every record has the same weighted sum all composite scores are 0.
 */
public class Ensembler {

    public static final double MAX_SCORE = 100.0;

    private final EnsembleWeights weights;

    public Ensembler() {
        this(EnsembleWeights.defaultWeights());
    }

    public Ensembler(EnsembleWeights weights) {
        this.weights = checkNotNull(weights, "weights must not be null");
    }

    public double[] combine(RawScores raw) {
        checkNotNull(raw, "raw must not be null");
        double[] combined = new double[raw.size()];
        for (DetectorType type : DetectorType.values()) {
            double weight = weights.getWeight(type);
            for (int i = 0; i < combined.length; i++) {
                combined[i] = saturate(combined[i] + weight * raw.get(type, i));
            }
        }
        return normalize(combined);
    }

    /**
     * Min-max scales values onto [0, 100], clamping rounding excursions.
     *
     * @param values the values to scale
     * @return the scaled values; all zeros if the values are all equal
     */
    public static double[] normalize(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double[] scaled = new double[values.length];
        if (!(max > min)) {
            return scaled;
        }
        // halving is exact and keeps differences of finite values finite
        double low = min / 2;
        double range = max / 2 - low;
        for (int i = 0; i < values.length; i++) {
            double value = MAX_SCORE * ((values[i] / 2 - low) / range);
            scaled[i] = Math.max(0.0, Math.min(MAX_SCORE, value));
        }
        return scaled;
    }

    public EnsembleWeights getWeights() {
        return weights;
    }
}
