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

package com.velora.ensemble.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.velora.ensemble.exception.InvalidWeightsException;

/**
 * The weight of each detector in the composite score. Weights are validated on
 * construction: every detector must be present, every weight must be finite
 * and non-negative, and the weights must sum to one.
 */
public class EnsembleWeights {

    public static final double DEFAULT_ISOLATION_WEIGHT = 0.5;

    public static final double DEFAULT_SUBSPACE_WEIGHT = 0.3;

    public static final double DEFAULT_BOUNDARY_WEIGHT = 0.2;

    /**
     * how far the sum of the weights may stray from 1.0
     */
    public static final double SUM_TOLERANCE = 1e-9;

    private final EnumMap<DetectorType, Double> weights;

    private EnsembleWeights(Map<DetectorType, Double> weights) {
        if (weights == null) {
            throw new InvalidWeightsException("weights must not be null");
        }
        this.weights = new EnumMap<>(DetectorType.class);
        double sum = 0;
        for (DetectorType type : DetectorType.values()) {
            Double weight = weights.get(type);
            if (weight == null) {
                throw new InvalidWeightsException("missing weight for detector " + type);
            }
            if (!Double.isFinite(weight) || weight < 0) {
                throw new InvalidWeightsException(
                        String.format("weight for detector %s must be finite and non-negative, was %s", type, weight));
            }
            this.weights.put(type, weight);
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new InvalidWeightsException(String.format("weights must sum to 1.0, found %s", sum));
        }
    }

    /**
     * @return the weights 0.5 / 0.3 / 0.2 for isolation / subspace / boundary
     */
    public static EnsembleWeights defaultWeights() {
        return of(DEFAULT_ISOLATION_WEIGHT, DEFAULT_SUBSPACE_WEIGHT, DEFAULT_BOUNDARY_WEIGHT);
    }

    public static EnsembleWeights of(double isolation, double subspace, double boundary) {
        EnumMap<DetectorType, Double> map = new EnumMap<>(DetectorType.class);
        map.put(DetectorType.ISOLATION, isolation);
        map.put(DetectorType.SUBSPACE, subspace);
        map.put(DetectorType.BOUNDARY, boundary);
        return new EnsembleWeights(map);
    }

    /**
     * Builds weights from a loose mapping, as supplied by a caller that keeps its
     * configuration in a map.
     *
     * @param weights a weight for every detector
     * @return validated weights
     * @throws InvalidWeightsException if the mapping is incomplete or malformed
     */
    public static EnsembleWeights of(Map<DetectorType, Double> weights) {
        return new EnsembleWeights(weights);
    }

    public double getWeight(DetectorType type) {
        return weights.get(type);
    }

    public Map<DetectorType, Double> asMap() {
        return Collections.unmodifiableMap(weights);
    }

    @Override
    public String toString() {
        return "EnsembleWeights" + weights;
    }
}
