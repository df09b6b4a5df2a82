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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.velora.ensemble.exception.InvalidWeightsException;

public class EnsembleWeightsTest {

    @Test
    public void testDefaultWeights() {
        EnsembleWeights weights = EnsembleWeights.defaultWeights();
        assertEquals(0.5, weights.getWeight(DetectorType.ISOLATION));
        assertEquals(0.3, weights.getWeight(DetectorType.SUBSPACE));
        assertEquals(0.2, weights.getWeight(DetectorType.BOUNDARY));
        assertEquals(3, weights.asMap().size());
    }

    @ParameterizedTest
    @CsvSource({ "0.5, 0.5, 0.5", "0.5, 0.3, 0.1", "-0.2, 0.7, 0.5", "NaN, 0.5, 0.5", "Infinity, 0, 0" })
    public void testInvalidWeights(double isolation, double subspace, double boundary) {
        assertThrows(InvalidWeightsException.class, () -> EnsembleWeights.of(isolation, subspace, boundary));
    }

    @Test
    public void testSingleDetectorMayCarryAllWeight() {
        EnsembleWeights weights = EnsembleWeights.of(0.0, 1.0, 0.0);
        assertEquals(1.0, weights.getWeight(DetectorType.SUBSPACE));
    }

    @Test
    public void testSumTolerance() {
        EnsembleWeights.of(0.1, 0.2, 0.7);
        assertThrows(InvalidWeightsException.class, () -> EnsembleWeights.of(0.1, 0.2, 0.7 + 1e-6));
    }

    @Test
    public void testMapMustBeComplete() {
        Map<DetectorType, Double> map = new EnumMap<>(DetectorType.class);
        map.put(DetectorType.ISOLATION, 0.5);
        map.put(DetectorType.SUBSPACE, 0.5);
        assertThrows(InvalidWeightsException.class, () -> EnsembleWeights.of(map));
        assertThrows(InvalidWeightsException.class, () -> EnsembleWeights.of((Map<DetectorType, Double>) null));
        map.put(DetectorType.BOUNDARY, 0.0);
        assertEquals(0.0, EnsembleWeights.of(map).getWeight(DetectorType.BOUNDARY));
    }

    @Test
    public void testAsMapIsUnmodifiable() {
        assertThrows(UnsupportedOperationException.class,
                () -> EnsembleWeights.defaultWeights().asMap().put(DetectorType.ISOLATION, 1.0));
    }
}
