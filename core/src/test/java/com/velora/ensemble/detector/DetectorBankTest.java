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

import static com.velora.ensemble.TestUtils.matrix;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.executor.ParallelDetectorExecutor;
import com.velora.ensemble.executor.SequentialDetectorExecutor;
import com.velora.ensemble.preprocessor.FeatureMatrix;
import com.velora.ensemble.returntypes.RawScores;

public class DetectorBankTest {

    private static FeatureMatrix train() {
        Random rng = new Random(0);
        double[][] values = new double[60][2];
        for (double[] row : values) {
            row[0] = rng.nextGaussian();
            row[1] = rng.nextGaussian();
        }
        return matrix(values);
    }

    private static List<IAnomalyDetector> detectors() {
        return Arrays.asList(new IsolationForestDetector(20, 32, 0.05, 1L), new SubspaceReconstructionDetector(),
                new BoundaryDensityDetector());
    }

    @Test
    public void testEveryTypeIsRequiredOnce() {
        assertThrows(IllegalArgumentException.class, () -> new DetectorBank(
                Arrays.asList(new IsolationForestDetector(1L), new SubspaceReconstructionDetector())));
        assertThrows(IllegalArgumentException.class,
                () -> new DetectorBank(Arrays.asList(new IsolationForestDetector(1L),
                        new SubspaceReconstructionDetector(), new BoundaryDensityDetector(),
                        new BoundaryDensityDetector())));
        assertThrows(NullPointerException.class, () -> new DetectorBank(null));
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    public void testFit(boolean parallel) {
        List<IAnomalyDetector> detectors = detectors();
        try (DetectorBank bank = new DetectorBank(detectors, parallel, 2)) {
            assertEquals(parallel ? ParallelDetectorExecutor.class : SequentialDetectorExecutor.class,
                    bank.getExecutor().getClass());
            assertFalse(bank.isFitted());
            FeatureMatrix train = train();
            bank.fit(train);
            assertTrue(bank.isFitted());
            for (IAnomalyDetector detector : detectors) {
                assertTrue(detector.isFitted());
                assertSame(detector, bank.getDetector(detector.getType()));
            }
            RawScores scores = bank.getExecutor().score(train);
            assertEquals(60, scores.size());
            assertThrows(IllegalStateException.class, () -> bank.fit(train));
        }
    }

    @Test
    public void testDetectorsAreOrderedByType() {
        List<IAnomalyDetector> detectors = detectors();
        try (DetectorBank bank = new DetectorBank(
                Arrays.asList(detectors.get(2), detectors.get(0), detectors.get(1)))) {
            List<IAnomalyDetector> ordered = bank.getExecutor().getDetectors();
            for (int i = 0; i < ordered.size(); i++) {
                assertEquals(DetectorType.values()[i], ordered.get(i).getType());
            }
        }
    }
}
