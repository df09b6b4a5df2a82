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

import static com.velora.ensemble.TestUtils.matrix;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.detector.BoundaryDensityDetector;
import com.velora.ensemble.detector.DetectorBank;
import com.velora.ensemble.detector.IsolationForestDetector;
import com.velora.ensemble.detector.SubspaceReconstructionDetector;
import com.velora.ensemble.preprocessor.FeatureMatrix;
import com.velora.ensemble.returntypes.RawScores;

public class ScorerTest {

    private static FeatureMatrix gaussian(int rows, long seed) {
        Random rng = new Random(seed);
        double[][] values = new double[rows][2];
        for (double[] row : values) {
            row[0] = rng.nextGaussian();
            row[1] = rng.nextGaussian();
        }
        return matrix(values);
    }

    private static DetectorBank bank() {
        return new DetectorBank(Arrays.asList(new IsolationForestDetector(20, 64, 0.05, 2L),
                new SubspaceReconstructionDetector(), new BoundaryDensityDetector()));
    }

    @Test
    public void testScoreBeforeFit() {
        try (DetectorBank bank = bank()) {
            assertThrows(IllegalStateException.class, () -> new Scorer(bank).score(gaussian(5, 0)));
        }
    }

    @Test
    public void testEveryDetectorScoresEveryRecord() {
        try (DetectorBank bank = bank()) {
            bank.fit(gaussian(100, 1));
            FeatureMatrix test = gaussian(17, 2);
            RawScores scores = new Scorer(bank).score(test);
            assertEquals(17, scores.size());
            for (DetectorType type : DetectorType.values()) {
                assertEquals(17, scores.get(type).length);
                assertEquals(scores.get(type, 3), bank.getDetector(type).score(test)[3]);
            }
        }
    }

    @Test
    public void testNullArguments() {
        assertThrows(NullPointerException.class, () -> new Scorer(null));
        try (DetectorBank bank = bank()) {
            assertThrows(NullPointerException.class, () -> new Scorer(bank).score(null));
        }
    }
}
