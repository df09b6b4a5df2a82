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

import static com.velora.ensemble.TestUtils.EPSILON;
import static com.velora.ensemble.TestUtils.matrix;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.exception.DetectorFitException;

public class SubspaceReconstructionDetectorTest {

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 1.0, -0.5, Double.NaN })
    public void testVarianceRetainedOutOfRange(double varianceRetained) {
        assertThrows(IllegalArgumentException.class, () -> new SubspaceReconstructionDetector(varianceRetained));
    }

    @Test
    public void testSingleRowCannotBeFitted() {
        SubspaceReconstructionDetector detector = new SubspaceReconstructionDetector();
        assertEquals(DetectorType.SUBSPACE, detector.getType());
        assertThrows(DetectorFitException.class, () -> detector.fit(matrix(new double[][] { { 1.0 } })));
    }

    @Test
    public void testReconstructionErrorOnALine() {
        SubspaceReconstructionDetector detector = new SubspaceReconstructionDetector();
        detector.fit(matrix(new double[][] { { 1, 0 }, { -1, 0 }, { 2, 0 }, { -2, 0 } }));
        assertEquals(1, detector.getNumberOfComponents());
        double[] ratios = detector.getExplainedVarianceRatio();
        assertThat(ratios[0], closeTo(1.0, EPSILON));
        assertThat(ratios[1], closeTo(0.0, EPSILON));

        double[] scores = detector.score(matrix(new double[][] { { 0, 3 }, { 5, 0 }, { 0, 0 } }));
        assertThat(scores[0], closeTo(4.5, EPSILON));
        assertThat(scores[1], closeTo(0.0, EPSILON));
        assertThat(scores[2], closeTo(0.0, EPSILON));
    }

    @Test
    public void testExtremeValuesSaturate() {
        SubspaceReconstructionDetector detector = new SubspaceReconstructionDetector();
        detector.fit(matrix(new double[][] { { 1, 0 }, { -1, 0 }, { 2, 0 }, { -2, 0 } }));

        double[] scores = detector.score(matrix(new double[][] { { 0, 1e150 }, { 0, 1e200 }, { 0, -1e200 },
                { 0, Double.MAX_VALUE }, { 0, 3 } }));
        assertThat(scores[0], closeTo(5e299, 5e299 * 1e-12));
        assertEquals(Double.MAX_VALUE, scores[1]);
        assertEquals(Double.MAX_VALUE, scores[2]);
        assertEquals(Double.MAX_VALUE, scores[3]);
        assertThat(scores[4], closeTo(4.5, EPSILON));
    }

    @Test
    public void testComponentsReachRetainedVariance() {
        Random rng = new Random(3);
        double[][] values = new double[400][4];
        for (double[] row : values) {
            double t = rng.nextGaussian();
            row[0] = 10 * t;
            row[1] = 5 * t + 0.1 * rng.nextGaussian();
            row[2] = rng.nextGaussian();
            row[3] = 0.01 * rng.nextGaussian();
        }
        SubspaceReconstructionDetector detector = new SubspaceReconstructionDetector(0.9);
        detector.fit(matrix(values));
        int kept = detector.getNumberOfComponents();
        double[] ratios = detector.getExplainedVarianceRatio();
        double cumulative = 0;
        for (int i = 0; i < kept; i++) {
            cumulative += ratios[i];
        }
        assertThat(cumulative, greaterThanOrEqualTo(0.9));
        assertThat(cumulative - ratios[kept - 1], lessThan(0.9));
        for (int i = 1; i < ratios.length; i++) {
            assertThat(ratios[i - 1], greaterThanOrEqualTo(ratios[i]));
        }

        double[] scores = detector.score(matrix(new double[][] { { 1, 0.5, 0, 0 }, { 1, -5, 0, 0 } }));
        assertThat(scores[1], greaterThan(scores[0]));
    }

    @Test
    public void testConstantMatrixKeepsOneComponent() {
        double[][] values = new double[5][3];
        for (double[] row : values) {
            row[0] = 1;
            row[1] = 2;
            row[2] = 3;
        }
        SubspaceReconstructionDetector detector = new SubspaceReconstructionDetector();
        detector.fit(matrix(values));
        assertEquals(1, detector.getNumberOfComponents());
        assertThat(detector.score(matrix(values))[0], closeTo(0.0, EPSILON));
    }

    @Test
    public void testGettersBeforeFit() {
        SubspaceReconstructionDetector detector = new SubspaceReconstructionDetector(0.8);
        assertEquals(0.8, detector.getVarianceRetained());
        assertThrows(IllegalStateException.class, detector::getNumberOfComponents);
        assertThrows(IllegalStateException.class, detector::getExplainedVarianceRatio);
    }
}
