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

package com.velora.ensemble.preprocessor;

import static com.velora.ensemble.TestUtils.EPSILON;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.velora.ensemble.exception.ScalerNotFittedException;
import com.velora.ensemble.statistics.Deviation;

public class FeatureScalerTest {

    private static FeatureMatrix randomMatrix(int rows, long seed) {
        Random rng = new Random(seed);
        double[][] values = new double[rows][3];
        for (double[] row : values) {
            row[0] = 5 + 3 * rng.nextGaussian();
            row[1] = -100 + 0.01 * rng.nextGaussian();
            row[2] = 0.1;
        }
        return new FeatureMatrix(Arrays.asList("a", "b", "c"), values);
    }

    @Test
    public void testTransformBeforeFit() {
        FeatureScaler scaler = new FeatureScaler();
        assertFalse(scaler.isFitted());
        assertThrows(ScalerNotFittedException.class, () -> scaler.transform(randomMatrix(5, 0)));
        assertThrows(ScalerNotFittedException.class, scaler::getMeans);
    }

    @Test
    public void testOverflowSaturates() {
        FeatureMatrix train = new FeatureMatrix(Arrays.asList("x"), new double[][] { { 0.0 }, { 0.2 } });
        FeatureScaler scaler = new FeatureScaler().fit(train);
        FeatureMatrix scaled = scaler.transform(new FeatureMatrix(Arrays.asList("x"),
                new double[][] { { -Double.MAX_VALUE }, { Double.MAX_VALUE }, { 0.3 } }));
        assertEquals(-Double.MAX_VALUE, scaled.get(0, 0));
        assertEquals(Double.MAX_VALUE, scaled.get(1, 0));
        assertEquals(2.0, scaled.get(2, 0), EPSILON);
    }

    @Test
    public void testTrainingMatrixIsStandardized() {
        FeatureMatrix train = randomMatrix(200, 1);
        FeatureScaler scaler = new FeatureScaler().fit(train);
        assertTrue(scaler.isFitted());
        FeatureMatrix scaled = scaler.transform(train);
        for (int j = 0; j < 2; j++) {
            Deviation deviation = new Deviation();
            deviation.update(scaled.getColumn(j));
            assertEquals(0.0, deviation.getMean(), EPSILON);
            assertEquals(1.0, deviation.getDeviation(), EPSILON);
        }
        // the constant feature maps to exact zeros
        assertArrayEquals(new double[200], scaled.getColumn(2));
        assertEquals(1.0, scaler.getScales()[2]);
    }

    @Test
    public void testTestMatrixUsesTrainingStatistics() {
        FeatureMatrix train = new FeatureMatrix(Arrays.asList("a"), new double[][] { { 0 }, { 2 } });
        FeatureScaler scaler = new FeatureScaler().fit(train);
        FeatureMatrix test = new FeatureMatrix(Arrays.asList("a"), new double[][] { { 3 }, { 5 } });
        assertArrayEquals(new double[] { 2.0, 4.0 }, scaler.transform(test).getColumn(0), EPSILON);
        assertArrayEquals(new double[] { 1.0 }, scaler.getMeans(), EPSILON);
    }

    @Test
    public void testInputIsNotModified() {
        FeatureMatrix train = randomMatrix(10, 2);
        double[][] before = train.toArray();
        new FeatureScaler().fit(train).transform(train);
        assertArrayEquals(before, train.toArray());
    }

    @Test
    public void testInvalidUse() {
        FeatureScaler scaler = new FeatureScaler().fit(randomMatrix(10, 3));
        assertThrows(IllegalStateException.class, () -> scaler.fit(randomMatrix(10, 3)));
        FeatureMatrix renamed = new FeatureMatrix(Arrays.asList("a", "c", "b"), new double[][] { { 1, 2, 3 } });
        assertThrows(IllegalArgumentException.class, () -> scaler.transform(renamed));
        FeatureMatrix empty = new FeatureMatrix(Arrays.asList("a"), new double[0][]);
        assertThrows(IllegalArgumentException.class, () -> new FeatureScaler().fit(empty));
    }
}
