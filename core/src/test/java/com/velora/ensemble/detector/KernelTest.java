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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.velora.ensemble.config.KernelType;

public class KernelTest {

    private static final double[] A = new double[] { 1.0, 2.0 };
    private static final double[] B = new double[] { 3.0, 4.0 };

    @Test
    public void testRbf() {
        Kernel kernel = new Kernel(KernelType.RBF, 0.5);
        assertThat(kernel.evaluate(new double[] { 0, 0 }, new double[] { 1, 1 }), closeTo(Math.exp(-1), EPSILON));
        assertThat(kernel.evaluate(A, A), closeTo(1.0, EPSILON));
    }

    @Test
    public void testLinearIgnoresGamma() {
        assertThat(new Kernel(KernelType.LINEAR, 7.0).evaluate(A, B), closeTo(11.0, EPSILON));
    }

    @Test
    public void testPolynomial() {
        assertThat(new Kernel(KernelType.POLYNOMIAL, 1.0).evaluate(A, B), closeTo(1331.0, EPSILON));
        assertThat(new Kernel(KernelType.POLYNOMIAL, 0.5, 2, 1.0).evaluate(A, B), closeTo(42.25, EPSILON));
    }

    @Test
    public void testSigmoid() {
        assertThat(new Kernel(KernelType.SIGMOID, 0.5).evaluate(A, B), closeTo(0.9999665971563038, EPSILON));
    }

    @ParameterizedTest
    @EnumSource(KernelType.class)
    public void testSymmetry(KernelType type) {
        Kernel kernel = new Kernel(type, 0.3);
        assertEquals(kernel.evaluate(A, B), kernel.evaluate(B, A), 1e-12);
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY })
    public void testInvalidGamma(double gamma) {
        assertThrows(IllegalArgumentException.class, () -> new Kernel(KernelType.RBF, gamma));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(NullPointerException.class, () -> new Kernel(null, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new Kernel(KernelType.POLYNOMIAL, 1.0, 0, 0.0));
    }

    @Test
    public void testScaleGamma() {
        assertThat(Kernel.scaleGamma(new double[][] { { 0, 0 }, { 2, 2 } }), closeTo(0.5, EPSILON));
        assertThat(Kernel.scaleGamma(new double[][] { { 3, 3 }, { 3, 3 } }), closeTo(1.0, EPSILON));
        assertThrows(IllegalArgumentException.class, () -> Kernel.scaleGamma(new double[0][]));
    }

    @Test
    public void testDefaults() {
        Kernel kernel = new Kernel(KernelType.POLYNOMIAL, 2.0);
        assertEquals(Kernel.DEFAULT_DEGREE, kernel.getDegree());
        assertEquals(Kernel.DEFAULT_COEF0, kernel.getCoef0());
        assertEquals(2.0, kernel.getGamma());
        assertEquals(KernelType.POLYNOMIAL, kernel.getType());
    }
}
