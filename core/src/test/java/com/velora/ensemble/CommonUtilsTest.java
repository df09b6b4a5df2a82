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

package com.velora.ensemble;

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;
import static com.velora.ensemble.CommonUtils.checkOpenFraction;
import static com.velora.ensemble.CommonUtils.checkState;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class CommonUtilsTest {

    @Test
    public void testCheckArgument() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> checkArgument(false, "bad argument"));
        assertEquals("bad argument", e.getMessage());
        assertDoesNotThrow(() -> checkArgument(true, "not thrown"));
    }

    @Test
    public void testCheckState() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> checkState(false, "bad state"));
        assertEquals("bad state", e.getMessage());
        assertDoesNotThrow(() -> checkState(true, "not thrown"));
    }

    @Test
    public void testCheckNotNull() {
        NullPointerException e = assertThrows(NullPointerException.class, () -> checkNotNull(null, "null value"));
        assertEquals("null value", e.getMessage());
        String value = "value";
        assertSame(value, checkNotNull(value, "not thrown"));
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 1.0, -0.5, 1.5, Double.NaN })
    public void testCheckOpenFractionRejects(double value) {
        assertThrows(IllegalArgumentException.class, () -> checkOpenFraction(value, "fraction"));
    }

    @Test
    public void testCheckOpenFraction() {
        assertEquals(0.7, checkOpenFraction(0.7, "fraction"));
    }
}
