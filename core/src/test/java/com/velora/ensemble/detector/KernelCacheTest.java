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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.velora.ensemble.config.KernelType;

public class KernelCacheTest {

    private static final double[][] POINTS = new double[][] { { 0.0 }, { 1.0 }, { 2.0 }, { 3.0 } };

    private final Kernel kernel = new Kernel(KernelType.LINEAR, 1.0);

    @Test
    public void testCapacityFor() {
        assertEquals(8388, KernelCache.capacityFor(1000, 64));
        assertEquals(2, KernelCache.capacityFor(Integer.MAX_VALUE, 1));
        assertEquals(64 << 17, KernelCache.capacityFor(0, 64));
    }

    @Test
    public void testRowsAndDiagonal() {
        KernelCache cache = new KernelCache(POINTS, kernel);
        for (int i = 0; i < POINTS.length; i++) {
            assertEquals(POINTS[i][0] * POINTS[i][0], cache.getDiagonal(i));
        }
        double[] row = cache.getRow(2);
        assertEquals(4, row.length);
        assertEquals(6.0, row[3]);
        assertEquals(4.0, row[2]);
        assertEquals(0.0, row[0]);
    }

    @Test
    public void testLeastRecentlyUsedRowIsEvicted() {
        KernelCache cache = new KernelCache(POINTS, kernel, 2);
        assertEquals(2, cache.getCapacity());
        double[] first = cache.getRow(0);
        cache.getRow(1);
        assertSame(first, cache.getRow(0));
        assertEquals(2, cache.getMisses());

        // row 1 is now the eldest
        cache.getRow(2);
        assertEquals(2, cache.size());
        assertSame(first, cache.getRow(0));
        assertEquals(3, cache.getMisses());
        cache.getRow(1);
        assertEquals(4, cache.getMisses());
        assertEquals(2, cache.size());
    }

    @Test
    public void testCapacityMustHoldTwoRows() {
        assertThrows(IllegalArgumentException.class, () -> new KernelCache(POINTS, kernel, 1));
    }
}
