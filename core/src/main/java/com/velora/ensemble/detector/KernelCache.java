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

import static com.velora.ensemble.CommonUtils.checkArgument;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Least-recently-used cache of kernel matrix rows over a fixed set of training
 * points. Row {@code i} holds {@code K(x_i, x_k)} for every training point
 * {@code k}; rows are computed on first access.
 */
public class KernelCache {

    public static final int DEFAULT_CACHE_MEGABYTES = 64;

    private final double[][] points;

    private final Kernel kernel;

    private final double[] diagonal;

    private final int capacity;

    private final LinkedHashMap<Integer, double[]> rows;

    private long misses = 0;

    public KernelCache(double[][] points, Kernel kernel) {
        this(points, kernel, capacityFor(points.length, DEFAULT_CACHE_MEGABYTES));
    }

    public KernelCache(double[][] points, Kernel kernel, int capacity) {
        checkArgument(capacity >= 2, "the cache must hold at least two rows");
        this.points = points;
        this.kernel = kernel;
        this.capacity = capacity;
        this.rows = new LinkedHashMap<Integer, double[]>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Integer, double[]> eldest) {
                return size() > KernelCache.this.capacity;
            }
        };
        diagonal = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            diagonal[i] = kernel.evaluate(points[i], points[i]);
        }
    }

    /**
     * @param numberOfPoints the number of training points
     * @param megabytes      the memory budget
     * @return how many rows of {@code numberOfPoints} doubles fit in the budget,
     *         at least 2
     */
    static int capacityFor(int numberOfPoints, int megabytes) {
        long rowBytes = 8L * Math.max(numberOfPoints, 1);
        long fit = ((long) megabytes << 20) / rowBytes;
        return (int) Math.max(2, Math.min(Integer.MAX_VALUE, fit));
    }

    public double[] getRow(int i) {
        double[] row = rows.get(i);
        if (row == null) {
            misses++;
            row = new double[points.length];
            for (int k = 0; k < points.length; k++) {
                row[k] = (k == i) ? diagonal[i] : kernel.evaluate(points[i], points[k]);
            }
            rows.put(i, row);
        }
        return row;
    }

    public double getDiagonal(int i) {
        return diagonal[i];
    }

    public int size() {
        return rows.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public long getMisses() {
        return misses;
    }
}
