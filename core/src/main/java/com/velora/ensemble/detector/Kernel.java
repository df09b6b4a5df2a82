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
import static com.velora.ensemble.CommonUtils.checkNotNull;
import static com.velora.ensemble.CommonUtils.saturate;

import com.velora.ensemble.config.KernelType;
import com.velora.ensemble.statistics.Deviation;

/**
 * A kernel function for the boundary detector. Polynomial kernels use degree 3;
 * polynomial and sigmoid kernels use a zero offset.
 */
public class Kernel {

    public static final int DEFAULT_DEGREE = 3;

    public static final double DEFAULT_COEF0 = 0.0;

    private final KernelType type;

    private final double gamma;

    private final int degree;

    private final double coef0;

    public Kernel(KernelType type, double gamma) {
        this(type, gamma, DEFAULT_DEGREE, DEFAULT_COEF0);
    }

    public Kernel(KernelType type, double gamma, int degree, double coef0) {
        this.type = checkNotNull(type, "type must not be null");
        checkArgument(Double.isFinite(gamma) && gamma > 0, "gamma must be a positive finite number");
        checkArgument(degree > 0, "degree must be greater than 0");
        this.gamma = gamma;
        this.degree = degree;
        this.coef0 = coef0;
    }

    /**
     * The "scale" gamma: {@code 1 / (d * var(X))} where the variance is taken over
     * every cell of the matrix. A matrix without variance gets gamma 1.
     *
     * @param rows the training rows
     * @return the gamma
     */
    public static double scaleGamma(double[][] rows) {
        checkArgument(rows.length > 0, "rows must not be empty");
        Deviation deviation = new Deviation();
        for (double[] row : rows) {
            deviation.update(row);
        }
        double variance = deviation.getVariance();
        int dimensions = rows[0].length;
        return (variance > 0) ? 1.0 / (dimensions * variance) : 1.0;
    }

    public double evaluate(double[] a, double[] b) {
        switch (type) {
        case RBF:
            double distance = 0;
            for (int i = 0; i < a.length; i++) {
                double diff = a[i] - b[i];
                distance += diff * diff;
            }
            return Math.exp(-gamma * distance);
        case LINEAR:
            return dot(a, b);
        case POLYNOMIAL:
            return saturate(Math.pow(gamma * dot(a, b) + coef0, degree));
        case SIGMOID:
            return Math.tanh(gamma * dot(a, b) + coef0);
        default:
            throw new IllegalStateException("unknown kernel " + type);
        }
    }

    /**
     * The inner product, clamped to the finite range. Vectors whose products
     * overflow are rescaled to unit magnitude first.
     */
    static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        if (Double.isFinite(sum)) {
            return sum;
        }
        double scaleA = maxAbs(a);
        double scaleB = maxAbs(b);
        double scaled = 0;
        for (int i = 0; i < a.length; i++) {
            scaled += (a[i] / scaleA) * (b[i] / scaleB);
        }
        if (scaled == 0) {
            return 0;
        }
        return saturate(scaleA * (scaleB * scaled));
    }

    private static double maxAbs(double[] values) {
        double max = 0;
        for (double value : values) {
            max = Math.max(max, Math.abs(value));
        }
        return max;
    }

    public KernelType getType() {
        return type;
    }

    public double getGamma() {
        return gamma;
    }

    public int getDegree() {
        return degree;
    }

    public double getCoef0() {
        return coef0;
    }

    @Override
    public String toString() {
        return String.format("Kernel(%s, gamma=%g)", type, gamma);
    }
}
