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

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Sequential minimal optimization for the one-class SVM dual
 *
 * <pre>
 * min 0.5 a'Qa   subject to   0 &lt;= a_i &lt;= 1,   sum a_i = nu * l
 * </pre>
 *
 * where {@code Q_ij = K(x_i, x_j)}. Each step picks the maximal violating pair
 * by first order information and solves the two-variable subproblem exactly.
 */
@Slf4j
public class OneClassSolver {

    public static final double DEFAULT_TOLERANCE = 1e-3;

    static final double TAU = 1e-12;

    static final double UPPER_BOUND = 1.0;

    private final double tolerance;

    private final int maxIterations;

    public OneClassSolver() {
        this(DEFAULT_TOLERANCE, -1);
    }

    /**
     * @param tolerance     the stopping tolerance on the maximal violation
     * @param maxIterations the iteration cap; a negative value means
     *                      {@code max(100 * l, 100000)}
     */
    public OneClassSolver(double tolerance, int maxIterations) {
        checkArgument(tolerance > 0, "tolerance must be positive");
        checkArgument(maxIterations != 0, "maxIterations must not be 0");
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    public Solution solve(KernelCache cache, int l, double nu) {
        checkArgument(l > 0, "there must be at least one training point");
        checkArgument(nu > 0 && nu < 1, "nu must be in (0, 1)");

        double[] alpha = new double[l];
        int full = (int) Math.floor(nu * l);
        for (int i = 0; i < full; i++) {
            alpha[i] = UPPER_BOUND;
        }
        if (full < l) {
            alpha[full] = nu * l - full;
        }

        double[] gradient = new double[l];
        for (int i = 0; i < l; i++) {
            if (alpha[i] > 0) {
                double[] row = cache.getRow(i);
                for (int k = 0; k < l; k++) {
                    gradient[k] += alpha[i] * row[k];
                }
            }
        }

        int cap = (maxIterations > 0) ? maxIterations : (int) Math.min(Integer.MAX_VALUE, Math.max(100L * l, 100000L));
        int iteration = 0;
        boolean converged = false;
        while (iteration < cap) {
            int i = -1;
            int j = -1;
            double gmax = Double.NEGATIVE_INFINITY;
            double gmin = Double.POSITIVE_INFINITY;
            for (int t = 0; t < l; t++) {
                if (alpha[t] < UPPER_BOUND && -gradient[t] >= gmax) {
                    gmax = -gradient[t];
                    i = t;
                }
                if (alpha[t] > 0 && -gradient[t] <= gmin) {
                    gmin = -gradient[t];
                    j = t;
                }
            }
            if (i < 0 || j < 0 || gmax - gmin < tolerance) {
                converged = true;
                break;
            }
            iteration++;

            double[] rowI = cache.getRow(i);
            double[] rowJ = cache.getRow(j);
            double oldI = alpha[i];
            double oldJ = alpha[j];
            double quad = cache.getDiagonal(i) + cache.getDiagonal(j) - 2 * rowI[j];
            if (quad <= 0) {
                quad = TAU;
            }
            double delta = (gradient[i] - gradient[j]) / quad;
            double sum = alpha[i] + alpha[j];
            alpha[i] -= delta;
            alpha[j] += delta;
            if (sum > UPPER_BOUND) {
                if (alpha[i] > UPPER_BOUND) {
                    alpha[i] = UPPER_BOUND;
                    alpha[j] = sum - UPPER_BOUND;
                }
            } else if (alpha[j] < 0) {
                alpha[j] = 0;
                alpha[i] = sum;
            }
            if (sum > UPPER_BOUND) {
                if (alpha[j] > UPPER_BOUND) {
                    alpha[j] = UPPER_BOUND;
                    alpha[i] = sum - UPPER_BOUND;
                }
            } else if (alpha[i] < 0) {
                alpha[i] = 0;
                alpha[j] = sum;
            }

            double deltaI = alpha[i] - oldI;
            double deltaJ = alpha[j] - oldJ;
            for (int k = 0; k < l; k++) {
                gradient[k] += rowI[k] * deltaI + rowJ[k] * deltaJ;
            }
        }
        if (converged) {
            log.debug("one-class optimization converged after {} iterations", iteration);
        } else {
            log.warn("one-class optimization stopped at the iteration cap of {} before reaching tolerance {}", cap,
                    tolerance);
        }
        return new Solution(alpha, offset(alpha, gradient), iteration, converged);
    }

    // the average gradient over free variables, or the midpoint of the feasible range
    static double offset(double[] alpha, double[] gradient) {
        double upper = Double.POSITIVE_INFINITY;
        double lower = Double.NEGATIVE_INFINITY;
        double sumFree = 0;
        int free = 0;
        for (int t = 0; t < alpha.length; t++) {
            if (alpha[t] >= UPPER_BOUND) {
                lower = Math.max(lower, gradient[t]);
            } else if (alpha[t] <= 0) {
                upper = Math.min(upper, gradient[t]);
            } else {
                sumFree += gradient[t];
                free++;
            }
        }
        return (free > 0) ? sumFree / free : (upper + lower) / 2;
    }

    @Getter
    public static class Solution {
        private final double[] alpha;
        private final double rho;
        private final int iterations;
        private final boolean converged;

        Solution(double[] alpha, double rho, int iterations, boolean converged) {
            this.alpha = alpha;
            this.rho = rho;
            this.iterations = iterations;
            this.converged = converged;
        }
    }
}
