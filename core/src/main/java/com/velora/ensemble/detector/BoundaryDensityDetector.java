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
import static com.velora.ensemble.CommonUtils.checkState;

import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.config.KernelType;

/**
 * A one-class support vector machine. The fitted boundary encloses all but
 * roughly a {@code nu} share of the training points; the score of a point is
 * {@code rho - sum_i alpha_i K(sv_i, x)}, positive outside the boundary and
 * negative inside it.
 */
@Slf4j
public class BoundaryDensityDetector extends AbstractDetector {

    public static final double DEFAULT_NU = 0.05;

    public static final KernelType DEFAULT_KERNEL = KernelType.RBF;

    private final double nu;

    private final KernelType kernelType;

    private final Optional<Double> gamma;

    private final OneClassSolver solver;

    private Kernel kernel;

    private double[][] supportVectors;

    private double[] coefficients;

    private double rho;

    public BoundaryDensityDetector() {
        this(DEFAULT_NU, DEFAULT_KERNEL, Optional.empty());
    }

    /**
     * @param nu         upper bound on the share of training points outside the
     *                   boundary, in (0, 1)
     * @param kernelType the kernel family
     * @param gamma      the kernel coefficient; when empty it is derived from the
     *                   training matrix with {@link Kernel#scaleGamma}
     */
    public BoundaryDensityDetector(double nu, KernelType kernelType, Optional<Double> gamma) {
        this(nu, kernelType, gamma, new OneClassSolver());
    }

    BoundaryDensityDetector(double nu, KernelType kernelType, Optional<Double> gamma, OneClassSolver solver) {
        super(DetectorType.BOUNDARY);
        checkArgument(nu > 0 && nu < 1, "nu must be in (0, 1)");
        checkNotNull(gamma, "gamma must not be null, use Optional.empty()");
        gamma.ifPresent(g -> checkArgument(Double.isFinite(g) && g > 0, "gamma must be a positive finite number"));
        this.nu = nu;
        this.kernelType = checkNotNull(kernelType, "kernelType must not be null");
        this.gamma = gamma;
        this.solver = checkNotNull(solver, "solver must not be null");
    }

    @Override
    protected void fitModel(double[][] rows) {
        kernel = new Kernel(kernelType, gamma.orElseGet(() -> Kernel.scaleGamma(rows)));
        KernelCache cache = new KernelCache(rows, kernel);
        OneClassSolver.Solution solution = solver.solve(cache, rows.length, nu);
        double[] alpha = solution.getAlpha();

        int count = 0;
        for (double a : alpha) {
            if (a > 0) {
                count++;
            }
        }
        supportVectors = new double[count][];
        coefficients = new double[count];
        int next = 0;
        for (int i = 0; i < alpha.length; i++) {
            if (alpha[i] > 0) {
                supportVectors[next] = rows[i];
                coefficients[next] = alpha[i];
                next++;
            }
        }
        rho = solution.getRho();
        log.debug("{}: {} support vectors, rho {}, {} kernel rows computed", kernel, count, rho, cache.getMisses());
    }

    @Override
    protected double scorePoint(double[] point) {
        double sum = 0;
        for (int i = 0; i < supportVectors.length; i++) {
            sum += coefficients[i] * kernel.evaluate(supportVectors[i], point);
        }
        return rho - sum;
    }

    public int getNumberOfSupportVectors() {
        checkState(isFitted(), "the boundary detector has not been fitted");
        return supportVectors.length;
    }

    public double getRho() {
        checkState(isFitted(), "the boundary detector has not been fitted");
        return rho;
    }

    public Kernel getKernel() {
        checkState(isFitted(), "the boundary detector has not been fitted");
        return kernel;
    }

    public double getNu() {
        return nu;
    }

    public KernelType getKernelType() {
        return kernelType;
    }
}
