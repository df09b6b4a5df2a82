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

import static com.velora.ensemble.CommonUtils.checkOpenFraction;
import static com.velora.ensemble.CommonUtils.checkState;
import static com.velora.ensemble.CommonUtils.saturate;

import java.util.Arrays;
import java.util.Comparator;

import lombok.extern.slf4j.Slf4j;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.Covariance;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.exception.DetectorFitException;

/**
 * Scores points by how badly the leading principal components of the training
 * data reconstruct them. The components kept are the fewest whose cumulative
 * explained variance reaches {@code varianceRetained}. The score is the mean
 * squared difference between a centred point and its projection onto the kept
 * subspace.
 */
@Slf4j
public class SubspaceReconstructionDetector extends AbstractDetector {

    public static final double DEFAULT_VARIANCE_RETAINED = 0.95;

    private final double varianceRetained;

    private double[] center;

    // one row per retained component, unit length
    private double[][] components;

    private double[] explainedVarianceRatio;

    public SubspaceReconstructionDetector() {
        this(DEFAULT_VARIANCE_RETAINED);
    }

    public SubspaceReconstructionDetector(double varianceRetained) {
        super(DetectorType.SUBSPACE);
        this.varianceRetained = checkOpenFraction(varianceRetained, "varianceRetained must be in (0, 1)");
    }

    @Override
    protected void fitModel(double[][] rows) {
        if (rows.length < 2) {
            throw new DetectorFitException(
                    String.format("subspace detector needs at least 2 training rows, found %d", rows.length));
        }
        int dimensions = rows[0].length;
        center = new double[dimensions];
        for (double[] row : rows) {
            for (int f = 0; f < dimensions; f++) {
                center[f] += row[f];
            }
        }
        for (int f = 0; f < dimensions; f++) {
            center[f] /= rows.length;
        }

        double[] eigenvalues = new double[dimensions];
        double[][] eigenvectors = new double[dimensions][];
        try {
            RealMatrix covariance = new Covariance(rows, true).getCovarianceMatrix();
            EigenDecomposition decomposition = new EigenDecomposition(covariance);
            for (int i = 0; i < dimensions; i++) {
                eigenvalues[i] = Math.max(0.0, decomposition.getRealEigenvalue(i));
                eigenvectors[i] = decomposition.getEigenvector(i).toArray();
            }
        } catch (MathIllegalArgumentException | MathIllegalStateException | MathArithmeticException e) {
            throw new DetectorFitException("principal component decomposition failed", e);
        }

        Integer[] order = new Integer[dimensions];
        for (int i = 0; i < dimensions; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> eigenvalues[i]).reversed());

        double total = 0;
        for (double value : eigenvalues) {
            total += value;
        }
        explainedVarianceRatio = new double[dimensions];
        int kept = 1;
        if (total > 0) {
            double cumulative = 0;
            kept = dimensions;
            for (int i = 0; i < dimensions; i++) {
                explainedVarianceRatio[i] = eigenvalues[order[i]] / total;
                cumulative += explainedVarianceRatio[i];
                if (cumulative >= varianceRetained && kept == dimensions) {
                    kept = i + 1;
                }
            }
        }
        components = new double[kept][];
        for (int i = 0; i < kept; i++) {
            components[i] = eigenvectors[order[i]];
        }
        log.debug("retained {} of {} principal components", kept, dimensions);
    }

    @Override
    protected double scorePoint(double[] point) {
        int dimensions = center.length;
        double[] centred = new double[dimensions];
        double magnitude = 0;
        for (int f = 0; f < dimensions; f++) {
            centred[f] = saturate(point[f] - center[f]);
            magnitude = Math.max(magnitude, Math.abs(centred[f]));
        }
        if (magnitude == 0) {
            return 0;
        }
        // work on the unit-scaled point so that projections and squares stay finite
        for (int f = 0; f < dimensions; f++) {
            centred[f] /= magnitude;
        }
        double[] reconstruction = new double[dimensions];
        for (double[] component : components) {
            double projection = 0;
            for (int f = 0; f < dimensions; f++) {
                projection += component[f] * centred[f];
            }
            for (int f = 0; f < dimensions; f++) {
                reconstruction[f] += projection * component[f];
            }
        }
        double sum = 0;
        for (int f = 0; f < dimensions; f++) {
            double error = centred[f] - reconstruction[f];
            sum += error * error;
        }
        if (sum == 0) {
            return 0;
        }
        return saturate(magnitude * (magnitude * (sum / dimensions)));
    }

    public int getNumberOfComponents() {
        checkState(isFitted(), "the subspace detector has not been fitted");
        return components.length;
    }

    /**
     * @return the explained variance ratio of every component, largest first
     */
    public double[] getExplainedVarianceRatio() {
        checkState(isFitted(), "the subspace detector has not been fitted");
        return Arrays.copyOf(explainedVarianceRatio, explainedVarianceRatio.length);
    }

    public double getVarianceRetained() {
        return varianceRetained;
    }
}
