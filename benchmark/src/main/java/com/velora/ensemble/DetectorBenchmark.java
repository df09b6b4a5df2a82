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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.velora.ensemble.config.KernelType;
import com.velora.ensemble.detector.BoundaryDensityDetector;
import com.velora.ensemble.detector.IAnomalyDetector;
import com.velora.ensemble.detector.IsolationForestDetector;
import com.velora.ensemble.detector.SubspaceReconstructionDetector;
import com.velora.ensemble.preprocessor.FeatureMatrix;
import com.velora.ensemble.preprocessor.FeatureScaler;
import com.velora.ensemble.testutils.TableWithKey;
import com.velora.ensemble.testutils.TimeSeriesTestData;

/**
 * Fit-and-score cost of each detector on its own.
 */
@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class DetectorBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "2000" })
        int numberOfRows;

        @Param({ "8" })
        int numberOfFeatures;

        @Param({ "isolation", "subspace", "boundary" })
        String detector;

        FeatureMatrix train;
        FeatureMatrix test;

        @Setup(Level.Trial)
        public void setUpData() {
            TableWithKey table = new TimeSeriesTestData().generate(numberOfRows, numberOfFeatures, 5);
            List<String> names = table.getHeader().subList(1, table.getHeader().size());
            int split = (int) (numberOfRows * 0.7);
            FeatureMatrix raw = new FeatureMatrix(names, toValues(table.getRows(), 0, split));
            FeatureMatrix rawTest = new FeatureMatrix(names, toValues(table.getRows(), split, numberOfRows));
            FeatureScaler scaler = new FeatureScaler().fit(raw);
            train = scaler.transform(raw);
            test = scaler.transform(rawTest);
        }

        IAnomalyDetector newDetector() {
            switch (detector) {
            case "isolation":
                return new IsolationForestDetector(42);
            case "subspace":
                return new SubspaceReconstructionDetector();
            default:
                return new BoundaryDensityDetector(BoundaryDensityDetector.DEFAULT_NU, KernelType.RBF,
                        Optional.empty());
            }
        }

        private static double[][] toValues(List<String[]> rows, int from, int to) {
            List<double[]> values = new ArrayList<>();
            for (String[] row : rows.subList(from, to)) {
                double[] point = new double[row.length - 1];
                for (int j = 1; j < row.length; j++) {
                    point[j - 1] = Double.parseDouble(row[j]);
                }
                values.add(point);
            }
            return values.toArray(new double[0][]);
        }
    }

    @Benchmark
    public double[] fitAndScore(BenchmarkState state) {
        IAnomalyDetector detector = state.newDetector();
        detector.fit(state.train);
        return detector.score(state.test);
    }
}
