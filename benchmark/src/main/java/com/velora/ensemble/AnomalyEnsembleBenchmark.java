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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.velora.ensemble.dataset.Dataset;
import com.velora.ensemble.returntypes.EnsembleResult;
import com.velora.ensemble.testutils.TableWithKey;
import com.velora.ensemble.testutils.TimeSeriesTestData;

@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class AnomalyEnsembleBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "1000", "4000" })
        int numberOfRows;

        @Param({ "4", "16" })
        int numberOfFeatures;

        @Param({ "false", "true" })
        boolean parallel;

        Dataset dataset;
        AnomalyEnsemble ensemble;

        @Setup(Level.Trial)
        public void setUpData() {
            TableWithKey table = new TimeSeriesTestData().outliers(new int[] { numberOfRows - 10 }, 12.0)
                    .generate(numberOfRows, numberOfFeatures, 17);
            dataset = new Dataset(table.getHeader(), table.getRows());
            ensemble = AnomalyEnsemble.builder().parallelExecutionEnabled(parallel).randomSeed(42).build();
        }
    }

    @Benchmark
    public EnsembleResult score(BenchmarkState state, Blackhole blackhole) {
        EnsembleResult result = state.ensemble.score(state.dataset);
        blackhole.consume(result.getCompositeScores());
        return result;
    }
}
