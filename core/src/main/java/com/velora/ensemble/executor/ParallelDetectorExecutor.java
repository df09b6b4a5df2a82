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

package com.velora.ensemble.executor;

import static com.velora.ensemble.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.detector.IAnomalyDetector;
import com.velora.ensemble.preprocessor.FeatureMatrix;
import com.velora.ensemble.returntypes.RawScores;

/**
 * An executor that uses a private thread pool to fit and score detectors in
 * parallel, one task per detector. Detectors share no mutable state, so the
 * results are identical to those of {@link SequentialDetectorExecutor}. The
 * first failing task, in detector order, aborts the call with its original
 * exception.
 */
public class ParallelDetectorExecutor extends AbstractDetectorExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelDetectorExecutor(List<IAnomalyDetector> detectors, int threadPoolSize) {
        super(detectors);
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
        forkJoinPool = new ForkJoinPool(threadPoolSize);
    }

    @Override
    public void fit(FeatureMatrix train) {
        List<Callable<DetectorType>> tasks = new ArrayList<>();
        for (IAnomalyDetector detector : detectors) {
            tasks.add(() -> {
                detector.fit(train);
                return detector.getType();
            });
        }
        submitAndJoin(tasks);
    }

    @Override
    public RawScores score(FeatureMatrix matrix) {
        List<Callable<double[]>> tasks = new ArrayList<>();
        for (IAnomalyDetector detector : detectors) {
            tasks.add(() -> detector.score(matrix));
        }
        List<double[]> results = submitAndJoin(tasks);
        EnumMap<DetectorType, double[]> scores = new EnumMap<>(DetectorType.class);
        for (int i = 0; i < detectors.size(); i++) {
            scores.put(detectors.get(i).getType(), results.get(i));
        }
        return new RawScores(scores);
    }

    @Override
    public void close() {
        if (forkJoinPool != null) {
            forkJoinPool.shutdown();
            forkJoinPool = null;
        }
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    private <T> List<T> submitAndJoin(List<Callable<T>> tasks) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        List<Future<T>> futures = new ArrayList<>();
        for (Callable<T> task : tasks) {
            futures.add(forkJoinPool.submit(task));
        }
        List<T> results = new ArrayList<>();
        try {
            for (Future<T> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for detectors", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("detector task failed", cause);
        }
        return results;
    }
}
