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

package com.velora.ensemble.dataset;

import static com.velora.ensemble.CommonUtils.checkNotNull;
import static com.velora.ensemble.CommonUtils.checkOpenFraction;

import java.util.Arrays;

import lombok.extern.slf4j.Slf4j;

import com.velora.ensemble.exception.InsufficientDataException;
import com.velora.ensemble.exception.MalformedDatasetException;

/**
 * Orders a dataset by its timestamp column and cuts it into a training prefix
 * and a test suffix. There is no shuffling: the test partition is always the
 * most recent data.
 */
@Slf4j
public class TemporalSplitter {

    public static final String DEFAULT_TIMESTAMP_COLUMN = "Time";

    public static final double DEFAULT_TRAIN_FRACTION = 0.7;

    private final String timestampColumn;

    private final double trainFraction;

    private final TimestampParser parser;

    public TemporalSplitter() {
        this(DEFAULT_TIMESTAMP_COLUMN, DEFAULT_TRAIN_FRACTION);
    }

    public TemporalSplitter(String timestampColumn, double trainFraction) {
        this.timestampColumn = checkNotNull(timestampColumn, "timestampColumn must not be null");
        this.trainFraction = checkOpenFraction(trainFraction, "trainFraction must be in (0, 1)");
        this.parser = new TimestampParser();
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public double getTrainFraction() {
        return trainFraction;
    }

    /**
     * Stable-sorts the dataset by timestamp and splits it at
     * {@code floor(n * trainFraction)}.
     *
     * @param dataset the full input
     * @return the training and test partitions
     * @throws MalformedDatasetException  if the timestamp column is absent or
     *                                    unparseable
     * @throws InsufficientDataException if either partition would be empty
     */
    public TemporalSplit split(Dataset dataset) {
        checkNotNull(dataset, "dataset must not be null");
        int column = dataset.indexOf(timestampColumn);
        if (column < 0) {
            throw new MalformedDatasetException(
                    String.format("timestamp column %s not found in %s", timestampColumn, dataset.getColumnNames()));
        }
        Timestamps timestamps = parser.parse(timestampColumn, dataset.getColumn(column));
        int[] order = sortedOrder(timestamps);

        int n = dataset.size();
        int k = (int) Math.floor(n * trainFraction);
        if (k == 0 || k == n) {
            throw new InsufficientDataException(String.format(
                    "splitting %d records at fraction %s leaves %d training and %d test records", n, trainFraction,
                    k, n - k));
        }
        Dataset sorted = dataset.select(order);
        log.info("Train size: {} | Test size: {}", k, n - k);
        log.debug("training ends at {}, test starts at {}", timestamps.toString(order[k - 1]),
                timestamps.toString(order[k]));
        return new TemporalSplit(sorted.slice(0, k), sorted.slice(k, n));
    }

    /**
     * @param timestamps parsed keys
     * @return record positions in ascending time order, ties in original order
     */
    static int[] sortedOrder(Timestamps timestamps) {
        Integer[] positions = new Integer[timestamps.size()];
        for (int i = 0; i < positions.length; i++) {
            positions[i] = i;
        }
        // object sort is stable
        Arrays.sort(positions, timestamps::compare);
        return Arrays.stream(positions).mapToInt(Integer::intValue).toArray();
    }
}
