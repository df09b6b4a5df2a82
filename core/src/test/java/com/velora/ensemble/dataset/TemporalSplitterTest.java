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

import static com.velora.ensemble.TestUtils.dataset;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.velora.ensemble.TestUtils;
import com.velora.ensemble.exception.InsufficientDataException;
import com.velora.ensemble.exception.MalformedDatasetException;
import com.velora.ensemble.testutils.TimeSeriesTestData;

public class TemporalSplitterTest {

    @Test
    public void testDefaults() {
        TemporalSplitter splitter = new TemporalSplitter();
        assertEquals("Time", splitter.getTimestampColumn());
        assertEquals(0.7, splitter.getTrainFraction());
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.0, 1.0, -0.1, 1.2 })
    public void testInvalidFraction(double fraction) {
        assertThrows(IllegalArgumentException.class, () -> new TemporalSplitter("Time", fraction));
    }

    @ParameterizedTest
    @CsvSource({ "10, 0.7, 7", "100, 0.7, 70", "7, 0.5, 3", "3, 0.7, 2" })
    public void testSplitSizes(int n, double fraction, int expectedTrain) {
        Dataset dataset = TestUtils.dataset(new TimeSeriesTestData().shuffled(true).generate(n, 2, 3));
        TemporalSplit split = new TemporalSplitter("Time", fraction).split(dataset);
        assertEquals(expectedTrain, split.getTrain().size());
        assertEquals(n, split.getTrain().size() + split.getTest().size());
    }

    @Test
    public void testTrainPrecedesTest() {
        Dataset dataset = TestUtils.dataset(new TimeSeriesTestData().shuffled(true).isoTimestamps(true)
                .generate(50, 2, 11));
        TemporalSplit split = new TemporalSplitter().split(dataset);
        TimestampParser parser = new TimestampParser();
        String latestTrain = null;
        for (String cell : split.getTrain().getColumn(0)) {
            if (latestTrain == null || parser.parseInstant("Time", 0, cell)
                    .isAfter(parser.parseInstant("Time", 0, latestTrain))) {
                latestTrain = cell;
            }
        }
        for (String cell : split.getTest().getColumn(0)) {
            assertTrue(!parser.parseInstant("Time", 0, cell).isBefore(parser.parseInstant("Time", 0, latestTrain)));
        }
        // sorted within each partition
        assertEquals("2024-01-01T00:00:00", split.getTrain().getCell(0, 0));
        assertEquals("2024-01-02T10:00:00", split.getTrain().getCell(34, 0));
        assertEquals("2024-01-02T11:00:00", split.getTest().getCell(0, 0));
    }

    @Test
    public void testTiesKeepInputOrder() {
        Dataset dataset = dataset(Arrays.asList("Time", "id"), new String[] { "2", "a" },
                new String[] { "1", "b" }, new String[] { "2", "c" }, new String[] { "1", "d" });
        TemporalSplit split = new TemporalSplitter("Time", 0.5).split(dataset);
        assertArrayEquals(new String[] { "b", "d" }, split.getTrain().getColumn(1));
        assertArrayEquals(new String[] { "a", "c" }, split.getTest().getColumn(1));
    }

    @Test
    public void testInsufficientData() {
        Dataset one = dataset(Arrays.asList("Time", "a"), new String[] { "1", "2" });
        assertThrows(InsufficientDataException.class, () -> new TemporalSplitter().split(one));
        Dataset two = dataset(Arrays.asList("Time", "a"), new String[] { "1", "2" }, new String[] { "2", "3" });
        // floor(2 * 0.4) = 0 training records
        assertThrows(InsufficientDataException.class, () -> new TemporalSplitter("Time", 0.4).split(two));
        Dataset empty = dataset(Arrays.asList("Time", "a"));
        assertThrows(InsufficientDataException.class, () -> new TemporalSplitter().split(empty));
    }

    @Test
    public void testMissingTimestampColumn() {
        Dataset dataset = dataset(Arrays.asList("When", "a"), new String[] { "1", "2" }, new String[] { "2", "3" });
        assertThrows(MalformedDatasetException.class, () -> new TemporalSplitter().split(dataset));
    }
}
