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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.velora.ensemble.exception.MalformedDatasetException;

public class TimestampParserTest {

    private TimestampParser parser;

    @BeforeEach
    public void setUp() {
        parser = new TimestampParser();
    }

    @ParameterizedTest
    @CsvSource({ "2024-03-01T10:15:30Z, 2024-03-01T10:15:30Z", "2024-03-01T12:15:30+02:00, 2024-03-01T10:15:30Z",
            "2024-03-01T10:15:30, 2024-03-01T10:15:30Z", "2024-03-01 10:15:30, 2024-03-01T10:15:30Z",
            "2024-03-01T10:15, 2024-03-01T10:15:00Z", "2024-03-01T10:15:30.250, 2024-03-01T10:15:30.250Z",
            "2024-03-01, 2024-03-01T00:00:00Z" })
    public void testParseInstant(String cell, String expected) {
        assertEquals(Instant.parse(expected), parser.parseInstant("Time", 0, cell));
    }

    @Test
    public void testNumericColumnIsOrderedNumerically() {
        Timestamps timestamps = parser.parse("Time", new String[] { "10", "9", "1e2", "-3" });
        assertEquals(4, timestamps.size());
        assertTrue(timestamps.compare(0, 1) > 0);
        assertTrue(timestamps.compare(2, 0) > 0);
        assertTrue(timestamps.compare(3, 1) < 0);
    }

    @Test
    public void testDateColumnIsOrderedOnTheTimeLine() {
        Timestamps timestamps = parser.parse("Time",
                new String[] { "2024-01-02", "2024-01-01T23:00:00", "2024-01-02T01:00:00+02:00" });
        assertTrue(timestamps.compare(1, 0) < 0);
        // 01:00+02:00 is 23:00 UTC on the previous day
        assertEquals(0, timestamps.compare(2, 1));
    }

    @Test
    public void testMissingTimestamp() {
        assertThrows(MalformedDatasetException.class, () -> parser.parse("Time", new String[] { "1", "" }));
        assertThrows(MalformedDatasetException.class, () -> parser.parse("Time", new String[] { "2024-01-01", "NA" }));
    }

    @Test
    public void testUnparseableTimestamp() {
        MalformedDatasetException e = assertThrows(MalformedDatasetException.class,
                () -> parser.parse("Time", new String[] { "2024-01-01", "yesterday" }));
        assertTrue(e.getMessage().contains("yesterday"));
    }
}
