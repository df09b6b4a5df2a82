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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

import com.velora.ensemble.exception.MalformedDatasetException;

/**
 * Turns the cells of a timestamp column into a total order. A column whose
 * cells are all plain numbers is ordered numerically; otherwise every cell has
 * to be an ISO-8601 date or date-time and the column is ordered on the UTC time
 * line. Local date-times are read as UTC.
 */
public class TimestampParser {

    private static final DateTimeFormatter ISO_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE).optionalStart().optionalStart().appendLiteral('T')
            .optionalEnd().optionalStart().appendLiteral(' ').optionalEnd().appendValue(ChronoField.HOUR_OF_DAY, 2)
            .appendLiteral(':').appendValue(ChronoField.MINUTE_OF_HOUR, 2).optionalStart().appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2).optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd().optionalEnd().optionalStart()
            .appendOffsetId().optionalEnd().optionalEnd().toFormatter();

    /**
     * Parses a whole column.
     *
     * @param columnName name used in error messages
     * @param cells      the raw cells in record order
     * @return comparable keys, one per cell
     * @throws MalformedDatasetException if a cell is missing or not a timestamp
     */
    public Timestamps parse(String columnName, String[] cells) {
        boolean numeric = true;
        for (int i = 0; i < cells.length; i++) {
            if (Cells.isMissing(cells[i])) {
                throw new MalformedDatasetException(
                        String.format("missing timestamp in column %s at record %d", columnName, i));
            }
            numeric &= Cells.isNumber(cells[i]);
        }
        if (numeric) {
            double[] values = new double[cells.length];
            for (int i = 0; i < cells.length; i++) {
                values[i] = Cells.toNumber(cells[i]);
            }
            return Timestamps.ofNumbers(values);
        }
        Instant[] instants = new Instant[cells.length];
        for (int i = 0; i < cells.length; i++) {
            instants[i] = parseInstant(columnName, i, cells[i].trim());
        }
        return Timestamps.ofInstants(instants);
    }

    Instant parseInstant(String columnName, int record, String cell) {
        TemporalAccessor parsed;
        try {
            parsed = ISO_DATE_TIME.parseBest(cell, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        } catch (DateTimeParseException e) {
            throw new MalformedDatasetException(String.format("cannot parse timestamp '%s' in column %s at record %d",
                    cell, columnName, record), e);
        }
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).toInstant();
        } else if (parsed instanceof LocalDateTime) {
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        }
        return ((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
}
