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

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.velora.ensemble.exception.MalformedDatasetException;

/**
 * Reads a {@link Dataset} from delimited text. The first non-blank line is the
 * header. Blank lines are skipped. Unquoted cells are trimmed. A cell wrapped in
 * double quotes is taken verbatim and may contain the delimiter, line breaks and
 * doubled quotes standing for one quote, which is how {@code CsvTableWriter}
 * escapes cells.
 */
@Slf4j
public class DatasetReader {

    public static final String DEFAULT_DELIMITER = ",";

    private static final char QUOTE = '"';

    private final String delimiter;

    public DatasetReader() {
        this(DEFAULT_DELIMITER);
    }

    public DatasetReader(String delimiter) {
        checkNotNull(delimiter, "delimiter must not be null");
        checkArgument(!delimiter.isEmpty(), "delimiter must not be empty");
        checkArgument(delimiter.indexOf(QUOTE) < 0, "delimiter must not contain a double quote");
        this.delimiter = delimiter;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public Dataset read(BufferedReader in) throws IOException {
        List<String> header = null;
        List<String[]> rows = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            int firstLine = lineNumber;
            String record = line;
            String[] values = split(record, firstLine);
            while (values == null) {
                String continuation = in.readLine();
                if (continuation == null) {
                    throw new MalformedDatasetException(
                            String.format("Unterminated quoted value starting on line %d.", firstLine));
                }
                lineNumber++;
                record = record + "\n" + continuation;
                values = split(record, firstLine);
            }
            if (header == null) {
                header = Arrays.asList(values);
                continue;
            }
            if (values.length != header.size()) {
                throw new MalformedDatasetException(String.format(
                        "Wrong number of values on line %d. Expected %d but found %d.", firstLine, header.size(),
                        values.length));
            }
            rows.add(values);
        }
        if (header == null) {
            throw new MalformedDatasetException("input contains no header row");
        }
        log.debug("read {} records with {} columns", rows.size(), header.size());
        return new Dataset(header, rows);
    }

    public Dataset read(String text) {
        try {
            return read(new BufferedReader(new StringReader(text)));
        } catch (IOException e) {
            throw new IllegalStateException("reading from a string cannot fail", e);
        }
    }

    /**
     * Splits one record into cells.
     *
     * @param record     the record, possibly spanning several lines
     * @param lineNumber the line the record starts on
     * @return the cells, or null if the record ends inside a quoted cell
     */
    String[] split(String record, int lineNumber) {
        List<String> values = new ArrayList<>();
        int position = 0;
        while (true) {
            int start = skipSpaces(record, position);
            if (start < record.length() && record.charAt(start) == QUOTE) {
                StringBuilder cell = new StringBuilder();
                int i = start + 1;
                while (true) {
                    if (i >= record.length()) {
                        return null;
                    }
                    char c = record.charAt(i);
                    if (c == QUOTE) {
                        if (i + 1 < record.length() && record.charAt(i + 1) == QUOTE) {
                            cell.append(QUOTE);
                            i += 2;
                        } else {
                            i++;
                            break;
                        }
                    } else {
                        cell.append(c);
                        i++;
                    }
                }
                values.add(cell.toString());
                i = skipSpaces(record, i);
                if (i == record.length()) {
                    break;
                }
                if (!record.startsWith(delimiter, i)) {
                    throw new MalformedDatasetException(String.format(
                            "Unexpected character '%s' after a quoted value on line %d.", record.charAt(i),
                            lineNumber));
                }
                position = i + delimiter.length();
            } else {
                int end = record.indexOf(delimiter, position);
                if (end < 0) {
                    values.add(record.substring(position).trim());
                    break;
                }
                values.add(record.substring(position, end).trim());
                position = end + delimiter.length();
            }
        }
        return values.toArray(new String[0]);
    }

    private static int skipSpaces(String record, int position) {
        int i = position;
        while (i < record.length() && record.charAt(i) == ' ') {
            i++;
        }
        return i;
    }
}
