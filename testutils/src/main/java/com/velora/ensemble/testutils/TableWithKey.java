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

package com.velora.ensemble.testutils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A generated table: a header, rows of text cells and the time positions of
 * the rows that were made outliers.
 */
public class TableWithKey {

    private final List<String> header;
    private final List<String[]> rows;
    private final int[] outlierRows;

    public TableWithKey(List<String> header, List<String[]> rows, int[] outlierRows) {
        this.header = Collections.unmodifiableList(new ArrayList<>(header));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.outlierRows = Arrays.copyOf(outlierRows, outlierRows.length);
    }

    public List<String> getHeader() {
        return header;
    }

    public List<String[]> getRows() {
        return rows;
    }

    public int[] getOutlierRows() {
        return Arrays.copyOf(outlierRows, outlierRows.length);
    }

    public String toCsv() {
        return toText(",");
    }

    public String toText(String delimiter) {
        StringBuilder builder = new StringBuilder();
        builder.append(String.join(delimiter, header)).append('\n');
        for (String[] row : rows) {
            builder.append(String.join(delimiter, row)).append('\n');
        }
        return builder.toString();
    }
}
