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

package com.velora.ensemble.output;

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The augmented output table. Every cell is either the original text of an
 * input cell (a {@code String}, possibly empty) or a score (a {@code Double});
 * score columns are listed by {@link #getScoreColumns()}.
 */
public class OutputTable {

    private final List<String> columnNames;

    private final Set<String> scoreColumns;

    private final List<Object[]> rows;

    public OutputTable(List<String> columnNames, Set<String> scoreColumns, List<Object[]> rows) {
        checkNotNull(columnNames, "columnNames must not be null");
        checkNotNull(scoreColumns, "scoreColumns must not be null");
        checkNotNull(rows, "rows must not be null");
        checkArgument(columnNames.containsAll(scoreColumns), "every score column must be a column of the table");
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.scoreColumns = Collections.unmodifiableSet(new LinkedHashSet<>(scoreColumns));
        List<Object[]> copy = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            checkArgument(row.length == columnNames.size(), "every row must have one cell per column");
            copy.add(Arrays.copyOf(row, row.length));
        }
        this.rows = copy;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public Set<String> getScoreColumns() {
        return scoreColumns;
    }

    public boolean isScoreColumn(String name) {
        return scoreColumns.contains(name);
    }

    public int size() {
        return rows.size();
    }

    public Object get(int row, int column) {
        return rows.get(row)[column];
    }

    public Object get(int row, String column) {
        int index = columnNames.indexOf(column);
        checkArgument(index >= 0, "no such column " + column);
        return get(row, index);
    }

    public double getScore(int row, String column) {
        checkArgument(isScoreColumn(column), column + " is not a score column");
        return (Double) get(row, column);
    }

    public Object[] getRow(int row) {
        Object[] values = rows.get(row);
        return Arrays.copyOf(values, values.length);
    }
}
