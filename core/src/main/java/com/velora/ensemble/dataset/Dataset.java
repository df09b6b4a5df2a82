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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.velora.ensemble.exception.MalformedDatasetException;

/**
 * An ordered sequence of records sharing one header. Cells are kept exactly as
 * they were supplied so that the output can reproduce the original fields; the
 * interpretation of a cell (number, timestamp, missing) is left to the stages
 * that need it. A Dataset is immutable.
 */
public class Dataset {

    private final List<String> columnNames;

    private final Map<String, Integer> columnIndexes;

    private final List<String[]> rows;

    /**
     * Create a new Dataset.
     *
     * @param columnNames the header; names must be unique
     * @param rows        the records, each with exactly one cell per column
     * @throws MalformedDatasetException if the header has duplicates or a row has
     *                                   the wrong number of cells
     */
    public Dataset(List<String> columnNames, List<String[]> rows) {
        checkNotNull(columnNames, "columnNames must not be null");
        checkNotNull(rows, "rows must not be null");
        checkArgument(!columnNames.isEmpty(), "a dataset needs at least one column");
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.columnIndexes = new HashMap<>();
        for (int i = 0; i < columnNames.size(); i++) {
            if (columnIndexes.put(columnNames.get(i), i) != null) {
                throw new MalformedDatasetException("duplicate column name " + columnNames.get(i));
            }
        }
        List<String[]> copy = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            String[] row = checkNotNull(rows.get(i), "rows must not contain null");
            if (row.length != columnNames.size()) {
                throw new MalformedDatasetException(String.format("row %d has %d cells, expected %d", i,
                        row.length, columnNames.size()));
            }
            copy.add(Arrays.copyOf(row, row.length));
        }
        this.rows = copy;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public int getNumberOfColumns() {
        return columnNames.size();
    }

    public int size() {
        return rows.size();
    }

    public boolean hasColumn(String name) {
        return columnIndexes.containsKey(name);
    }

    /**
     * @param name a column name
     * @return the 0-based position of the column, or -1 if absent
     */
    public int indexOf(String name) {
        Integer index = columnIndexes.get(name);
        return (index == null) ? -1 : index;
    }

    public String getCell(int row, int column) {
        return rows.get(row)[column];
    }

    /**
     * @param row a record position
     * @return a copy of the record's cells in header order
     */
    public String[] getRow(int row) {
        String[] values = rows.get(row);
        return Arrays.copyOf(values, values.length);
    }

    /**
     * @param column a column position
     * @return the cells of that column in record order
     */
    public String[] getColumn(int column) {
        String[] values = new String[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            values[i] = rows.get(i)[column];
        }
        return values;
    }

    /**
     * Returns a new Dataset made of the given records in the given order.
     *
     * @param positions record positions; repetitions are allowed
     * @return the selected records under the same header
     */
    public Dataset select(int[] positions) {
        List<String[]> selected = new ArrayList<>(positions.length);
        for (int position : positions) {
            selected.add(rows.get(position));
        }
        return new Dataset(columnNames, selected);
    }

    /**
     * @param from first record, inclusive
     * @param to   last record, exclusive
     * @return the records in {@code [from, to)} under the same header
     */
    public Dataset slice(int from, int to) {
        checkArgument(0 <= from && from <= to && to <= rows.size(), "invalid slice bounds");
        return new Dataset(columnNames, rows.subList(from, to));
    }
}
