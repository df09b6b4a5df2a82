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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.velora.ensemble.config.DetectorType;
import com.velora.ensemble.dataset.Dataset;
import com.velora.ensemble.exception.MalformedDatasetException;
import com.velora.ensemble.returntypes.RawScores;

/**
 * Builds the output table: one row per test record in temporal order, holding
 * the original columns, the composite score, the raw score of every detector
 * and a raw copy of each ranked feature.
 */
public class OutputAssembler {

    public static final String COMPOSITE_SCORE_COLUMN = "composite_score";

    public static final String COPY_SUFFIX = "_copy";

    public OutputTable assemble(Dataset test, double[] composite, RawScores raw, List<String> rankedFeatures) {
        checkNotNull(test, "test must not be null");
        checkNotNull(composite, "composite must not be null");
        checkNotNull(raw, "raw must not be null");
        checkNotNull(rankedFeatures, "rankedFeatures must not be null");
        checkArgument(composite.length == test.size() && raw.size() == test.size(),
                String.format("expected %d scores, found %d composite and %d raw", test.size(), composite.length,
                        raw.size()));

        List<String> appended = appendedColumns(rankedFeatures);
        for (String name : appended) {
            if (test.hasColumn(name)) {
                throw new MalformedDatasetException(
                        String.format("input column %s clashes with an output column", name));
            }
        }
        int[] copied = new int[rankedFeatures.size()];
        for (int i = 0; i < copied.length; i++) {
            copied[i] = test.indexOf(rankedFeatures.get(i));
            checkArgument(copied[i] >= 0, "ranked feature " + rankedFeatures.get(i) + " is not an input column");
        }

        List<String> columnNames = new ArrayList<>(test.getColumnNames());
        columnNames.addAll(appended);
        Set<String> scoreColumns = new LinkedHashSet<>();
        scoreColumns.add(COMPOSITE_SCORE_COLUMN);
        for (DetectorType type : DetectorType.values()) {
            scoreColumns.add(type.getColumnName());
        }

        int original = test.getNumberOfColumns();
        int detectors = DetectorType.values().length;
        List<Object[]> rows = new ArrayList<>(test.size());
        for (int r = 0; r < test.size(); r++) {
            Object[] row = new Object[columnNames.size()];
            for (int c = 0; c < original; c++) {
                row[c] = test.getCell(r, c);
            }
            row[original] = composite[r];
            for (DetectorType type : DetectorType.values()) {
                row[original + 1 + type.ordinal()] = raw.get(type, r);
            }
            for (int i = 0; i < copied.length; i++) {
                row[original + 1 + detectors + i] = test.getCell(r, copied[i]);
            }
            rows.add(row);
        }
        return new OutputTable(columnNames, scoreColumns, rows);
    }

    /**
     * @param rankedFeatures the ranked feature names
     * @return the names of the columns appended to the input columns, in order
     */
    public static List<String> appendedColumns(List<String> rankedFeatures) {
        List<String> names = new ArrayList<>();
        names.add(COMPOSITE_SCORE_COLUMN);
        for (DetectorType type : DetectorType.values()) {
            names.add(type.getColumnName());
        }
        for (String feature : rankedFeatures) {
            names.add(feature + COPY_SUFFIX);
        }
        return names;
    }
}
