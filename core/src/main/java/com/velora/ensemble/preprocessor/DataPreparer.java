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

package com.velora.ensemble.preprocessor;

import static com.velora.ensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.velora.ensemble.config.ImputationMethod;
import com.velora.ensemble.dataset.Cells;
import com.velora.ensemble.dataset.Dataset;
import com.velora.ensemble.exception.EmptyFeatureSetException;
import com.velora.ensemble.exception.FeatureMismatchException;
import com.velora.ensemble.statistics.Deviation;

/**
 * Selects the numeric columns of a partition and fills their missing cells. A
 * column is numeric in a partition when it has at least one present cell and
 * every present cell is a decimal number. The timestamp column is never a
 * feature.
 */
@Slf4j
public class DataPreparer {

    private final String timestampColumn;

    private final ImputationMethod imputationMethod;

    public DataPreparer(String timestampColumn, ImputationMethod imputationMethod) {
        this.timestampColumn = checkNotNull(timestampColumn, "timestampColumn must not be null");
        this.imputationMethod = checkNotNull(imputationMethod, "imputationMethod must not be null");
    }

    public ImputationMethod getImputationMethod() {
        return imputationMethod;
    }

    /**
     * Prepares the training partition; its numeric columns become the feature
     * set of the run, in header order.
     *
     * @param partition the training records
     * @return the feature matrix with missing cells replaced by column means
     * @throws EmptyFeatureSetException if no column is numeric
     */
    public FeatureMatrix prepare(Dataset partition) {
        checkNotNull(partition, "partition must not be null");
        List<String> names = new ArrayList<>();
        List<Integer> columns = new ArrayList<>();
        for (int c = 0; c < partition.getNumberOfColumns(); c++) {
            String name = partition.getColumnNames().get(c);
            if (!name.equals(timestampColumn) && isNumeric(partition.getColumn(c))) {
                names.add(name);
                columns.add(c);
            }
        }
        if (names.isEmpty()) {
            throw new EmptyFeatureSetException(
                    "no numeric columns found among " + partition.getColumnNames() + " besides " + timestampColumn);
        }
        double[] fillValues = new double[names.size()];
        for (int j = 0; j < names.size(); j++) {
            fillValues[j] = presentMean(partition.getColumn(columns.get(j)));
        }
        log.debug("numeric features {}", names);
        return build(partition, names, columns, fillValues);
    }

    /**
     * Prepares the test partition against the training features: the same names
     * in the same order, columns that only the test partition has are dropped.
     * Missing cells are filled according to the imputation method.
     *
     * @param partition the test records
     * @param reference the prepared training matrix
     * @return the aligned test feature matrix
     * @throws FeatureMismatchException if a training feature has no numeric
     *                                  counterpart in the test partition
     */
    public FeatureMatrix prepare(Dataset partition, FeatureMatrix reference) {
        checkNotNull(partition, "partition must not be null");
        checkNotNull(reference, "reference must not be null");
        List<String> names = reference.getFeatureNames();
        double[] referenceFills = reference.getFillValues();
        List<Integer> columns = new ArrayList<>();
        double[] fillValues = new double[names.size()];
        for (int j = 0; j < names.size(); j++) {
            int column = partition.indexOf(names.get(j));
            if (column < 0) {
                throw new FeatureMismatchException("feature " + names.get(j) + " is absent from the test partition");
            }
            String[] cells = partition.getColumn(column);
            if (imputationMethod == ImputationMethod.TRAINING_MEAN) {
                if (!allNumberOrMissing(cells)) {
                    throw new FeatureMismatchException(
                            "feature " + names.get(j) + " is not numeric in the test partition");
                }
                fillValues[j] = referenceFills[j];
            } else {
                if (!isNumeric(cells)) {
                    throw new FeatureMismatchException(
                            "feature " + names.get(j) + " is not numeric in the test partition");
                }
                fillValues[j] = presentMean(cells);
            }
            columns.add(column);
        }
        return build(partition, names, columns, fillValues);
    }

    private FeatureMatrix build(Dataset partition, List<String> names, List<Integer> columns, double[] fillValues) {
        double[][] values = new double[partition.size()][names.size()];
        int filled = 0;
        for (int i = 0; i < partition.size(); i++) {
            for (int j = 0; j < names.size(); j++) {
                String cell = partition.getCell(i, columns.get(j));
                if (Cells.isMissing(cell)) {
                    values[i][j] = fillValues[j];
                    filled++;
                } else {
                    values[i][j] = Cells.toNumber(cell);
                }
            }
        }
        if (filled > 0) {
            log.debug("filled {} missing cells using {}", filled, imputationMethod);
        }
        return new FeatureMatrix(names, values, fillValues);
    }

    static boolean isNumeric(String[] cells) {
        boolean present = false;
        for (String cell : cells) {
            if (Cells.isMissing(cell)) {
                continue;
            }
            if (!Cells.isNumber(cell)) {
                return false;
            }
            present = true;
        }
        return present;
    }

    static boolean allNumberOrMissing(String[] cells) {
        for (String cell : cells) {
            if (!Cells.isMissing(cell) && !Cells.isNumber(cell)) {
                return false;
            }
        }
        return true;
    }

    static double presentMean(String[] cells) {
        Deviation deviation = new Deviation();
        for (String cell : cells) {
            if (!Cells.isMissing(cell)) {
                deviation.update(Cells.toNumber(cell));
            }
        }
        return deviation.getMean();
    }
}
