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

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A dense matrix of finite values, rows are records and columns are named
 * features. The matrix owns its storage; accessors hand out copies.
 */
public class FeatureMatrix {

    private final List<String> featureNames;

    private final double[][] values;

    // means used to fill missing cells, one per feature
    private final double[] fillValues;

    public FeatureMatrix(List<String> featureNames, double[][] values) {
        this(featureNames, values, new double[featureNames.size()]);
    }

    public FeatureMatrix(List<String> featureNames, double[][] values, double[] fillValues) {
        checkNotNull(featureNames, "featureNames must not be null");
        checkNotNull(values, "values must not be null");
        checkNotNull(fillValues, "fillValues must not be null");
        checkArgument(fillValues.length == featureNames.size(), "one fill value per feature is required");
        this.featureNames = Collections.unmodifiableList(new ArrayList<>(featureNames));
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            checkArgument(values[i].length == featureNames.size(),
                    String.format("row %d has %d values, expected %d", i, values[i].length, featureNames.size()));
            this.values[i] = Arrays.copyOf(values[i], values[i].length);
        }
        this.fillValues = Arrays.copyOf(fillValues, fillValues.length);
    }

    public List<String> getFeatureNames() {
        return featureNames;
    }

    public int getNumberOfRows() {
        return values.length;
    }

    public int getNumberOfFeatures() {
        return featureNames.size();
    }

    public double get(int row, int feature) {
        return values[row][feature];
    }

    public double[] getRow(int row) {
        return Arrays.copyOf(values[row], values[row].length);
    }

    public double[] getColumn(int feature) {
        double[] column = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            column[i] = values[i][feature];
        }
        return column;
    }

    /**
     * @return a deep copy of the values
     */
    public double[][] toArray() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = Arrays.copyOf(values[i], values[i].length);
        }
        return copy;
    }

    public double[] getFillValues() {
        return Arrays.copyOf(fillValues, fillValues.length);
    }
}
