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

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * This class samples a time-ordered table whose feature columns are drawn from
 * a normal distribution with covariance sigma * I. Chosen rows can be shifted
 * far away from the base distribution to act as outliers, and cells can be
 * blanked out at random to exercise imputation. The first column, "Time",
 * holds either the row index or an hourly ISO-8601 local date-time.
 */
public class TimeSeriesTestData {

    public static final String TIME_COLUMN = "Time";

    public static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0, 0);

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final double baseMu;
    private final double baseSigma;
    private int[] outlierRows = new int[0];
    private double outlierShift = 0;
    private double missingProbability = 0;
    private boolean isoTimestamps = false;
    private boolean shuffled = false;

    public TimeSeriesTestData(double baseMu, double baseSigma) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
    }

    public TimeSeriesTestData() {
        this(0.0, 1.0);
    }

    /**
     * @param rows  positions (in time order) of the outlier rows
     * @param shift the amount added to every feature of an outlier row
     * @return this generator
     */
    public TimeSeriesTestData outliers(int[] rows, double shift) {
        this.outlierRows = Arrays.copyOf(rows, rows.length);
        this.outlierShift = shift;
        return this;
    }

    public TimeSeriesTestData missingProbability(double probability) {
        this.missingProbability = probability;
        return this;
    }

    public TimeSeriesTestData isoTimestamps(boolean isoTimestamps) {
        this.isoTimestamps = isoTimestamps;
        return this;
    }

    /**
     * @param shuffled if true the rows are emitted in a random order, the time
     *                 column still records their true order
     * @return this generator
     */
    public TimeSeriesTestData shuffled(boolean shuffled) {
        this.shuffled = shuffled;
        return this;
    }

    public TableWithKey generate(int numberOfRows, int numberOfFeatures, long seed) {
        Random rng = new Random(seed);
        NormalDistribution dist = new NormalDistribution(rng);
        boolean[] outlier = new boolean[numberOfRows];
        for (int row : outlierRows) {
            outlier[row] = true;
        }

        List<String> header = new ArrayList<>();
        header.add(TIME_COLUMN);
        for (int j = 0; j < numberOfFeatures; j++) {
            header.add("f" + j);
        }

        List<String[]> rows = new ArrayList<>();
        for (int i = 0; i < numberOfRows; i++) {
            String[] row = new String[numberOfFeatures + 1];
            row[0] = isoTimestamps ? START.plusHours(i).format(FORMAT) : Integer.toString(i);
            for (int j = 0; j < numberOfFeatures; j++) {
                double value = dist.nextDouble(baseMu, baseSigma) + (outlier[i] ? outlierShift : 0);
                if (!outlier[i] && missingProbability > 0 && rng.nextDouble() < missingProbability) {
                    row[j + 1] = "";
                } else {
                    row[j + 1] = Double.toString(value);
                }
            }
            rows.add(row);
        }

        if (shuffled) {
            for (int i = rows.size() - 1; i > 0; i--) {
                int j = rng.nextInt(i + 1);
                String[] swap = rows.get(i);
                rows.set(i, rows.get(j));
                rows.set(j, swap);
            }
        }
        return new TableWithKey(header, rows, outlierRows);
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // apply the Box-Muller transform to produce Normal variates
                double u = 1.0 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
