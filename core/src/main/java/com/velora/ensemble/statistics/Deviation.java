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

package com.velora.ensemble.statistics;

import static com.velora.ensemble.CommonUtils.checkArgument;

/**
 * Running mean and population deviation of a stream of values (Welford's
 * update), together with the observed range. A constant stream reports its
 * value as the mean exactly and a deviation of 0.
 */
public class Deviation {

    protected long count = 0;

    protected double mean = 0;

    protected double sumSquaredDifferences = 0;

    protected double min = Double.POSITIVE_INFINITY;

    protected double max = Double.NEGATIVE_INFINITY;

    public void update(double value) {
        checkArgument(Double.isFinite(value), "values must be finite");
        count++;
        double delta = value - mean;
        mean += delta / count;
        sumSquaredDifferences += delta * (value - mean);
        min = Math.min(min, value);
        max = Math.max(max, value);
    }

    public void update(double[] values) {
        for (double value : values) {
            update(value);
        }
    }

    public double getMean() {
        checkArgument(count > 0, "incorrect invocation for mean");
        return isConstant() ? min : mean;
    }

    /**
     * @return the population variance (divided by the count, not count - 1)
     */
    public double getVariance() {
        checkArgument(count > 0, "incorrect invocation for variance");
        if (isConstant()) {
            return 0;
        }
        double answer = sumSquaredDifferences / count;
        return (answer > 0) ? answer : 0;
    }

    public double getDeviation() {
        return Math.sqrt(getVariance());
    }

    public boolean isConstant() {
        return count > 0 && min == max;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public long getCount() {
        return count;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /**
     * @param values a sample
     * @return the population variance of the sample
     */
    public static double variance(double[] values) {
        Deviation deviation = new Deviation();
        deviation.update(values);
        return deviation.getVariance();
    }
}
