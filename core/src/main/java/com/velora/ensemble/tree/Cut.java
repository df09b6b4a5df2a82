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

package com.velora.ensemble.tree;

/**
 * A Cut divides feature space into two half-spaces along one feature. Cuts are
 * the internal nodes of an {@link IsolationTree}.
 */
public class Cut {

    private final int feature;
    private final double value;

    /**
     * @param feature the 0-based index of the feature the cut is made in
     * @param value   the position of the cut along that feature
     */
    public Cut(int feature, double value) {
        this.feature = feature;
        this.value = value;
    }

    /**
     * A point is left of the cut when its value in the cut feature is less than or
     * equal to the cut value.
     *
     * @param point a point with at least {@code feature + 1} coordinates
     * @param cut   a Cut instance
     * @return true if the point falls in the left half-space
     */
    public static boolean isLeftOf(double[] point, Cut cut) {
        return point[cut.getFeature()] <= cut.getValue();
    }

    public int getFeature() {
        return feature;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toString() {
        return String.format("Cut(%d, %f)", feature, value);
    }
}
