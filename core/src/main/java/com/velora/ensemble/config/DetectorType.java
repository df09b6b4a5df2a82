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

package com.velora.ensemble.config;

/**
 * The three detectors of the ensemble. The declaration order fixes the order
 * of the per-detector score columns in the output.
 */
public enum DetectorType {

    /**
     * randomized isolation trees; few splits to isolate a point means anomalous
     */
    ISOLATION("isolation_score"),
    /**
     * reconstruction error from a principal subspace
     */
    SUBSPACE("subspace_score"),
    /**
     * distance outside a one-class kernel boundary
     */
    BOUNDARY("boundary_score");

    private final String columnName;

    DetectorType(String columnName) {
        this.columnName = columnName;
    }

    /**
     * @return the name of the output column holding this detector's raw score
     */
    public String getColumnName() {
        return columnName;
    }
}
