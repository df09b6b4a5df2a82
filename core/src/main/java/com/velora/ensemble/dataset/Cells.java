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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Interpretation of raw table cells.
 */
public class Cells {

    private static final Set<String> MISSING_TOKENS = new HashSet<>(
            Arrays.asList("", "NA", "N/A", "NaN", "nan", "null", "NULL", "None"));

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private Cells() {
    }

    /**
     * A cell is missing when it is null, blank, one of the usual missing-value
     * tokens, or a number too large to be represented.
     *
     * @param cell the raw cell
     * @return true if the cell carries no value
     */
    public static boolean isMissing(String cell) {
        if (cell == null) {
            return true;
        }
        String trimmed = cell.trim();
        if (MISSING_TOKENS.contains(trimmed)) {
            return true;
        }
        return DECIMAL.matcher(trimmed).matches() && !Double.isFinite(Double.parseDouble(trimmed));
    }

    /**
     * @param cell a cell that is not missing
     * @return true if the cell is a plain decimal number
     */
    public static boolean isNumber(String cell) {
        return cell != null && DECIMAL.matcher(cell.trim()).matches();
    }

    /**
     * @param cell a cell for which {@link #isNumber} holds
     * @return its value
     */
    public static double toNumber(String cell) {
        return Double.parseDouble(cell.trim());
    }
}
