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

import java.time.Instant;

/**
 * The parsed keys of a timestamp column; exactly one of the two arrays is in
 * use.
 */
public class Timestamps {

    private final double[] numbers;

    private final Instant[] instants;

    private Timestamps(double[] numbers, Instant[] instants) {
        this.numbers = numbers;
        this.instants = instants;
    }

    static Timestamps ofNumbers(double[] numbers) {
        return new Timestamps(numbers, null);
    }

    static Timestamps ofInstants(Instant[] instants) {
        return new Timestamps(null, instants);
    }

    public int size() {
        return (numbers != null) ? numbers.length : instants.length;
    }

    /**
     * @param i first record
     * @param j second record
     * @return negative, zero or positive as record i is earlier than, as early as,
     *         or later than record j
     */
    public int compare(int i, int j) {
        if (numbers != null) {
            return Double.compare(numbers[i], numbers[j]);
        }
        return instants[i].compareTo(instants[j]);
    }

    public String toString(int i) {
        return (numbers != null) ? Double.toString(numbers[i]) : instants[i].toString();
    }
}
