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

package com.velora.ensemble.scoring;

import static com.velora.ensemble.CommonUtils.checkNotNull;
import static com.velora.ensemble.CommonUtils.checkState;

import com.velora.ensemble.detector.DetectorBank;
import com.velora.ensemble.preprocessor.FeatureMatrix;
import com.velora.ensemble.returntypes.RawScores;

/**
 * Runs every fitted detector of a bank over the scaled test matrix.
 */
public class Scorer {

    private final DetectorBank bank;

    public Scorer(DetectorBank bank) {
        this.bank = checkNotNull(bank, "bank must not be null");
    }

    public RawScores score(FeatureMatrix test) {
        checkNotNull(test, "test must not be null");
        checkState(bank.isFitted(), "the detector bank must be fitted before scoring");
        return bank.getExecutor().score(test);
    }
}
