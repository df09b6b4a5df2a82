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

public enum ImputationMethod {

    /**
     * each partition is filled with the mean of its own present values; the
     * test partition never sees training statistics
     */
    PARTITION_MEAN,
    /**
     * the training partition is filled with its own means and the test partition
     * is filled with the training means, the same way scaling is done
     */
    TRAINING_MEAN;
}
