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

package com.velora.ensemble.exception;

/**
 * Thrown when the input table itself is unusable: a ragged row, a missing or
 * unparseable timestamp column, or a clash with a reserved output column.
 */
public class MalformedDatasetException extends AnomalyEnsembleException {

    public MalformedDatasetException(String message, Throwable cause) {
        super(message, cause);
    }

    public MalformedDatasetException(String message) {
        super(message);
    }
}
