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
 * Base class of every error raised by the ensemble pipeline. All of them are
 * fatal to the current run; nothing in the pipeline retries or substitutes
 * default scores.
 */
public class AnomalyEnsembleException extends RuntimeException {

    public AnomalyEnsembleException(String message, Throwable cause) {
        super(message, cause);
    }

    public AnomalyEnsembleException(String message) {
        super(message);
    }
}
