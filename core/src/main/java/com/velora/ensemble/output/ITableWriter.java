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

package com.velora.ensemble.output;

import java.io.PrintWriter;

/**
 * Writes an {@link OutputTable} as text.
 */
public interface ITableWriter {

    /**
     * @param table the table to write
     * @param out   the destination; flushed but not closed
     */
    void write(OutputTable table, PrintWriter out);
}
