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

import static com.velora.ensemble.CommonUtils.checkArgument;
import static com.velora.ensemble.CommonUtils.checkNotNull;

import java.io.PrintWriter;
import java.util.List;

/**
 * Writes a table as delimited text with a header row. Cells that contain the
 * delimiter, a double quote or a line break are quoted, with embedded quotes
 * doubled. Scores are written with {@link Double#toString(double)}.
 */
public class CsvTableWriter implements ITableWriter {

    private final String delimiter;

    public CsvTableWriter() {
        this(",");
    }

    public CsvTableWriter(String delimiter) {
        checkNotNull(delimiter, "delimiter must not be null");
        checkArgument(!delimiter.isEmpty(), "delimiter must not be empty");
        this.delimiter = delimiter;
    }

    @Override
    public void write(OutputTable table, PrintWriter out) {
        List<String> columns = table.getColumnNames();
        out.println(join(columns.toArray()));
        for (int r = 0; r < table.size(); r++) {
            out.println(join(table.getRow(r)));
        }
        out.flush();
    }

    private String join(Object[] values) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                builder.append(delimiter);
            }
            builder.append(escape(String.valueOf(values[i])));
        }
        return builder.toString();
    }

    String escape(String cell) {
        if (cell.contains(delimiter) || cell.contains("\"") || cell.contains("\n") || cell.contains("\r")) {
            return "\"" + cell.replace("\"", "\"\"") + "\"";
        }
        return cell;
    }
}
