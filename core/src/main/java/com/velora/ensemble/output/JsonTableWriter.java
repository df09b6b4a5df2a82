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
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes a table as a JSON array with one object per row, keyed by column name
 * in column order, using <a href="https://github.com/FasterXML/jackson">Jackson</a>.
 * Score columns are JSON numbers; all other cells are strings.
 */
public class JsonTableWriter implements ITableWriter {

    private final ObjectMapper mapper;

    private final boolean prettyPrint;

    public JsonTableWriter() {
        this(false);
    }

    public JsonTableWriter(boolean prettyPrint) {
        this.mapper = new ObjectMapper();
        this.prettyPrint = prettyPrint;
    }

    public ArrayNode toJson(OutputTable table) {
        List<String> columns = table.getColumnNames();
        ArrayNode array = mapper.createArrayNode();
        for (int r = 0; r < table.size(); r++) {
            ObjectNode object = array.addObject();
            for (int c = 0; c < columns.size(); c++) {
                String name = columns.get(c);
                Object value = table.get(r, c);
                if (table.isScoreColumn(name)) {
                    object.put(name, (Double) value);
                } else {
                    object.put(name, (String) value);
                }
            }
        }
        return array;
    }

    @Override
    public void write(OutputTable table, PrintWriter out) {
        try {
            if (prettyPrint) {
                out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(table)));
            } else {
                out.println(mapper.writeValueAsString(toJson(table)));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("unable to serialize the output table", e);
        }
        out.flush();
    }
}
