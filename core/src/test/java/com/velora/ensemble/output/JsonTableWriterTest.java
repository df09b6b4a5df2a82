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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

public class JsonTableWriterTest {

    private static OutputTable table() {
        List<Object[]> rows = Arrays.asList(new Object[] { "2024-01-01", "", 12.5 },
                new Object[] { "2024-01-02", "7", 100.0 });
        return new OutputTable(Arrays.asList("Time", "cpu", "composite_score"),
                Collections.singleton("composite_score"), rows);
    }

    @Test
    public void testToJson() {
        ArrayNode array = new JsonTableWriter().toJson(table());
        assertEquals(2, array.size());
        JsonNode first = array.get(0);
        assertTrue(first.get("composite_score").isDouble());
        assertEquals(12.5, first.get("composite_score").asDouble());
        assertTrue(first.get("cpu").isTextual());
        assertEquals("", first.get("cpu").asText());
        assertEquals("7", array.get(1).get("cpu").asText());

        List<String> keys = new ArrayList<>();
        Iterator<String> names = first.fieldNames();
        names.forEachRemaining(keys::add);
        assertEquals(Arrays.asList("Time", "cpu", "composite_score"), keys);
    }

    @Test
    public void testWriteProducesParseableJson() throws Exception {
        for (boolean pretty : new boolean[] { false, true }) {
            StringWriter buffer = new StringWriter();
            new JsonTableWriter(pretty).write(table(), new PrintWriter(buffer));
            JsonNode parsed = new ObjectMapper().readTree(buffer.toString());
            assertTrue(parsed.isArray());
            assertEquals(100.0, parsed.get(1).get("composite_score").asDouble());
        }
    }

    @Test
    public void testEmptyTable() {
        StringWriter buffer = new StringWriter();
        new JsonTableWriter().write(new OutputTable(Collections.singletonList("Time"), Collections.emptySet(),
                Collections.emptyList()), new PrintWriter(buffer));
        assertEquals("[]", buffer.toString().trim());
    }
}
