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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import com.velora.ensemble.dataset.Dataset;
import com.velora.ensemble.dataset.DatasetReader;

public class CsvTableWriterTest {

    private static OutputTable table() {
        List<Object[]> rows = Arrays.asList(new Object[] { "1", "plain", 12.5 },
                new Object[] { "2", "a,\"b\"", 0.0 });
        return new OutputTable(Arrays.asList("Time", "note", "composite_score"),
                Collections.singleton("composite_score"), rows);
    }

    @Test
    public void testWrite() {
        StringWriter buffer = new StringWriter();
        new CsvTableWriter().write(table(), new PrintWriter(buffer));
        String separator = System.lineSeparator();
        assertEquals("Time,note,composite_score" + separator + "1,plain,12.5" + separator + "2,\"a,\"\"b\"\"\",0.0"
                + separator, buffer.toString());
    }

    @Test
    public void testRowsArePrintedInOrder() {
        PrintWriter out = mock(PrintWriter.class);
        new CsvTableWriter(";").write(table(), out);
        InOrder order = inOrder(out);
        order.verify(out).println("Time;note;composite_score");
        order.verify(out).println("1;plain;12.5");
        order.verify(out).println("2;\"a,\"\"b\"\"\";0.0");
        order.verify(out).flush();
    }

    @Test
    public void testOutputCanBeReadBack() {
        List<Object[]> rows = Arrays.asList(new Object[] { "1", "plain", 12.5 },
                new Object[] { "2", "a;\"b\", c", 0.0 }, new Object[] { "3", "two\nlines", 100.0 },
                new Object[] { "4", "", 7.25 });
        OutputTable table = new OutputTable(Arrays.asList("Time", "note", "composite_score"),
                Collections.singleton("composite_score"), rows);
        StringWriter buffer = new StringWriter();
        new CsvTableWriter(";").write(table, new PrintWriter(buffer));

        Dataset dataset = new DatasetReader(";").read(buffer.toString());
        assertEquals(table.getColumnNames(), dataset.getColumnNames());
        assertEquals(rows.size(), dataset.size());
        for (int i = 0; i < rows.size(); i++) {
            for (int j = 0; j < 3; j++) {
                assertEquals(String.valueOf(rows.get(i)[j]), dataset.getCell(i, j));
            }
        }
    }

    @Test
    public void testEscape() {
        CsvTableWriter writer = new CsvTableWriter("\t");
        assertEquals("a,b", writer.escape("a,b"));
        assertEquals("\"a\tb\"", writer.escape("a\tb"));
        assertEquals("\"line\nbreak\"", writer.escape("line\nbreak"));
        assertEquals("", writer.escape(""));
    }

    @Test
    public void testInvalidDelimiter() {
        assertThrows(IllegalArgumentException.class, () -> new CsvTableWriter(""));
        assertThrows(NullPointerException.class, () -> new CsvTableWriter(null));
    }
}
