/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.tidba.cli;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.commons.lang.StringUtils;

import io.tidba.ql.jdbc.QueryResult;

/**
 * Renders query results the way the mysql client does: a boxed table, or one
 * block per row for statements terminated by <code>\G</code>.
 */
public class ResultPrinter {

    private static final String ROW_MARKER = StringUtils.repeat("*", 27);

    private final PrintStream out;
    private final String nullValue;

    public ResultPrinter(PrintStream out, String nullValue) {
        this.out = out;
        this.nullValue = nullValue;
    }

    public void printTable(QueryResult result, double elapsedSeconds) {
        List<String> columns = result.getColumns();
        if(!columns.isEmpty()) {
            int[] widths = new int[columns.size()];
            for(int i = 0; i < columns.size(); i++) {
                widths[i] = columns.get(i).length();
            }
            for(Map<String, String> row : result.getRows()) {
                for(int i = 0; i < columns.size(); i++) {
                    widths[i] = Math.max(widths[i], display(row.get(columns.get(i))).length());
                }
            }

            String separator = separator(widths);
            out.println(separator);
            out.println(line(widths, columns));
            out.println(separator);
            if(!result.isEmpty()) {
                for(Map<String, String> row : result.getRows()) {
                    String[] cells = new String[columns.size()];
                    for(int i = 0; i < columns.size(); i++) {
                        cells[i] = display(row.get(columns.get(i)));
                    }
                    out.println(line(widths, Arrays.asList(cells)));
                }
                out.println(separator);
            }
        }
        printFooter(result.size(), elapsedSeconds);
    }

    public void printVertical(QueryResult result, double elapsedSeconds) {
        List<String> columns = result.getColumns();
        int labelWidth = 0;
        for(String column : columns) {
            labelWidth = Math.max(labelWidth, column.length());
        }
        int rowNumber = 0;
        for(Map<String, String> row : result.getRows()) {
            rowNumber++;
            out.println(ROW_MARKER + " " + rowNumber + ". row " + ROW_MARKER);
            for(String column : columns) {
                out.println(StringUtils.leftPad(column, labelWidth) + ": " + display(row.get(column)));
            }
        }
        printFooter(result.size(), elapsedSeconds);
    }

    private void printFooter(int rows, double elapsedSeconds) {
        String time = String.format(Locale.ROOT, "%.2f sec", elapsedSeconds);
        out.println(rows + (rows == 1 ? " row" : " rows") + " in set (" + time + ")");
        out.println();
    }

    private String display(String value) {
        return value == null ? nullValue : value;
    }

    private static String separator(int[] widths) {
        StringBuilder sb = new StringBuilder("+");
        for(int width : widths) {
            sb.append(StringUtils.repeat("-", width + 2)).append('+');
        }
        return sb.toString();
    }

    private static String line(int[] widths, List<String> cells) {
        StringBuilder sb = new StringBuilder("|");
        for(int i = 0; i < widths.length; i++) {
            sb.append(' ').append(StringUtils.rightPad(cells.get(i), widths[i])).append(" |");
        }
        return sb.toString();
    }
}
