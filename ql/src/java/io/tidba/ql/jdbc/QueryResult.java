/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.tidba.ql.jdbc;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

/**
 * Column names and rows of a query. Each row maps a column name to its
 * value as a string; SQL NULL is a null value.
 */
public final class QueryResult {

  private final List<String> columns;
  private final List<Map<String, String>> rows;

  public QueryResult(List<String> columns, List<Map<String, String>> rows) {
    this.columns = ImmutableList.copyOf(columns);
    this.rows = Collections.unmodifiableList(rows);
  }

  public List<String> getColumns() {
    return columns;
  }

  public List<Map<String, String>> getRows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
