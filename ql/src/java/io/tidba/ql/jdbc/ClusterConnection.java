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

import java.sql.SQLException;

import io.tidba.ql.exec.CancellationToken;

/**
 * Connection handle to one cluster. Blocking calls abort their running
 * statement when the given token is cancelled.
 */
public interface ClusterConnection extends AutoCloseable {

  /**
   * @return name of the cluster this handle points at
   */
  String getClusterName();

  /**
   * Executes a statement that produces no result set.
   */
  void execute(CancellationToken token, String statement) throws SQLException;

  /**
   * Executes a query and materialises its result.
   */
  QueryResult query(CancellationToken token, String statement) throws SQLException;

  /**
   * Opens a transient handle to the same cluster, for work that runs in
   * parallel with this one. The caller closes it.
   */
  ClusterConnection fork() throws SQLException;

  @Override
  void close();
}
