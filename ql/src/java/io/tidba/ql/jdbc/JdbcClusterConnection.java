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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tidba.ql.exec.CancellationToken;

/**
 * {@link ClusterConnection} over a single JDBC connection. Statements on one
 * handle run one at a time; use {@link #fork()} for parallel work.
 */
public class JdbcClusterConnection implements ClusterConnection {

  private static final Logger LOG = LoggerFactory.getLogger(JdbcClusterConnection.class);

  private final ClusterConfig config;
  private final int connectTimeoutMillis;
  private final Connection connection;
  private final Object statementLock = new Object();

  JdbcClusterConnection(ClusterConfig config, int connectTimeoutMillis, Connection connection) {
    this.config = config;
    this.connectTimeoutMillis = connectTimeoutMillis;
    this.connection = connection;
  }

  public static JdbcClusterConnection open(ClusterConfig config, int connectTimeoutMillis)
      throws SQLException {
    Connection conn = DriverManager.getConnection(config.getUrl(),
        config.toDriverProperties(connectTimeoutMillis));
    LOG.debug("Opened connection to cluster {} at {}", config.getName(), config.getUrl());
    return new JdbcClusterConnection(config, connectTimeoutMillis, conn);
  }

  @Override
  public String getClusterName() {
    return config.getName();
  }

  @Override
  public void execute(CancellationToken token, String sql) throws SQLException {
    synchronized (statementLock) {
      try (Statement stmt = connection.createStatement();
          CancellationToken.Registration ignored = token.onCancel(cancelAction(stmt))) {
        token.throwIfCancelled();
        stmt.execute(sql);
      }
    }
  }

  @Override
  public QueryResult query(CancellationToken token, String sql) throws SQLException {
    synchronized (statementLock) {
      try (Statement stmt = connection.createStatement();
          CancellationToken.Registration ignored = token.onCancel(cancelAction(stmt))) {
        token.throwIfCancelled();
        try (ResultSet rs = stmt.executeQuery(sql)) {
          return toQueryResult(rs);
        }
      }
    }
  }

  static QueryResult toQueryResult(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int count = md.getColumnCount();
    List<String> columns = new ArrayList<String>(count);
    for (int i = 1; i <= count; i++) {
      columns.add(md.getColumnLabel(i));
    }
    List<Map<String, String>> rows = new ArrayList<Map<String, String>>();
    while (rs.next()) {
      Map<String, String> row = new LinkedHashMap<String, String>();
      for (int i = 1; i <= count; i++) {
        row.put(columns.get(i - 1), rs.getString(i));
      }
      rows.add(row);
    }
    return new QueryResult(columns, rows);
  }

  private Runnable cancelAction(final Statement stmt) {
    return new Runnable() {
      @Override
      public void run() {
        try {
          stmt.cancel();
        } catch (SQLException e) {
          LOG.warn("Failed to cancel statement on cluster {}", config.getName(), e);
        }
      }
    };
  }

  @Override
  public ClusterConnection fork() throws SQLException {
    return open(config, connectTimeoutMillis);
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (SQLException e) {
      LOG.warn("Failed to close connection to cluster {}", config.getName(), e);
    }
  }
}
