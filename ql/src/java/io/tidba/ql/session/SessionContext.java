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

package io.tidba.ql.session;

import java.sql.SQLException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.commons.lang.StringUtils;

import io.tidba.ql.jdbc.ClusterConnection;
import io.tidba.ql.jdbc.ConnectionRegistry;

/**
 * The active cluster, schema and connection of a console. Login, logout and
 * schema changes take the write lock; prompt rendering, statement execution
 * and kill rounds run under the read lock, so no statement runs while the
 * login state is being changed.
 */
public class SessionContext {

  /**
   * Work done with the session's connection while the read lock is held.
   */
  public interface ConnectionCallback<T, E extends Exception> {
    T call(ClusterConnection connection) throws E;
  }

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private String clusterName = "";
  private String schemaName = "";
  private ClusterConnection connection;

  public void login(String cluster) {
    lock.writeLock().lock();
    try {
      clusterName = StringUtils.trimToEmpty(cluster);
      schemaName = "";
      connection = null;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void logout() {
    lock.writeLock().lock();
    try {
      clusterName = "";
      schemaName = "";
      connection = null;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void changeSchema(String schema) {
    lock.writeLock().lock();
    try {
      schemaName = StringUtils.trimToEmpty(schema);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public String getClusterName() {
    lock.readLock().lock();
    try {
      return clusterName;
    } finally {
      lock.readLock().unlock();
    }
  }

  public String getSchemaName() {
    lock.readLock().lock();
    try {
      return schemaName;
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isLoggedIn() {
    return !getClusterName().isEmpty();
  }

  public boolean hasConnection() {
    lock.readLock().lock();
    try {
      return connection != null;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Runs the callback with the active connection, opening it through the
   * registry on first use after login.
   *
   * @throws SQLException if no cluster is active, the connection cannot be
   *           opened, or the callback fails
   */
  public <T, E extends Exception> T withConnection(ConnectionRegistry registry,
      ConnectionCallback<T, E> callback) throws SQLException, E {
    ensureConnection(registry);
    lock.readLock().lock();
    try {
      if (connection == null) {
        throw new SQLException("the session was logged out before the statement could run");
      }
      return callback.call(connection);
    } finally {
      lock.readLock().unlock();
    }
  }

  private void ensureConnection(ConnectionRegistry registry) throws SQLException {
    if (hasConnection()) {
      return;
    }
    lock.writeLock().lock();
    try {
      if (connection != null) {
        return;
      }
      if (clusterName.isEmpty()) {
        throw new SQLException("no cluster is logged in, run [login -c {clusterName}] first");
      }
      connection = registry.getConnection(clusterName);
    } finally {
      lock.writeLock().unlock();
    }
  }
}
