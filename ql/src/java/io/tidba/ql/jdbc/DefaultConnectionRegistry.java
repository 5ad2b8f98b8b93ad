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
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

import io.tidba.ql.conf.TidbaConf;
import io.tidba.ql.conf.TidbaConf.ConfVars;

/**
 * Registry of the clusters configured in {@link TidbaConf}. A cluster's
 * connection is opened on first request and shared afterwards.
 */
public class DefaultConnectionRegistry implements ConnectionRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(DefaultConnectionRegistry.class);

  /**
   * Opens connections; replaced in tests.
   */
  @VisibleForTesting
  interface Connector {
    ClusterConnection connect(ClusterConfig config, int connectTimeoutMillis) throws SQLException;
  }

  private static final Connector JDBC = new Connector() {
    @Override
    public ClusterConnection connect(ClusterConfig config, int connectTimeoutMillis)
        throws SQLException {
      return JdbcClusterConnection.open(config, connectTimeoutMillis);
    }
  };

  private final Map<String, ClusterConfig> configs;
  private final Map<String, ClusterConnection> connections = new HashMap<String, ClusterConnection>();
  private final int connectTimeoutMillis;
  private final Connector connector;

  public DefaultConnectionRegistry(TidbaConf conf) {
    this(conf, JDBC);
  }

  @VisibleForTesting
  DefaultConnectionRegistry(TidbaConf conf, Connector connector) {
    Map<String, ClusterConfig> parsed = new TreeMap<String, ClusterConfig>();
    for (Map.Entry<String, Map<String, String>> e : conf.getClusterProperties().entrySet()) {
      try {
        parsed.put(e.getKey(), ClusterConfig.fromProperties(e.getKey(), e.getValue()));
      } catch (IllegalArgumentException ex) {
        LOG.warn("Skipping cluster {}: {}", e.getKey(), ex.getMessage());
      }
    }
    this.configs = Collections.unmodifiableMap(parsed);
    this.connectTimeoutMillis = TidbaConf.getIntVar(conf, ConfVars.JDBC_CONNECT_TIMEOUT_MS);
    this.connector = connector;
  }

  @Override
  public synchronized ClusterConnection getConnection(String clusterName) throws SQLException {
    ClusterConnection conn = connections.get(clusterName);
    if (conn != null) {
      return conn;
    }
    ClusterConfig config = configs.get(clusterName);
    if (config == null) {
      throw new SQLException("the cluster name [" + clusterName + "] is not registered, "
          + "please configure it with the [" + TidbaConf.CLUSTER_PREFIX + clusterName + ".url] property");
    }
    conn = connector.connect(config, connectTimeoutMillis);
    connections.put(clusterName, conn);
    LOG.info("Connected to cluster {}", clusterName);
    return conn;
  }

  @Override
  public boolean isRegistered(String clusterName) {
    return configs.containsKey(clusterName);
  }

  @Override
  public Set<String> getClusterNames() {
    return configs.keySet();
  }

  @Override
  public synchronized void close() {
    for (ClusterConnection conn : connections.values()) {
      conn.close();
    }
    connections.clear();
  }
}
