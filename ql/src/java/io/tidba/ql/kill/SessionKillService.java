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

package io.tidba.ql.kill;

import java.sql.SQLException;
import java.util.List;

import com.google.common.base.Preconditions;

import io.tidba.ql.exec.CancellationToken;
import io.tidba.ql.jdbc.ClusterConnection;
import io.tidba.ql.jdbc.ConnectionRegistry;

/**
 * Entry points for killing sessions by statement digest or by user.
 */
public class SessionKillService {

  private final ConnectionRegistry registry;

  public SessionKillService(ConnectionRegistry registry) {
    this.registry = Preconditions.checkNotNull(registry, "registry");
  }

  public KillSummary killByDigest(CancellationToken token, String clusterName, List<String> digests,
      int durationSeconds, int intervalMillis, int concurrency) throws KillSessionException {
    return kill(token, clusterName, KillPredicate.digests(digests),
        KillOptions.fromFlags(durationSeconds, intervalMillis, concurrency));
  }

  public KillSummary killByUsername(CancellationToken token, String clusterName, List<String> usernames,
      int durationSeconds, int intervalMillis, int concurrency) throws KillSessionException {
    return kill(token, clusterName, KillPredicate.usernames(usernames),
        KillOptions.fromFlags(durationSeconds, intervalMillis, concurrency));
  }

  public KillSummary kill(CancellationToken token, String clusterName, KillPredicate predicate,
      KillOptions options) throws KillSessionException {
    ClusterConnection conn;
    try {
      conn = registry.getConnection(clusterName);
    } catch (SQLException e) {
      throw new KillSessionException("get cluster [" + clusterName + "] connection failed: " + e.getMessage(), e);
    }
    return kill(token, conn, predicate, options);
  }

  /**
   * Runs the kill loop on a connection the caller already holds.
   */
  public KillSummary kill(CancellationToken token, ClusterConnection conn, KillPredicate predicate,
      KillOptions options) throws KillSessionException {
    return new SessionKiller(conn, predicate, options).run(token);
  }
}
