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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.tidba.ql.exec.CancellationToken;
import io.tidba.ql.exec.CancellationToken.CancelledException;
import io.tidba.ql.exec.CancellationToken.Reason;
import io.tidba.ql.jdbc.ClusterConnection;
import io.tidba.ql.jdbc.QueryResult;

/**
 * Repeatedly discovers the live sessions matching a {@link KillPredicate}
 * across a cluster and kills them, until the deadline elapses, the operator
 * interrupts, or a round fails.
 * <p>
 * Rounds run one after another. Within a round every matched session is
 * killed on a fixed-size worker pool; the first failed kill cancels the
 * shared token, which aborts the other in-flight kills and ends the
 * invocation. A round that finds nothing just sleeps and polls again, since
 * new sessions may start matching at any time.
 */
public class SessionKiller {

  private static final Logger LOG = LoggerFactory.getLogger(SessionKiller.class);

  static final String GLOBAL_KILL_QUERY =
      "show config where `type`='tidb' and name ='enable-global-kill'";
  static final String KILL_STATEMENT = "KILL TIDB %s";
  static final String INST_COLUMN = "inst";

  private static final long POOL_SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final ClusterConnection connection;
  private final KillPredicate predicate;
  private final KillOptions options;

  public SessionKiller(ClusterConnection connection, KillPredicate predicate, KillOptions options) {
    this.connection = Preconditions.checkNotNull(connection, "connection");
    this.predicate = Preconditions.checkNotNull(predicate, "predicate");
    this.options = Preconditions.checkNotNull(options, "options");
  }

  /**
   * Runs rounds until the token is cancelled.
   *
   * @return the summary when stopped by the deadline or an interrupt
   * @throws KillSessionException if global kill is not enabled, discovery
   *           fails, or a kill fails
   */
  public KillSummary run(CancellationToken token) throws KillSessionException {
    if (!checkGlobalKill(token)) {
      return finish(token, 0, 0, null);
    }

    String cluster = connection.getClusterName();
    String query = predicate.toDiscoveryQuery();
    LOG.info("kill {} session on cluster [{}] with {}", predicate, cluster, options);

    ExecutorService pool = Executors.newFixedThreadPool(options.getConcurrency(),
        new ThreadFactoryBuilder().setNameFormat("kill-" + cluster + "-%d").setDaemon(true).build());
    ScheduledExecutorService scheduler = null;
    if (options.isBounded()) {
      scheduler = Executors.newSingleThreadScheduledExecutor(
          new ThreadFactoryBuilder().setNameFormat("kill-deadline-%d").setDaemon(true).build());
      token.scheduleDeadline(options.getDuration(), scheduler);
    }

    int rounds = 0;
    long killed = 0;
    KillRound last = null;
    try {
      while (!token.isCancelled()) {
        Stopwatch watch = Stopwatch.createStarted();
        int roundNumber = rounds++;
        LOG.info("started round [{}] kill {} session operation...", roundNumber, predicate.getKind().getLabel());

        List<TargetSession> targets = discover(token, query);
        if (targets == null) {
          break;
        }
        KillRound round = new KillRound(roundNumber, targets.size());
        last = round;
        LOG.info("round [{}] generated kill list in {}, discovered [{}] session(s)",
            roundNumber, watch, targets.size());

        if (!targets.isEmpty()) {
          try {
            killAll(round, targets, token, pool);
          } catch (KillSessionException e) {
            LOG.error("aborted {}, finished in {}", round, watch, e);
            throw e;
          } finally {
            killed += round.getKilled();
          }
        }
        LOG.info("completed {}, finished in {}", round, watch);

        if (token.sleep(options.getInterval().toMillis())) {
          break;
        }
      }
    } finally {
      shutdown(pool);
      if (scheduler != null) {
        scheduler.shutdownNow();
      }
    }
    return finish(token, rounds, killed, last);
  }

  /**
   * @return false if the token was cancelled for a reason other than a
   *         failure before the check completed
   */
  private boolean checkGlobalKill(CancellationToken token) throws KillSessionException {
    QueryResult res;
    try {
      res = connection.query(token, GLOBAL_KILL_QUERY);
    } catch (CancelledException e) {
      return false;
    } catch (SQLException e) {
      if (isStopped(token)) {
        return false;
      }
      throw new KillSessionException("query cluster [" + connection.getClusterName()
          + "] config enable-global-kill failed: " + e.getMessage(), e);
    }
    boolean enabled = !res.isEmpty();
    for (Map<String, String> row : res.getRows()) {
      String value = row.containsKey("Value") ? row.get("Value") : row.get("value");
      if (value != null && value.trim().equalsIgnoreCase("false")) {
        enabled = false;
      }
    }
    if (!enabled) {
      throw new KillSessionException("the cluster name [" + connection.getClusterName()
          + "] database version not meet requirement, require version >= v6.1.0 and config [enable-global-kill = true]");
    }
    return true;
  }

  /**
   * @return the matched sessions, or null if the token was cancelled for a
   *         reason other than a failure while discovering
   */
  private List<TargetSession> discover(CancellationToken token, String query)
      throws KillSessionException {
    QueryResult result;
    try {
      result = connection.query(token, query);
    } catch (CancelledException e) {
      return null;
    } catch (SQLException e) {
      if (isStopped(token)) {
        return null;
      }
      token.cancel(Reason.FAILED, e);
      throw new KillSessionException("discover sessions failed, query: " + query, e);
    }
    List<TargetSession> targets = new ArrayList<TargetSession>(result.size());
    for (Map<String, String> row : result.getRows()) {
      String inst = row.get(INST_COLUMN);
      if (StringUtils.isBlank(inst)) {
        LOG.warn("Skipping session without address: {}", row);
        continue;
      }
      try {
        targets.add(TargetSession.parse(inst));
      } catch (IllegalArgumentException e) {
        LOG.warn("Skipping session [{}]: {}", inst, e.getMessage());
      }
    }
    return targets;
  }

  private void killAll(final KillRound round, List<TargetSession> targets,
      final CancellationToken token, ExecutorService pool) throws KillSessionException {
    CompletionService<TargetSession> completion = new ExecutorCompletionService<TargetSession>(pool);
    List<Future<TargetSession>> futures = new ArrayList<Future<TargetSession>>(targets.size());
    for (final TargetSession target : targets) {
      futures.add(completion.submit(new Callable<TargetSession>() {
        @Override
        public TargetSession call() throws SQLException {
          kill(round, target, token);
          return target;
        }
      }));
    }

    try {
      for (int i = 0; i < futures.size(); i++) {
        Future<TargetSession> done = completion.take();
        try {
          done.get();
        } catch (CancellationException e) {
          LOG.debug("kill task cancelled in round [{}]", round.getRoundNumber());
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          if (cause instanceof CancelledException || isStopped(token)) {
            // aborted by deadline or interrupt, not a failure of the kill itself
            continue;
          }
          token.cancel(Reason.FAILED, cause);
          cancelAll(futures);
          throw new KillSessionException(String.format(
              "round [%d] kill session failed, [%d] of [%d] session(s) in this round are not confirmed killed: %s",
              round.getRoundNumber(), round.getRemaining(), round.getDiscovered(), cause.getMessage()),
              cause, round);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      token.cancel(Reason.INTERRUPTED, e);
      cancelAll(futures);
    }
  }

  private void kill(KillRound round, TargetSession target, CancellationToken token)
      throws SQLException {
    token.throwIfCancelled();
    Stopwatch watch = Stopwatch.createStarted();
    try (ClusterConnection conn = connection.fork()) {
      conn.execute(token, String.format(KILL_STATEMENT, target.getSessionId()));
    }
    int remaining = round.markKilled();
    LOG.info("killed {} session on {} finished in {}, round [{}] discovered [{}] remaining [{}]",
        predicate.getKind().getLabel(), target, watch, round.getRoundNumber(), round.getDiscovered(), remaining);
  }

  private KillSummary finish(CancellationToken token, int rounds, long killed, KillRound last)
      throws KillSessionException {
    Reason reason = token.getReason();
    Preconditions.checkState(reason != null, "kill loop ended without cancellation");
    if (reason == Reason.FAILED) {
      Throwable cause = token.getCause();
      throw new KillSessionException("kill operation was cancelled by an error"
          + (cause == null ? "" : ": " + cause.getMessage()), cause, last);
    }
    KillSummary summary = new KillSummary(reason, rounds, killed, last);
    if (reason == Reason.DEADLINE_EXCEEDED) {
      LOG.warn("the running time has expired [--duration {}] and the kill operation exited automatically, {}",
          options.getDuration().getSeconds(), summary);
    } else {
      LOG.warn("received interrupt signal, kill operation stopped, {}", summary);
    }
    return summary;
  }

  private static boolean isStopped(CancellationToken token) {
    return token.isCancelled() && token.getReason() != Reason.FAILED;
  }

  private static void cancelAll(List<? extends Future<?>> futures) {
    for (Future<?> future : futures) {
      future.cancel(true);
    }
  }

  private static void shutdown(ExecutorService pool) {
    pool.shutdownNow();
    try {
      if (!pool.awaitTermination(POOL_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        LOG.warn("kill workers did not stop within {}s", POOL_SHUTDOWN_TIMEOUT_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
