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

import io.tidba.ql.exec.CancellationToken.Reason;

/**
 * How a kill invocation that did not fail came to an end.
 */
public final class KillSummary {

  private final Reason stopReason;
  private final int rounds;
  private final long killed;
  private final KillRound lastRound;

  public KillSummary(Reason stopReason, int rounds, long killed, KillRound lastRound) {
    this.stopReason = stopReason;
    this.rounds = rounds;
    this.killed = killed;
    this.lastRound = lastRound;
  }

  /**
   * @return {@link Reason#DEADLINE_EXCEEDED} or {@link Reason#INTERRUPTED}
   */
  public Reason getStopReason() {
    return stopReason;
  }

  public boolean isTimedOut() {
    return stopReason == Reason.DEADLINE_EXCEEDED;
  }

  /**
   * @return number of rounds started
   */
  public int getRounds() {
    return rounds;
  }

  /**
   * @return sessions confirmed killed over all rounds
   */
  public long getKilled() {
    return killed;
  }

  /**
   * @return the last round started, null if the engine stopped before the
   *         first discovery returned
   */
  public KillRound getLastRound() {
    return lastRound;
  }

  @Override
  public String toString() {
    return "stopped by " + stopReason + " after " + rounds + " round(s), killed [" + killed
        + "] session(s)" + (lastRound == null ? "" : ", last " + lastRound);
  }
}
