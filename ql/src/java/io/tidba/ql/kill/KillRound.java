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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * One discover-then-terminate pass. <code>remaining</code> starts at the
 * number of discovered sessions and drops by one for every confirmed kill,
 * so <code>0 &lt;= remaining &lt;= discovered</code> at all times.
 */
public final class KillRound {

  private final int roundNumber;
  private final int discovered;
  private final AtomicInteger remaining;

  public KillRound(int roundNumber, int discovered) {
    this.roundNumber = roundNumber;
    this.discovered = discovered;
    this.remaining = new AtomicInteger(discovered);
  }

  /**
   * Records a confirmed kill.
   *
   * @return sessions of this round still not confirmed killed
   */
  public int markKilled() {
    return remaining.decrementAndGet();
  }

  public int getRoundNumber() {
    return roundNumber;
  }

  public int getDiscovered() {
    return discovered;
  }

  public int getRemaining() {
    return remaining.get();
  }

  public int getKilled() {
    return discovered - remaining.get();
  }

  @Override
  public String toString() {
    return "round [" + roundNumber + "] discovered [" + discovered + "] killed [" + getKilled()
        + "] remaining [" + getRemaining() + "]";
  }
}
