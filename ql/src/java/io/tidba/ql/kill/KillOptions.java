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

import java.time.Duration;

import com.google.common.base.Preconditions;

/**
 * Tuning of a kill invocation.
 */
public final class KillOptions {

  private final Duration duration;
  private final Duration interval;
  private final int concurrency;

  private KillOptions(Duration duration, Duration interval, int concurrency) {
    Preconditions.checkArgument(!duration.isNegative(), "duration must not be negative: %s", duration);
    Preconditions.checkArgument(!interval.isNegative(), "interval must not be negative: %s", interval);
    Preconditions.checkArgument(concurrency >= 1, "concurrency must be at least 1: %s", concurrency);
    this.duration = duration;
    this.interval = interval;
    this.concurrency = concurrency;
  }

  /**
   * @param duration overall bound, {@link Duration#ZERO} runs until cancelled
   * @param interval sleep between two rounds
   * @param concurrency kills in flight within a round
   */
  public static KillOptions of(Duration duration, Duration interval, int concurrency) {
    return new KillOptions(duration, interval, concurrency);
  }

  public static KillOptions fromFlags(int durationSeconds, int intervalMillis, int concurrency) {
    Preconditions.checkArgument(durationSeconds >= 0, "--duration must not be negative: %s", durationSeconds);
    Preconditions.checkArgument(intervalMillis >= 0, "--interval must not be negative: %s", intervalMillis);
    return new KillOptions(Duration.ofSeconds(durationSeconds), Duration.ofMillis(intervalMillis), concurrency);
  }

  public Duration getDuration() {
    return duration;
  }

  public boolean isBounded() {
    return !duration.isZero();
  }

  public Duration getInterval() {
    return interval;
  }

  public int getConcurrency() {
    return concurrency;
  }

  @Override
  public String toString() {
    return "duration=" + (isBounded() ? duration.getSeconds() + "s" : "unbounded")
        + ", interval=" + interval.toMillis() + "ms, concurrency=" + concurrency;
  }
}
