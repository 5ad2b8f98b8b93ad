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

/**
 * A kill invocation could not start or one of its rounds failed.
 */
public class KillSessionException extends Exception {

  private static final long serialVersionUID = 1L;

  private final KillRound round;

  public KillSessionException(String message) {
    this(message, null, null);
  }

  public KillSessionException(String message, Throwable cause) {
    this(message, cause, null);
  }

  public KillSessionException(String message, Throwable cause, KillRound round) {
    super(message, cause);
    this.round = round;
  }

  /**
   * @return the failing round, null for failures outside a round
   */
  public KillRound getRound() {
    return round;
  }
}
