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

import java.util.Objects;

import org.apache.commons.lang.StringUtils;

import com.google.common.base.Preconditions;

/**
 * A live session found by a discovery query: the address of the instance
 * owning it and its numeric session id.
 */
public final class TargetSession {

  private final String instanceAddress;
  private final String sessionId;

  public TargetSession(String instanceAddress, String sessionId) {
    Preconditions.checkArgument(StringUtils.isNumeric(sessionId) && !sessionId.isEmpty(),
        "invalid session id [%s]", sessionId);
    this.instanceAddress = StringUtils.defaultString(instanceAddress);
    this.sessionId = sessionId;
  }

  /**
   * Parses a discovery row value <code>host:port:id</code>. The instance part
   * is empty when the process list row could not be matched to an instance.
   */
  public static TargetSession parse(String inst) {
    Preconditions.checkArgument(StringUtils.isNotBlank(inst), "empty session address");
    String value = inst.trim();
    int idx = value.lastIndexOf(':');
    if (idx < 0) {
      return new TargetSession("", value);
    }
    return new TargetSession(value.substring(0, idx), value.substring(idx + 1));
  }

  public String getInstanceAddress() {
    return instanceAddress;
  }

  public String getSessionId() {
    return sessionId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TargetSession)) {
      return false;
    }
    TargetSession other = (TargetSession) o;
    return instanceAddress.equals(other.instanceAddress) && sessionId.equals(other.sessionId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(instanceAddress, sessionId);
  }

  @Override
  public String toString() {
    return "[" + instanceAddress + "] with id [" + sessionId + "]";
  }
}
