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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class TargetSessionTest {

  @Test
  public void testParse() {
    TargetSession session = TargetSession.parse("10.0.1.5:4000:2199023255553");
    assertEquals("10.0.1.5:4000", session.getInstanceAddress());
    assertEquals("2199023255553", session.getSessionId());
    assertEquals("[10.0.1.5:4000] with id [2199023255553]", session.toString());
    assertEquals(new TargetSession("10.0.1.5:4000", "2199023255553"), session);
  }

  @Test
  public void testUnmatchedInstance() {
    // concat_ws drops the NULL instance of an unmatched process list row
    TargetSession session = TargetSession.parse("42");
    assertEquals("", session.getInstanceAddress());
    assertEquals("42", session.getSessionId());
  }

  @Test
  public void testInvalid() {
    assertThrows(IllegalArgumentException.class, () -> TargetSession.parse(" "));
    assertThrows(IllegalArgumentException.class, () -> TargetSession.parse("host:4000:"));
    assertThrows(IllegalArgumentException.class, () -> TargetSession.parse("host:4000:12; drop"));
  }
}
