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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

public class KillOptionsTest {

  @Test
  public void testFromFlags() {
    KillOptions options = KillOptions.fromFlags(30, 500, 8);
    assertTrue(options.isBounded());
    assertEquals(Duration.ofSeconds(30), options.getDuration());
    assertEquals(Duration.ofMillis(500), options.getInterval());
    assertEquals(8, options.getConcurrency());
    assertEquals("duration=30s, interval=500ms, concurrency=8", options.toString());
  }

  @Test
  public void testZeroDurationIsUnbounded() {
    assertFalse(KillOptions.fromFlags(0, 1000, 1).isBounded());
  }

  @Test
  public void testInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> KillOptions.fromFlags(-1, 1000, 1));
    assertThrows(IllegalArgumentException.class, () -> KillOptions.fromFlags(0, -5, 1));
    assertThrows(IllegalArgumentException.class, () -> KillOptions.fromFlags(0, 1000, 0));
  }
}
