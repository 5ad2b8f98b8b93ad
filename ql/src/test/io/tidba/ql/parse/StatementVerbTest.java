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


package io.tidba.ql.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class StatementVerbTest {

  @Test
  public void testClassifiesCaseInsensitively() {
    assertEquals(StatementVerb.SELECT, StatementVerb.of("select * from t"));
    assertEquals(StatementVerb.SHOW, StatementVerb.of("  Show processlist"));
    assertEquals(StatementVerb.USE, StatementVerb.of("USE test"));
    assertEquals(StatementVerb.EXPLAIN, StatementVerb.of("explain analyze select 1"));
  }

  @Test
  public void testOtherVerbsAreNotAllowed() {
    assertEquals(StatementVerb.OTHER, StatementVerb.of("delete from t"));
    assertEquals(StatementVerb.OTHER, StatementVerb.of("DROP TABLE t"));
    assertEquals(StatementVerb.OTHER, StatementVerb.of(""));
    assertFalse(StatementVerb.OTHER.isAllowed());
    assertFalse(StatementVerb.isAllowedVerb("update"));
  }

  @Test
  public void testCommentsBeforeVerb() {
    assertEquals(StatementVerb.SELECT, StatementVerb.of("/* hint */ select 1"));
    assertEquals(StatementVerb.SHOW, StatementVerb.of("-- note\nshow tables"));
    assertEquals(StatementVerb.OTHER, StatementVerb.of("/* select */ delete from t"));
  }

  @Test
  public void testTokenWithTerminator() {
    assertTrue(StatementVerb.isAllowedVerb("show;"));
    assertTrue(StatementVerb.isAllowedVerb("SELECT\\G"));
    assertEquals(StatementVerb.USE, StatementVerb.ofToken("use;"));
  }

  @Test
  public void testHelpers() {
    assertEquals("SELECT/SHOW/USE/EXPLAIN", StatementVerb.describeAllowed());
    assertEquals("kill", StatementVerb.firstToken("  kill sql --digest a"));
    assertEquals("", StatementVerb.firstToken("   "));
  }
}
