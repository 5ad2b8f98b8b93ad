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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

public class KillPredicateTest {

  @Test
  public void testValuesAreTrimmedAndDeduplicated() {
    KillPredicate predicate = KillPredicate.digests(Arrays.asList(" abc ", "def", "abc", " "));
    assertEquals(Arrays.asList("abc", "def"), predicate.getValues());
    assertEquals("sql digests [abc, def]", predicate.toString());
  }

  @Test
  public void testEmptyValuesRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> KillPredicate.usernames(Collections.<String>emptyList()));
    assertEquals("the username cannot be empty", e.getMessage());
    assertThrows(IllegalArgumentException.class, () -> KillPredicate.digests(Arrays.asList("", "  ")));
  }

  @Test
  public void testDiscoveryQuery() {
    String digestQuery = KillPredicate.digests(Arrays.asList("a1", "b2")).toDiscoveryQuery();
    assertTrue(digestQuery.contains("concat_ws(':',f.instance,t.ID) AS inst"));
    assertTrue(digestQuery.contains("information_schema.cluster_processlist t"));
    assertTrue(digestQuery.endsWith("t.digest IN ('a1','b2')"), digestQuery);

    String userQuery = KillPredicate.usernames(Arrays.asList("app")).toDiscoveryQuery();
    assertTrue(userQuery.endsWith("t.user IN ('app')"), userQuery);
  }

  @Test
  public void testQuoting() {
    assertEquals("'o''brien'", KillPredicate.quote("o'brien"));
    assertEquals("'a\\\\b'", KillPredicate.quote("a\\b"));
    String query = KillPredicate.usernames(Arrays.asList("x') OR ('1'='1")).toDiscoveryQuery();
    assertTrue(query.endsWith("IN ('x'') OR (''1''=''1')"), query);
  }
}
