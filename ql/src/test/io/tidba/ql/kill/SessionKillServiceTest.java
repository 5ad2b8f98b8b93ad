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
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.tidba.ql.exec.CancellationToken;
import io.tidba.ql.exec.CancellationToken.Reason;
import io.tidba.ql.jdbc.ConnectionRegistry;
import io.tidba.ql.jdbc.QueryResult;

@ExtendWith(MockitoExtension.class)
public class SessionKillServiceTest {

  @Mock
  private ConnectionRegistry registry;

  @Test
  public void testKillByUsernameOnRegisteredCluster() throws Exception {
    final CancellationToken token = new CancellationToken();
    FakeClusterConnection cluster = new FakeClusterConnection("prod")
        .discovery(new FakeClusterConnection.Discovery() {
          @Override
          public QueryResult discover(int call, CancellationToken t) {
            if (call > 1) {
              token.cancel(Reason.INTERRUPTED);
              return FakeClusterConnection.sessions();
            }
            return FakeClusterConnection.sessions("11", "12");
          }
        });
    when(registry.getConnection("prod")).thenReturn(cluster);

    KillSummary summary = new SessionKillService(registry)
        .killByUsername(token, "prod", Arrays.asList("batch"), 0, 10, 2);

    assertEquals(2, summary.getKilled());
    assertEquals(Reason.INTERRUPTED, summary.getStopReason());
  }

  @Test
  public void testUnknownCluster() throws Exception {
    when(registry.getConnection("nope")).thenThrow(new SQLException("the cluster name [nope] is not registered"));

    KillSessionException e = assertThrows(KillSessionException.class,
        () -> new SessionKillService(registry)
            .killByDigest(new CancellationToken(), "nope", Arrays.asList("d"), 0, 10, 1));

    assertTrue(e.getMessage().contains("get cluster [nope] connection failed"));
  }

  @Test
  public void testInvalidArgumentsRejectedBeforeConnecting() {
    assertThrows(IllegalArgumentException.class,
        () -> new SessionKillService(registry)
            .killByDigest(new CancellationToken(), "prod", Arrays.asList(" "), 0, 10, 1));
  }
}
