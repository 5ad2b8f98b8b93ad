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


package io.tidba.ql.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.SQLException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.tidba.ql.jdbc.ClusterConnection;
import io.tidba.ql.jdbc.ConnectionRegistry;

@ExtendWith(MockitoExtension.class)
public class SessionContextTest {

  @Mock
  private ConnectionRegistry registry;

  private SessionContext session;

  @BeforeEach
  public void setUp() {
    session = new SessionContext();
  }

  private static final SessionContext.ConnectionCallback<ClusterConnection, SQLException> IDENTITY =
      new SessionContext.ConnectionCallback<ClusterConnection, SQLException>() {
        @Override
        public ClusterConnection call(ClusterConnection connection) {
          return connection;
        }
      };

  @Test
  public void testLoginResetsSchema() {
    assertFalse(session.isLoggedIn());
    session.login(" prod ");
    session.changeSchema("test");
    assertEquals("prod", session.getClusterName());
    assertEquals("test", session.getSchemaName());

    session.login("staging");
    assertEquals("", session.getSchemaName());

    session.logout();
    assertFalse(session.isLoggedIn());
    assertEquals("", session.getClusterName());
  }

  @Test
  public void testConnectionOpenedLazilyAndReused() throws SQLException {
    ClusterConnection conn = mock(ClusterConnection.class);
    when(registry.getConnection("prod")).thenReturn(conn);

    session.login("prod");
    assertFalse(session.hasConnection());
    assertSame(conn, session.withConnection(registry, IDENTITY));
    assertSame(conn, session.withConnection(registry, IDENTITY));
    assertTrue(session.hasConnection());
    verify(registry, times(1)).getConnection("prod");

    session.login("prod");
    assertFalse(session.hasConnection());
  }

  @Test
  public void testNoClusterLoggedIn() throws SQLException {
    SQLException e = assertThrows(SQLException.class, () -> session.withConnection(registry, IDENTITY));
    assertTrue(e.getMessage().contains("no cluster"));
    verify(registry, never()).getConnection("");
  }

  @Test
  public void testCallbackExceptionPropagates() throws SQLException {
    when(registry.getConnection("prod")).thenReturn(mock(ClusterConnection.class));
    session.login("prod");
    IllegalStateException e = assertThrows(IllegalStateException.class,
        () -> session.withConnection(registry,
            new SessionContext.ConnectionCallback<Void, IllegalStateException>() {
              @Override
              public Void call(ClusterConnection connection) {
                throw new IllegalStateException("callback failed");
              }
            }));
    assertEquals("callback failed", e.getMessage());
  }
}
