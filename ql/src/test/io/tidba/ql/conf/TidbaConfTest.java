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


package io.tidba.ql.conf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import java.util.SortedMap;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.tidba.ql.conf.TidbaConf.ConfVars;

public class TidbaConfTest {

  @TempDir
  Path tempDir;

  @Test
  public void testDefaults() {
    TidbaConf conf = new TidbaConf();
    assertEquals("tidba", conf.getVar(ConfVars.CLIPROMPT));
    assertEquals(5, TidbaConf.getIntVar(conf, ConfVars.KILL_CONCURRENCY));
    assertEquals(1000, TidbaConf.getIntVar(conf, ConfVars.KILL_INTERVAL_MS));
    assertTrue(TidbaConf.getBoolVar(conf, ConfVars.CLIPRINTCURRENTDB));
  }

  @Test
  public void testOverrideAndInvalidInteger() {
    TidbaConf conf = new TidbaConf();
    conf.setVar(ConfVars.KILL_CONCURRENCY, " 12 ");
    assertEquals(12, TidbaConf.getIntVar(conf, ConfVars.KILL_CONCURRENCY));

    conf.setVar(ConfVars.KILL_CONCURRENCY, "many");
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> TidbaConf.getIntVar(conf, ConfVars.KILL_CONCURRENCY));
    assertTrue(e.getMessage().contains("tidba.kill.concurrency"));

    conf.setVar(ConfVars.KILL_CONCURRENCY, null);
    assertEquals(5, TidbaConf.getIntVar(conf, ConfVars.KILL_CONCURRENCY));
  }

  @Test
  public void testMetadataDirExpandsHome() {
    TidbaConf conf = new TidbaConf();
    assertEquals(new File(System.getProperty("user.home") + "/.tidba"), conf.getMetadataDir());
    conf.setVar(ConfVars.METADATA_DIR, "/var/lib/tidba");
    assertEquals(new File("/var/lib/tidba"), conf.getMetadataDir());
  }

  @Test
  public void testClusterProperties() {
    TidbaConf conf = new TidbaConf();
    conf.set("tidba.cluster.prod.url", "jdbc:mysql://10.0.0.1:4000/");
    conf.set("tidba.cluster.prod.user", " root ");
    conf.set("tidba.cluster.eu.west.host", "10.0.0.2");
    conf.set("tidba.cluster.broken", "x");

    SortedMap<String, Map<String, String>> clusters = conf.getClusterProperties();
    assertEquals(Arrays.asList("eu.west", "prod"), Arrays.asList(clusters.keySet().toArray()));
    assertEquals("root", clusters.get("prod").get("user"));
    assertEquals("10.0.0.2", clusters.get("eu.west").get("host"));
  }

  @Test
  public void testLoadSiteFile() throws IOException {
    TidbaConf conf = new TidbaConf();
    conf.setVar(ConfVars.METADATA_DIR, tempDir.toString());
    assertFalse(conf.loadSiteFile());

    Files.write(tempDir.resolve(TidbaConf.SITE_FILE),
        Arrays.asList("tidba.cli.prompt=ops", "tidba.cluster.test.url=jdbc:mysql://127.0.0.1:4000/"),
        StandardCharsets.UTF_8);
    assertTrue(conf.loadSiteFile());
    assertEquals("ops", conf.getVar(ConfVars.CLIPROMPT));
    assertTrue(conf.getClusterProperties().containsKey("test"));
  }
}
