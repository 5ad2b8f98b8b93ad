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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.Properties;
import java.util.SortedMap;
import java.util.TreeMap;

import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * TiDBA configuration. Values are layered: built-in defaults, then
 * <code>tidba-site.properties</code> on the classpath, then
 * <code>tidba-site.properties</code> in the metadata directory, then
 * explicit overrides.
 */
public class TidbaConf {

  private static final Logger LOG = LoggerFactory.getLogger(TidbaConf.class);

  public static final String SITE_FILE = "tidba-site.properties";
  public static final String CLUSTER_PREFIX = "tidba.cluster.";

  /**
   * Metadata for every supported configuration variable.
   */
  public static enum ConfVars {
    // holds history and site configuration
    METADATA_DIR("tidba.metadata.dir", "~/.tidba"),
    CLIPROMPT("tidba.cli.prompt", "tidba"),
    // current cluster and database in the prompt
    CLIPRINTCURRENTDB("tidba.cli.print.current.db", true),
    // relative to the metadata directory
    CLI_HISTORY_FILE("tidba.cli.history.file", "tidba_history"),
    CLI_NULL_VALUE("tidba.cli.null.value", "NULL"),
    JDBC_CONNECT_TIMEOUT_MS("tidba.jdbc.connect.timeout.ms", 10000),
    KILL_INTERVAL_MS("tidba.kill.interval.ms", 1000),
    KILL_CONCURRENCY("tidba.kill.concurrency", 5),
    ;

    public final String varname;
    private final String defaultVal;

    ConfVars(String varname, Object defaultVal) {
      this.varname = varname;
      this.defaultVal = String.valueOf(defaultVal);
    }

    public String getDefaultValue() {
      return defaultVal;
    }

    @Override
    public String toString() {
      return varname;
    }
  }

  private final Properties props = new Properties();

  public TidbaConf() {
    for (ConfVars var : ConfVars.values()) {
      props.setProperty(var.varname, var.getDefaultValue());
    }
    loadResource(SITE_FILE);
  }

  private void loadResource(String name) {
    InputStream in = TidbaConf.class.getClassLoader().getResourceAsStream(name);
    if (in == null) {
      return;
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      props.load(reader);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load " + name + " from classpath", e);
    }
  }

  /**
   * Loads <code>tidba-site.properties</code> from the metadata directory if
   * present.
   *
   * @return true if a site file was found and loaded
   */
  public boolean loadSiteFile() throws IOException {
    File site = new File(getMetadataDir(), SITE_FILE);
    if (!site.isFile()) {
      LOG.debug("No site configuration at {}", site);
      return false;
    }
    try (Reader reader = Files.newBufferedReader(site.toPath(), StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    LOG.info("Loaded site configuration from {}", site);
    return true;
  }

  public String get(String name) {
    return props.getProperty(name);
  }

  public void set(String name, String value) {
    Preconditions.checkNotNull(name, "name");
    if (value == null) {
      props.remove(name);
    } else {
      props.setProperty(name, value);
    }
  }

  public String getVar(ConfVars var) {
    return props.getProperty(var.varname, var.getDefaultValue());
  }

  public void setVar(ConfVars var, String value) {
    set(var.varname, value);
  }

  public static int getIntVar(TidbaConf conf, ConfVars var) {
    String value = conf.getVar(var);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer value [" + value + "] for " + var.varname, e);
    }
  }

  public static boolean getBoolVar(TidbaConf conf, ConfVars var) {
    return Boolean.parseBoolean(conf.getVar(var).trim());
  }

  /**
   * @return the metadata directory with a leading <code>~</code> expanded
   */
  public File getMetadataDir() {
    String dir = getVar(ConfVars.METADATA_DIR);
    if (dir.equals("~") || dir.startsWith("~/")) {
      dir = System.getProperty("user.home") + dir.substring(1);
    }
    return new File(dir);
  }

  /**
   * Collects every property below <code>tidba.cluster.</code>, grouped by
   * cluster name.
   *
   * @return cluster name to (key to value), keys without the cluster prefix
   */
  public SortedMap<String, Map<String, String>> getClusterProperties() {
    SortedMap<String, Map<String, String>> clusters = new TreeMap<String, Map<String, String>>();
    for (String name : props.stringPropertyNames()) {
      if (!name.startsWith(CLUSTER_PREFIX)) {
        continue;
      }
      String rest = name.substring(CLUSTER_PREFIX.length());
      int dot = rest.lastIndexOf('.');
      if (dot <= 0 || dot == rest.length() - 1) {
        LOG.warn("Ignoring malformed cluster property {}", name);
        continue;
      }
      String cluster = rest.substring(0, dot);
      String key = rest.substring(dot + 1);
      Map<String, String> values = clusters.get(cluster);
      if (values == null) {
        values = new TreeMap<String, String>();
        clusters.put(cluster, values);
      }
      values.put(key, StringUtils.trimToEmpty(props.getProperty(name)));
    }
    return clusters;
  }
}
