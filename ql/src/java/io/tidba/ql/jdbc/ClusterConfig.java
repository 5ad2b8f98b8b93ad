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

package io.tidba.ql.jdbc;

import java.util.Map;
import java.util.Properties;

import org.apache.commons.lang.StringUtils;

import com.google.common.base.Preconditions;

/**
 * Connection settings of one cluster, read from
 * <code>tidba.cluster.&lt;name&gt;.*</code> properties.
 */
public final class ClusterConfig {

  public static final String URL = "url";
  public static final String HOST = "host";
  public static final String PORT = "port";
  public static final String USER = "user";
  public static final String PASSWORD = "password";

  private static final String DEFAULT_PORT = "4000";

  private final String name;
  private final String url;
  private final String user;
  private final String password;

  public ClusterConfig(String name, String url, String user, String password) {
    Preconditions.checkArgument(StringUtils.isNotBlank(name), "cluster name is empty");
    Preconditions.checkArgument(StringUtils.isNotBlank(url),
        "the cluster [%s] has no jdbc url configured", name);
    this.name = name;
    this.url = url;
    this.user = StringUtils.defaultString(user);
    this.password = StringUtils.defaultString(password);
  }

  /**
   * Builds a config from the properties of one cluster. Either <code>url</code>
   * or <code>host</code> (and optionally <code>port</code>) must be present.
   */
  public static ClusterConfig fromProperties(String name, Map<String, String> values) {
    String url = values.get(URL);
    if (StringUtils.isBlank(url) && StringUtils.isNotBlank(values.get(HOST))) {
      String port = StringUtils.defaultIfEmpty(values.get(PORT), DEFAULT_PORT);
      url = "jdbc:mysql://" + values.get(HOST) + ":" + port + "/";
    }
    return new ClusterConfig(name, url, values.get(USER), values.get(PASSWORD));
  }

  public String getName() {
    return name;
  }

  public String getUrl() {
    return url;
  }

  public String getUser() {
    return user;
  }

  /**
   * @return driver properties for opening a connection
   */
  public Properties toDriverProperties(int connectTimeoutMillis) {
    Properties info = new Properties();
    info.setProperty("user", user);
    info.setProperty("password", password);
    info.setProperty("connectTimeout", String.valueOf(connectTimeoutMillis));
    return info;
  }

  @Override
  public String toString() {
    return "ClusterConfig{name=" + name + ", url=" + url + ", user=" + user + "}";
  }
}
