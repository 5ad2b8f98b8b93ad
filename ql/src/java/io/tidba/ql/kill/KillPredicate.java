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

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang.StringUtils;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Which live sessions a kill targets: sessions running one of a set of
 * statement digests, or sessions owned by one of a set of users.
 */
public final class KillPredicate {

  public enum Kind {
    DIGEST("sql digests", "t.digest"),
    USERNAME("username", "t.user");

    private final String label;
    private final String column;

    Kind(String label, String column) {
      this.label = label;
      this.column = column;
    }

    public String getLabel() {
      return label;
    }
  }

  private static final String DISCOVERY_QUERY = "SELECT\n"
      + "\tconcat_ws(':',f.instance,t.ID) AS inst\n"
      + "FROM\n"
      + "\tinformation_schema.cluster_processlist t\n"
      + "LEFT JOIN information_schema.cluster_info f ON\n"
      + "\tt.INSTANCE = f.STATUS_ADDRESS\n"
      + "WHERE\n"
      + "\t%s IN (%s)";

  private final Kind kind;
  private final List<String> values;

  private KillPredicate(Kind kind, Collection<String> raw) {
    Preconditions.checkNotNull(raw, "values");
    Set<String> cleaned = new LinkedHashSet<String>();
    for (String value : raw) {
      if (StringUtils.isNotBlank(value)) {
        cleaned.add(value.trim());
      }
    }
    Preconditions.checkArgument(!cleaned.isEmpty(), "the %s cannot be empty", kind.getLabel());
    this.kind = kind;
    this.values = ImmutableList.copyOf(cleaned);
  }

  public static KillPredicate digests(Collection<String> digests) {
    return new KillPredicate(Kind.DIGEST, digests);
  }

  public static KillPredicate usernames(Collection<String> usernames) {
    return new KillPredicate(Kind.USERNAME, usernames);
  }

  public Kind getKind() {
    return kind;
  }

  public List<String> getValues() {
    return values;
  }

  /**
   * @return the cluster-wide live session query; each row has one column
   *         <code>inst</code> formatted as <code>host:port:id</code>
   */
  public String toDiscoveryQuery() {
    StringBuilder in = new StringBuilder();
    for (String value : values) {
      if (in.length() > 0) {
        in.append(',');
      }
      in.append(quote(value));
    }
    return String.format(DISCOVERY_QUERY, kind.column, in);
  }

  static String quote(String value) {
    return "'" + value.replace("\\", "\\\\").replace("'", "''") + "'";
  }

  @Override
  public String toString() {
    return kind.getLabel() + " [" + Joiner.on(", ").join(values) + "]";
  }
}
