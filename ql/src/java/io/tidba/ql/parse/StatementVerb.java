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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import org.apache.commons.lang.StringUtils;

import com.google.common.base.Joiner;

/**
 * Leading verb of a statement. Only the allowed verbs may be executed from
 * the interactive console.
 */
public enum StatementVerb {
  SELECT,
  SHOW,
  USE,
  EXPLAIN,
  OTHER;

  private static final Set<StatementVerb> ALLOWED =
      EnumSet.of(SELECT, SHOW, USE, EXPLAIN);

  public boolean isAllowed() {
    return ALLOWED.contains(this);
  }

  /**
   * Classifies a statement by its first token once comments are removed.
   */
  public static StatementVerb of(String statement) {
    return ofToken(firstToken(CommentStripper.strip(statement)));
  }

  /**
   * Classifies a single raw token, case-insensitively.
   */
  public static StatementVerb ofToken(String token) {
    if (StringUtils.isBlank(token)) {
      return OTHER;
    }
    String bare = StringUtils.removeEnd(StringUtils.removeEnd(token.trim(), ";"), "\\G");
    String upper = bare.toUpperCase(Locale.ROOT);
    for (StatementVerb verb : ALLOWED) {
      if (verb.name().equals(upper)) {
        return verb;
      }
    }
    return OTHER;
  }

  public static boolean isAllowedVerb(String token) {
    return ofToken(token).isAllowed();
  }

  /**
   * @return the allow-list as shown to the operator, e.g. SELECT/SHOW/USE/EXPLAIN
   */
  public static String describeAllowed() {
    return Joiner.on('/').join(ALLOWED);
  }

  /**
   * @return the first whitespace-delimited token, or an empty string
   */
  public static String firstToken(String text) {
    String[] tokens = StringUtils.split(text);
    if (tokens == null || tokens.length == 0) {
      return "";
    }
    return tokens[0];
  }
}
