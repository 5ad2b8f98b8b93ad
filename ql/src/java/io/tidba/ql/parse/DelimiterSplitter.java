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

import java.util.ArrayList;
import java.util.List;

import io.tidba.ql.parse.StatementGroup.Terminator;

/**
 * Splits a completed statement buffer into {@link StatementGroup}s on
 * <code>;</code> and <code>\G</code>.
 */
public final class DelimiterSplitter {

  private DelimiterSplitter() {
  }

  /**
   * Splits the buffer on every terminator outside quotes. We can not use
   * a plain regex split here as a terminator may be quoted.
   *
   * @param input comment-free statement text
   * @return groups in input order; a non-blank trailing remainder is
   *         returned last with {@link Terminator#NONE}
   */
  public static List<StatementGroup> split(String input) {
    List<StatementGroup> ret = new ArrayList<StatementGroup>();
    if (input == null) {
      return ret;
    }
    boolean insideSingleQuote = false;
    boolean insideDoubleQuote = false;
    boolean insideBackQuote = false;
    boolean escape = false;
    int beginIndex = 0;
    int index = 0;
    while (index < input.length()) {
      char c = input.charAt(index);
      boolean quoted = insideSingleQuote || insideDoubleQuote || insideBackQuote;
      if (c == '\'' && !escape && !insideDoubleQuote && !insideBackQuote) {
        insideSingleQuote = !insideSingleQuote;
      } else if (c == '"' && !escape && !insideSingleQuote && !insideBackQuote) {
        insideDoubleQuote = !insideDoubleQuote;
      } else if (c == '`' && !insideSingleQuote && !insideDoubleQuote) {
        insideBackQuote = !insideBackQuote;
      } else if (!quoted && c == ';') {
        ret.add(new StatementGroup(input.substring(beginIndex, index).trim(), Terminator.SEMICOLON));
        beginIndex = index + 1;
      } else if (!quoted && c == '\\' && index + 1 < input.length() && input.charAt(index + 1) == 'G') {
        ret.add(new StatementGroup(input.substring(beginIndex, index).trim(), Terminator.VERTICAL));
        index += 2;
        beginIndex = index;
        continue;
      }

      if (escape) {
        escape = false;
      } else if (c == '\\' && (insideSingleQuote || insideDoubleQuote)) {
        escape = true;
      }
      index++;
    }
    String remainder = input.substring(beginIndex).trim();
    if (!remainder.isEmpty()) {
      ret.add(new StatementGroup(remainder, Terminator.NONE));
    }
    return ret;
  }

  /**
   * @return true when at least one group was closed by a terminator
   */
  public static boolean containsTerminator(List<StatementGroup> groups) {
    for (StatementGroup group : groups) {
      if (group.isExecutable()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Inverse of {@link #split(String)} modulo whitespace.
   */
  public static String join(List<StatementGroup> groups) {
    StringBuilder sb = new StringBuilder();
    for (StatementGroup group : groups) {
      if (sb.length() > 0) {
        sb.append(' ');
      }
      sb.append(group.getText()).append(group.getTerminator().getSymbol());
    }
    return sb.toString();
  }
}
