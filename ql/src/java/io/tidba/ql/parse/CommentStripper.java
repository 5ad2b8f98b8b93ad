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

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/**
 * Removes <code>--</code> line comments and <code>/* *&#47;</code> block
 * comments from SQL text. Block comments may span several lines of a
 * buffered statement. Comment markers inside quoted literals or quoted
 * identifiers are kept.
 */
public final class CommentStripper {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');
  private static final Joiner LINE_JOINER = Joiner.on('\n');

  private CommentStripper() {
  }

  public static String strip(String input) {
    if (input == null || input.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(input.length());
    boolean insideSingleQuote = false;
    boolean insideDoubleQuote = false;
    boolean insideBackQuote = false;
    boolean insideLineComment = false;
    boolean insideBlockComment = false;
    boolean escape = false;

    int index = 0;
    while (index < input.length()) {
      char c = input.charAt(index);
      char next = index + 1 < input.length() ? input.charAt(index + 1) : 0;

      if (insideLineComment) {
        if (c == '\n') {
          insideLineComment = false;
          sb.append(c);
        }
        index++;
        continue;
      }
      if (insideBlockComment) {
        if (c == '*' && next == '/') {
          insideBlockComment = false;
          // keep the tokens around the comment apart
          sb.append(' ');
          index += 2;
        } else {
          if (c == '\n') {
            sb.append(c);
          }
          index++;
        }
        continue;
      }

      boolean quoted = insideSingleQuote || insideDoubleQuote || insideBackQuote;
      if (!quoted && c == '-' && next == '-') {
        insideLineComment = true;
        index += 2;
        continue;
      }
      if (!quoted && c == '/' && next == '*') {
        insideBlockComment = true;
        index += 2;
        continue;
      }

      if (c == '\'' && !escape && !insideDoubleQuote && !insideBackQuote) {
        insideSingleQuote = !insideSingleQuote;
      } else if (c == '"' && !escape && !insideSingleQuote && !insideBackQuote) {
        insideDoubleQuote = !insideDoubleQuote;
      } else if (c == '`' && !insideSingleQuote && !insideDoubleQuote) {
        insideBackQuote = !insideBackQuote;
      }

      if (escape) {
        escape = false;
      } else if (c == '\\' && (insideSingleQuote || insideDoubleQuote)) {
        escape = true;
      }
      sb.append(c);
      index++;
    }

    List<String> lines = new ArrayList<String>();
    for (String line : LINE_SPLITTER.split(sb)) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        lines.add(trimmed);
      }
    }
    return LINE_JOINER.join(lines);
  }
}
