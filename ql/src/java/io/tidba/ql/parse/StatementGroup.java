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

import java.util.Objects;

import org.apache.commons.lang.StringUtils;

/**
 * One delimiter-terminated unit of SQL text extracted from a buffered
 * multi-line input, together with the terminator that closed it.
 */
public final class StatementGroup {

  /**
   * Statement terminators recognised by the console.
   */
  public enum Terminator {
    /** trailing remainder, never executed */
    NONE(""),
    SEMICOLON(";"),
    /** vertical output, one field per line */
    VERTICAL("\\G");

    private final String symbol;

    Terminator(String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }
  }

  private final String text;
  private final Terminator terminator;

  public StatementGroup(String text, Terminator terminator) {
    this.text = text == null ? "" : text;
    this.terminator = Objects.requireNonNull(terminator, "terminator");
  }

  public String getText() {
    return text;
  }

  public Terminator getTerminator() {
    return terminator;
  }

  public boolean isEmpty() {
    return StringUtils.isBlank(text);
  }

  /**
   * @return false for the unterminated remainder of a buffer
   */
  public boolean isExecutable() {
    return terminator != Terminator.NONE;
  }

  public boolean isVertical() {
    return terminator == Terminator.VERTICAL;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StatementGroup)) {
      return false;
    }
    StatementGroup other = (StatementGroup) o;
    return text.equals(other.text) && terminator == other.terminator;
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, terminator);
  }

  @Override
  public String toString() {
    return text + terminator.getSymbol();
  }
}
