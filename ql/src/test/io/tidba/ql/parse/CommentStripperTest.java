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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class CommentStripperTest {

  @Test
  public void testLineComment() {
    assertEquals("select 1", CommentStripper.strip("select 1 -- trailing"));
    assertEquals("select 1", CommentStripper.strip("-- leading\nselect 1"));
  }

  @Test
  public void testBlockComment() {
    assertEquals("select   1", CommentStripper.strip("select /* hint */ 1"));
    assertEquals("select 1", CommentStripper.strip("/* only a comment */select 1"));
  }

  @Test
  public void testBlockCommentAcrossLines() {
    assertEquals("select 1\n;", CommentStripper.strip("select 1 /* first\nsecond */;"));
    assertEquals("show tables;", CommentStripper.strip("/*\n * banner\n */\nshow tables;"));
  }

  @Test
  public void testMarkersInsideQuotesAreKept() {
    String sql = "select '-- not a comment', \"/* nor this */\", `a--b` from t";
    assertEquals(sql, CommentStripper.strip(sql));
    assertEquals("select 'it\\'s -- here'", CommentStripper.strip("select 'it\\'s -- here' -- gone"));
  }

  @Test
  public void testBlankLinesDropped() {
    assertEquals("select 1\nfrom dual", CommentStripper.strip("\n\n  select 1  \n\n\tfrom dual\n"));
    assertEquals("", CommentStripper.strip("  -- nothing\n\n/* at all */"));
    assertEquals("", CommentStripper.strip(null));
  }

  @Test
  public void testIdempotent() {
    String[] inputs = {
        "select 1 -- c\n;",
        "/* a */ show /* b */ tables;\n-- end",
        "select '/*' , 1 /* x */;",
        "use test;"
    };
    for (String input : inputs) {
      String once = CommentStripper.strip(input);
      assertEquals(once, CommentStripper.strip(once), input);
    }
  }
}
