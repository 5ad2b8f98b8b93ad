/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package io.tidba.cli;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ShellWordsTest {

    @Test
    public void testPlainWords() throws Exception {
        assertArrayEquals(new String[]{"kill", "sql", "--digest", "a,b"},
                ShellWords.parse("  kill   sql\t--digest a,b "));
        assertEquals(0, ShellWords.parse("   ").length);
    }

    @Test
    public void testQuotes() throws Exception {
        assertArrayEquals(new String[]{"kill", "user", "--username", "app user,o'neil"},
                ShellWords.parse("kill user --username \"app user,o'neil\""));
        assertArrayEquals(new String[]{"a b\\c", "d\"e"},
                ShellWords.parse("'a b\\c' \"d\\\"e\""));
        assertArrayEquals(new String[]{"ab", ""}, ShellWords.parse("a'b' ''"));
    }

    @Test
    public void testBackslashOutsideQuotes() throws Exception {
        assertArrayEquals(new String[]{"a b", "c"}, ShellWords.parse("a\\ b c"));
    }

    @Test
    public void testUnterminated() {
        assertThrows(ShellWords.ParseException.class, () -> ShellWords.parse("login -c \"prod"));
        assertThrows(ShellWords.ParseException.class, () -> ShellWords.parse("login -c 'prod"));
        assertThrows(ShellWords.ParseException.class, () -> ShellWords.parse("login \\"));
    }
}
