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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import jline.console.completer.Completer;
import jline.console.history.FileHistory;

public class JLineConsoleTest {

    @TempDir
    Path tempDir;

    private static List<String> complete(Completer completer, String buffer) {
        List<CharSequence> candidates = new ArrayList<CharSequence>();
        completer.complete(buffer, buffer.length(), candidates);
        List<String> ret = new ArrayList<String>();
        for(CharSequence candidate : candidates) {
            ret.add(candidate.toString().trim());
        }
        return ret;
    }

    @Test
    public void testCompletesCommandsAndVerbs() {
        Completer completer = JLineConsole.getCommandCompleter(Arrays.asList("kill", "login", "logout"));
        assertEquals(Arrays.asList("kill"), complete(completer, "ki"));
        assertEquals(Arrays.asList("login", "logout"), complete(completer, "log"));
        assertEquals(Arrays.asList("select"), complete(completer, "sel"));
        assertEquals(Arrays.asList("SHOW"), complete(completer, "SH"));
        assertTrue(complete(completer, "drop").isEmpty());
    }

    @Test
    public void testHistoryIsPersistedOnAdd() throws Exception {
        File file = tempDir.resolve("tidba_history").toFile();
        JLineConsole console = new JLineConsole(null, new FileHistory(file));

        console.add("login -c prod");
        console.add("select 1 from dual;");

        List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        assertEquals(Arrays.asList("login -c prod", "select 1 from dual;"), lines);
    }
}
