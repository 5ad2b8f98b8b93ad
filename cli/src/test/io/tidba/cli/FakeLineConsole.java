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

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Replays scripted input events and records the prompts shown.
 */
public class FakeLineConsole implements LineConsole, ConsoleHistory {

    private final Deque<InputEvent> events = new ArrayDeque<InputEvent>();
    public final List<String> prompts = new ArrayList<String>();
    public final List<String> history = new ArrayList<String>();
    public int clears;
    public IOException historyFailure;

    public FakeLineConsole lines(String... lines) {
        for(String line : lines) {
            events.add(InputEvent.line(line));
        }
        return this;
    }

    public FakeLineConsole event(InputEvent event) {
        events.add(event);
        return this;
    }

    @Override
    public InputEvent read(String prompt) {
        prompts.add(prompt);
        InputEvent next = events.poll();
        return next == null ? InputEvent.endOfInput() : next;
    }

    @Override
    public void clearScreen() {
        clears++;
    }

    @Override
    public void add(String entry) throws IOException {
        if(historyFailure != null) {
            throw historyFailure;
        }
        history.add(entry);
    }
}
