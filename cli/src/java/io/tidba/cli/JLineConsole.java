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

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import jline.console.ConsoleReader;
import jline.console.UserInterruptException;
import jline.console.completer.ArgumentCompleter;
import jline.console.completer.ArgumentCompleter.AbstractArgumentDelimiter;
import jline.console.completer.ArgumentCompleter.ArgumentDelimiter;
import jline.console.completer.Completer;
import jline.console.completer.StringsCompleter;
import jline.console.history.FileHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tidba.ql.parse.StatementVerb;

/**
 * {@link LineConsole} and {@link ConsoleHistory} on top of a jline
 * {@link ConsoleReader} with a {@link FileHistory}.
 */
public class JLineConsole implements LineConsole, ConsoleHistory, Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(JLineConsole.class);

    private final ConsoleReader reader;
    private final FileHistory history;

    JLineConsole(ConsoleReader reader, FileHistory history) {
        this.reader = reader;
        this.history = history;
    }

    /**
     * Sets up the reader with tab completion for the given command names and
     * the allowed sql verbs, and attaches the history file.
     */
    public static JLineConsole open(File historyFile, Collection<String> commandNames) throws IOException {
        ConsoleReader reader = new ConsoleReader();
        reader.setExpandEvents(false);
        reader.setBellEnabled(false);
        reader.setHandleUserInterrupt(true);
        reader.addCompleter(getCommandCompleter(commandNames));

        File parent = historyFile.getAbsoluteFile().getParentFile();
        if(parent != null && !parent.isDirectory() && !parent.mkdirs()) {
            throw new IOException("Unable to create directory " + parent + " for the history file");
        }
        FileHistory history = new FileHistory(historyFile);
        reader.setHistory(history);
        // entries are added by the dispatcher once a line is accepted
        reader.setHistoryEnabled(false);
        return new JLineConsole(reader, history);
    }

    static Completer getCommandCompleter(Collection<String> commandNames) {
        List<String> candidateStrings = new ArrayList<String>(commandNames);
        for(StatementVerb verb : StatementVerb.values()) {
            if(verb.isAllowed()) {
                candidateStrings.add(verb.name());
                candidateStrings.add(verb.name().toLowerCase(Locale.ROOT));
            }
        }
        ArgumentDelimiter delim = new AbstractArgumentDelimiter() {
            @Override
            public boolean isDelimiterChar(CharSequence buffer, int pos) {
                char c = buffer.charAt(pos);
                return (Character.isWhitespace(c) || c == '(' || c == ')' || c == ',');
            }
        };
        ArgumentCompleter argCompleter = new ArgumentCompleter(delim, new StringsCompleter(candidateStrings));
        // table and column names are not in the word list
        argCompleter.setStrict(false);
        return argCompleter;
    }

    @Override
    public InputEvent read(String prompt) {
        try {
            String line = reader.readLine(prompt);
            if(line == null) {
                return InputEvent.endOfInput();
            }
            return InputEvent.line(line);
        } catch(UserInterruptException e) {
            return InputEvent.interrupt();
        } catch(IOException e) {
            return InputEvent.readError(e);
        }
    }

    @Override
    public void clearScreen() throws IOException {
        reader.clearScreen();
        reader.flush();
    }

    @Override
    public void add(String entry) throws IOException {
        history.add(entry);
        history.flush();
    }

    @Override
    public void close() throws IOException {
        try {
            history.flush();
        } finally {
            reader.shutdown();
            LOG.debug("Console reader closed");
        }
    }
}
