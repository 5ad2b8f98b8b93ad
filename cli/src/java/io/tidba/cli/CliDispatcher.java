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
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang.StringUtils;

import com.google.common.base.Stopwatch;

import io.tidba.cli.command.CommandTree;
import io.tidba.ql.conf.TidbaConf;
import io.tidba.ql.conf.TidbaConf.ConfVars;
import io.tidba.ql.exec.CancellationToken;
import io.tidba.ql.jdbc.ClusterConnection;
import io.tidba.ql.jdbc.QueryResult;
import io.tidba.ql.parse.CommentStripper;
import io.tidba.ql.parse.DelimiterSplitter;
import io.tidba.ql.parse.StatementGroup;
import io.tidba.ql.parse.StatementVerb;
import io.tidba.ql.session.SessionContext;

/**
 * The read-eval loop of the interactive console. Every input line is either
 * an administrative command, run right away, or part of a sql statement that
 * is buffered until it is terminated by <code>;</code> or <code>\G</code>.
 */
public class CliDispatcher {

    public enum Action {
        CONTINUE,
        EXIT
    }

    public static final String PROMPT_SUFFIX = " »»» ";
    public static final String CONTINUATION_PROMPT = "    -> ";

    static final String CLUSTER_REQUIRED = "the cluster_name cannot be empty, if you need to execute the ["
            + StatementVerb.describeAllowed() + "] sql command, please log in to the cluster in advance by running "
            + "[login -c {clusterName}]. Otherwise, run the [help] command to view.";

    private final Console console;
    private final StatementBuffer buffer = new StatementBuffer();
    private DispatchState state = DispatchState.IDLE;

    public CliDispatcher(Console console) {
        this.console = console;
    }

    /**
     * Reads and processes lines until <code>exit</code>, <code>quit</code> or
     * the end of input.
     *
     * @return the exit status of the console
     * @throws IOException if the history file can not be written
     */
    public int run() throws IOException {
        LineConsole lineConsole = console.getLineConsole();
        while(true) {
            InputEvent event = lineConsole.read(getPrompt());
            if(process(event) == Action.EXIT) {
                return 0;
            }
        }
    }

    public Action process(InputEvent event) throws IOException {
        switch(event.getKind()) {
            case END_OF_INPUT:
                return Action.EXIT;
            case INTERRUPT:
                if(state == DispatchState.BUFFERING) {
                    resetBuffer();
                } else {
                    console.getLog().printInfo("Type 'exit' or 'quit' to leave the console");
                }
                return Action.CONTINUE;
            case READ_ERROR:
                console.getLog().printError("Read line error: " + event.getError().getMessage(), event.getError());
                return Action.CONTINUE;
            case LINE:
            default:
                return processLine(event.getLine());
        }
    }

    public DispatchState getState() {
        return state;
    }

    public String getPrompt() {
        if(state == DispatchState.BUFFERING) {
            return CONTINUATION_PROMPT;
        }
        TidbaConf conf = console.getConf();
        String prompt = conf.getVar(ConfVars.CLIPROMPT);
        if(!TidbaConf.getBoolVar(conf, ConfVars.CLIPRINTCURRENTDB)) {
            return prompt + PROMPT_SUFFIX;
        }
        SessionContext session = console.getSession();
        String cluster = session.getClusterName();
        if(cluster.isEmpty()) {
            return prompt + PROMPT_SUFFIX;
        }
        String schema = session.getSchemaName();
        return prompt + "[" + cluster + (schema.isEmpty() ? "" : "(" + schema + ")") + "]" + PROMPT_SUFFIX;
    }

    private Action processLine(String rawLine) throws IOException {
        String line = rawLine.trim();
        if(line.isEmpty()) {
            return Action.CONTINUE;
        }

        // recognised in any state, a pending statement is kept by clear and help
        String lower = line.toLowerCase();
        if(lower.equals("exit") || lower.equals("quit")) {
            console.getLog().getOutStream().println("Bye!");
            return Action.EXIT;
        }
        if(lower.equals("clear")) {
            console.getLineConsole().clearScreen();
            console.getHistory().add(line);
            return Action.CONTINUE;
        }
        if(lower.equals("help")) {
            console.newCommandTree().execute("help");
            console.getHistory().add(line);
            return Action.CONTINUE;
        }

        if(state == DispatchState.IDLE) {
            CommandTree commandTree = console.newCommandTree();
            String first = StatementVerb.firstToken(line);
            if(commandTree.isCommand(first)) {
                runCommand(commandTree, line);
                return Action.CONTINUE;
            }
            String stripped = CommentStripper.strip(line);
            if(stripped.isEmpty()) {
                // comment only
                return Action.CONTINUE;
            }
            if(!isStatementStart(StatementVerb.firstToken(stripped))) {
                runCommand(commandTree, line);
                return Action.CONTINUE;
            }
        }

        buffer.append(line);
        state = DispatchState.BUFFERING;
        if(line.endsWith(";") || line.endsWith("\\G")) {
            flush();
        }
        return Action.CONTINUE;
    }

    private static boolean isStatementStart(String token) {
        return StatementVerb.isAllowedVerb(token) || token.startsWith(";") || token.startsWith("\\G");
    }

    private void runCommand(CommandTree commandTree, String line) throws IOException {
        String[] args;
        try {
            args = ShellWords.parse(line);
        } catch(ShellWords.ParseException e) {
            console.getLog().printError("Parse command line error: " + e.getMessage());
            return;
        }
        commandTree.execute(args);
        console.getHistory().add(line);
    }

    private void flush() throws IOException {
        List<StatementGroup> groups = DelimiterSplitter.split(CommentStripper.strip(buffer.joined()));
        if(!DelimiterSplitter.containsTerminator(groups)) {
            // the terminator was commented out or quoted, wait for more input
            return;
        }
        console.getHistory().add(buffer.joinedForHistory());
        resetBuffer();

        if(!console.getSession().isLoggedIn()) {
            console.getLog().printError(CLUSTER_REQUIRED);
            return;
        }
        dispatch(groups);
    }

    private void resetBuffer() {
        buffer.clear();
        state = DispatchState.IDLE;
    }

    private void dispatch(List<StatementGroup> groups) {
        ConsoleLog log = console.getLog();
        CancellationToken token = new CancellationToken();
        try(InterruptScope ignored = InterruptScope.install(token, log)) {
            for(StatementGroup group : groups) {
                if(!group.isExecutable()) {
                    log.printInfo("Ignored the unterminated statement [" + group.getText() + "]");
                    continue;
                }
                if(group.isEmpty()) {
                    log.printError("ERROR: No query specified");
                    continue;
                }
                StatementVerb verb = StatementVerb.of(group.getText());
                if(!verb.isAllowed()) {
                    log.printError("ERROR: for security reasons only [" + StatementVerb.describeAllowed()
                            + "] sql statements can be executed, got [" + StatementVerb.firstToken(group.getText())
                            + "]");
                    continue;
                }
                try {
                    if(verb == StatementVerb.USE) {
                        executeUse(token, group);
                    } else {
                        executeQuery(token, group);
                    }
                } catch(SQLException | CancellationToken.CancelledException e) {
                    log.printError("Execute query failed!\n\nquery statement:\n" + group + "\n\nquery error content:\n"
                            + e.getMessage(), e);
                    return;
                }
            }
        }
    }

    private void executeUse(final CancellationToken token, StatementGroup group) throws SQLException {
        final String sql = group.getText();
        console.getSession().withConnection(console.getRegistry(),
                new SessionContext.ConnectionCallback<Void, SQLException>() {
                    @Override
                    public Void call(ClusterConnection connection) throws SQLException {
                        connection.execute(token, sql);
                        return null;
                    }
                });
        console.getSession().changeSchema(schemaOf(sql));
        console.getLog().getOutStream().println("Database changed");
    }

    private void executeQuery(final CancellationToken token, StatementGroup group) throws SQLException {
        final String sql = group.getText();
        Stopwatch watch = Stopwatch.createStarted();
        QueryResult result = console.getSession().withConnection(console.getRegistry(),
                new SessionContext.ConnectionCallback<QueryResult, SQLException>() {
                    @Override
                    public QueryResult call(ClusterConnection connection) throws SQLException {
                        return connection.query(token, sql);
                    }
                });
        double seconds = watch.elapsed(TimeUnit.MILLISECONDS) / 1000.0;
        if(group.isVertical()) {
            console.getPrinter().printVertical(result, seconds);
        } else {
            console.getPrinter().printTable(result, seconds);
        }
    }

    /**
     * Schema named by a <code>USE</code> statement, without quoting.
     */
    static String schemaOf(String useStatement) {
        String[] tokens = StringUtils.split(CommentStripper.strip(useStatement));
        if(tokens == null || tokens.length < 2) {
            return "";
        }
        return StringUtils.strip(tokens[1], "`\"'");
    }
}
