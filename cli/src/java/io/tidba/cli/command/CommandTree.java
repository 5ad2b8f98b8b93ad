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


package io.tidba.cli.command;

import java.io.PrintWriter;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.lang.StringUtils;

import com.google.common.base.Suppliers;

import io.tidba.cli.Console;
import io.tidba.cli.ConsoleLog;
import io.tidba.ql.parse.StatementVerb;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.IParameterExceptionHandler;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParseResult;

/**
 * The administrative commands, looked up by their first word. A tree is built
 * for every command line so no option value leaks into the next run.
 */
public class CommandTree {

    public static final String ERROR_PREFIX = "Execute command error: ";

    private final CommandLine commandLine;
    private final ConsoleLog log;

    public CommandTree(CommandLine commandLine, ConsoleLog log) {
        this.commandLine = commandLine;
        this.log = log;
        configure(commandLine, log);
    }

    /**
     * Tree of the commands available at the interactive prompt.
     */
    public static CommandTree interactive(Console console) {
        CommandLine commandLine = new CommandLine(ReplCommand.class,
                new ConsoleCommandFactory(Suppliers.ofInstance(console)));
        return new CommandTree(commandLine, console.getLog());
    }

    /**
     * Sends picocli output to the console streams and reports failures with
     * the {@value #ERROR_PREFIX} prefix.
     */
    public static void configure(CommandLine commandLine, final ConsoleLog log) {
        commandLine.setOut(new PrintWriter(log.getOutStream(), true));
        commandLine.setErr(new PrintWriter(log.getErrStream(), true));
        commandLine.setExecutionExceptionHandler(new IExecutionExceptionHandler() {
            @Override
            public int handleExecutionException(Exception ex, CommandLine cmd, ParseResult parseResult) {
                log.printError(ERROR_PREFIX + ex.getMessage(), ex);
                return cmd.getCommandSpec().exitCodeOnExecutionException();
            }
        });
        commandLine.setParameterExceptionHandler(new IParameterExceptionHandler() {
            @Override
            public int handleParseException(ParameterException ex, String[] args) {
                CommandLine cmd = ex.getCommandLine();
                log.printError(ERROR_PREFIX + ex.getMessage());
                cmd.usage(cmd.getErr());
                return cmd.getCommandSpec().exitCodeOnInvalidInput();
            }
        });
    }

    /**
     * Names of the interactive commands, for tab completion.
     */
    public static Set<String> interactiveCommandNames() {
        return Collections.unmodifiableSet(new TreeSet<String>(new CommandLine(new ReplCommand()).getSubcommands().keySet()));
    }

    public boolean isCommand(String name) {
        return StringUtils.isNotEmpty(name) && commandLine.getSubcommands().containsKey(name);
    }

    public Set<String> getCommandNames() {
        return Collections.unmodifiableSet(new TreeSet<String>(commandLine.getSubcommands().keySet()));
    }

    /**
     * Runs the command named by the first word.
     *
     * @return the command's exit code, non-zero when it failed
     */
    public int execute(String... args) {
        if(args.length == 0) {
            return 0;
        }
        if(!isCommand(args[0])) {
            log.printError(ERROR_PREFIX + "unknown command [" + args[0] + "] for [" + commandLine.getCommandName()
                    + "], sql statements must start with [" + StatementVerb.describeAllowed()
                    + "], run the [help] command to view the available commands");
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        return commandLine.execute(args);
    }

    CommandLine getCommandLine() {
        return commandLine;
    }
}
