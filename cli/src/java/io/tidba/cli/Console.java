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
import java.io.IOException;

import com.google.common.base.Preconditions;

import io.tidba.cli.command.CommandTree;
import io.tidba.ql.conf.TidbaConf;
import io.tidba.ql.jdbc.ConnectionRegistry;
import io.tidba.ql.kill.SessionKillService;
import io.tidba.ql.session.SessionContext;

/**
 * Everything a console session works with. One instance is shared by the
 * dispatcher and every command it runs.
 */
public class Console implements Closeable {

    private final TidbaConf conf;
    private final SessionContext session;
    private final ConnectionRegistry registry;
    private final SessionKillService killService;
    private final LineConsole lineConsole;
    private final ConsoleHistory history;
    private final ConsoleLog log;
    private final ResultPrinter printer;

    /**
     * @param lineConsole null for a non-interactive run
     */
    public Console(TidbaConf conf, ConnectionRegistry registry, LineConsole lineConsole,
                   ConsoleHistory history, ConsoleLog log) {
        this.conf = Preconditions.checkNotNull(conf, "conf");
        this.registry = Preconditions.checkNotNull(registry, "registry");
        this.lineConsole = lineConsole;
        this.history = history == null ? ConsoleHistory.NONE : history;
        this.log = Preconditions.checkNotNull(log, "log");
        this.session = new SessionContext();
        this.killService = new SessionKillService(registry);
        this.printer = new ResultPrinter(log.getOutStream(), conf.getVar(TidbaConf.ConfVars.CLI_NULL_VALUE));
    }

    public TidbaConf getConf() {
        return conf;
    }

    public SessionContext getSession() {
        return session;
    }

    public ConnectionRegistry getRegistry() {
        return registry;
    }

    public SessionKillService getKillService() {
        return killService;
    }

    public LineConsole getLineConsole() {
        return lineConsole;
    }

    public ConsoleHistory getHistory() {
        return history;
    }

    public ConsoleLog getLog() {
        return log;
    }

    public ResultPrinter getPrinter() {
        return printer;
    }

    public boolean isInteractive() {
        return lineConsole != null;
    }

    /**
     * Builds the command tree for one line typed at the prompt.
     */
    public CommandTree newCommandTree() {
        return CommandTree.interactive(this);
    }

    @Override
    public void close() throws IOException {
        try {
            registry.close();
        } finally {
            if(lineConsole instanceof Closeable) {
                ((Closeable) lineConsole).close();
            }
        }
    }
}
