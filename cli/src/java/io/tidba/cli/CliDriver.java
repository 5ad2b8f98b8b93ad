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

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import io.tidba.cli.command.ClusterCommand;
import io.tidba.cli.command.CommandTree;
import io.tidba.cli.command.ConsoleCommandFactory;
import io.tidba.cli.command.KillCommand;
import io.tidba.ql.conf.TidbaConf;
import io.tidba.ql.conf.TidbaConf.ConfVars;
import io.tidba.ql.jdbc.DefaultConnectionRegistry;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * CliDriver.
 */
@Command(name = "tidba",
        description = "TiDB operator console. Without a command the interactive console is started.",
        versionProvider = CliDriver.VersionProvider.class,
        subcommands = {HelpCommand.class, ClusterCommand.class, KillCommand.class})
public class CliDriver implements Callable<Integer> {

    public static final String LOG_CONFIG_FILE = "tidba-log4j2.properties";
    public static final String LOG_DIR_PROPERTY = "tidba.log.dir";

    @Option(names = {"-M", "--metadata-dir"}, paramLabel = "<dir>",
            description = "metadata directory holding tidba-site.properties and the history file (default: ~/.tidba)")
    String metadataDir;

    @Option(names = {"-c", "--cluster"}, paramLabel = "<clusterName>",
            description = "cluster to log in to on start")
    String clusterName;

    @Option(names = {"-d", "--disable-interactive"},
            description = "do not start the interactive console, print this help instead")
    boolean disableInteractive;

    @Option(names = "--conf", paramLabel = "<property=value>",
            description = "override a configuration property, e.g. --conf tidba.kill.concurrency=10")
    Map<String, String> overrides;

    @Option(names = {"-v", "--version"}, versionHelp = true, description = "print version information and exit")
    boolean versionRequested;

    @Option(names = {"-h", "--help"}, usageHelp = true, description = "print this help and exit")
    boolean helpRequested;

    @Spec
    CommandSpec spec;

    private final ConsoleLog console;
    private Console activeConsole;

    private final Supplier<Console> batchConsole = Suppliers.memoize(new Supplier<Console>() {
        @Override
        public Console get() {
            TidbaConf conf;
            try {
                conf = loadConf();
            } catch(IOException e) {
                throw new IllegalStateException("Failed to load the site configuration: " + e.getMessage(), e);
            }
            return openConsole(conf, null, null);
        }
    });

    public CliDriver() {
        this(System.out, System.err);
    }

    @VisibleForTesting
    CliDriver(PrintStream out, PrintStream err) {
        Logger LOG = LoggerFactory.getLogger("CliDriver");
        console = new ConsoleLog(LOG, out, out, err);
    }

    public static void main(String[] args) {
        if(System.getProperty("log4j2.configurationFile") == null) {
            System.setProperty("log4j2.configurationFile", LOG_CONFIG_FILE);
        }
        if(System.getProperty(LOG_DIR_PROPERTY) == null) {
            System.setProperty(LOG_DIR_PROPERTY, System.getProperty("user.home") + File.separator + ".tidba"
                    + File.separator + "logs");
        }
        int ret = new CliDriver().run(args);
        System.exit(ret);
    }

    /**
     * Parses the arguments and either runs the given command once or starts
     * the interactive console.
     *
     * @return process exit status
     */
    public int run(String[] args) {
        CommandLine commandLine = new CommandLine(this, new ConsoleCommandFactory(batchConsole));
        CommandTree.configure(commandLine, console);
        try {
            return commandLine.execute(args);
        } finally {
            closeConsole();
        }
    }

    @Override
    public Integer call() throws IOException {
        if(disableInteractive) {
            spec.commandLine().usage(spec.commandLine().getOut());
            return 0;
        }
        TidbaConf conf = loadConf();
        File historyFile = new File(conf.getMetadataDir(), conf.getVar(ConfVars.CLI_HISTORY_FILE));
        JLineConsole reader = JLineConsole.open(historyFile, CommandTree.interactiveCommandNames());
        return runInteractive(conf, reader, reader);
    }

    /**
     * Runs the console on an already loaded configuration until the operator
     * leaves.
     */
    @VisibleForTesting
    int runInteractive(TidbaConf conf, LineConsole lineConsole, ConsoleHistory history) throws IOException {
        Console interactive = openConsole(conf, lineConsole, history);
        printBanner(interactive);
        int ret = new CliDispatcher(interactive).run();
        closeConsole();
        return ret;
    }

    @VisibleForTesting
    TidbaConf loadConf() throws IOException {
        TidbaConf conf = new TidbaConf();
        if(metadataDir != null) {
            conf.setVar(ConfVars.METADATA_DIR, metadataDir);
        }
        conf.loadSiteFile();
        if(overrides != null) {
            for(Map.Entry<String, String> entry : overrides.entrySet()) {
                conf.set(entry.getKey(), entry.getValue());
            }
        }
        return conf;
    }

    private Console openConsole(TidbaConf conf, LineConsole lineConsole, ConsoleHistory history) {
        Console created = new Console(conf, new DefaultConnectionRegistry(conf), lineConsole, history, console);
        if(clusterName != null && !clusterName.trim().isEmpty()) {
            created.getSession().login(clusterName);
        }
        activeConsole = created;
        return created;
    }

    private void printBanner(Console interactive) {
        console.getInfoStream().println("Welcome to the TiDBA console. Type [help] to list the commands, "
                + "[exit] or [quit] to leave.");
        if(interactive.getSession().isLoggedIn()
                && !interactive.getRegistry().isRegistered(interactive.getSession().getClusterName())) {
            console.printError("WARNING: cluster [" + interactive.getSession().getClusterName()
                    + "] is not configured, statements will fail until you log in to a configured cluster.");
        }
    }

    private void closeConsole() {
        if(activeConsole == null) {
            return;
        }
        try {
            activeConsole.close();
        } catch(IOException e) {
            console.printError("WARNING: Failed to close the console: " + e.getMessage(), e);
        } finally {
            activeConsole = null;
        }
    }

    static class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = CliDriver.class.getPackage().getImplementationVersion();
            return new String[]{"tidba " + (version == null ? "(development build)" : version)};
        }
    }
}
