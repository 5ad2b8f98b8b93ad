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

import org.apache.commons.lang.StringUtils;

import io.tidba.cli.Console;
import io.tidba.cli.InterruptScope;
import io.tidba.ql.conf.TidbaConf;
import io.tidba.ql.conf.TidbaConf.ConfVars;
import io.tidba.ql.exec.CancellationToken;
import io.tidba.ql.jdbc.ClusterConnection;
import io.tidba.ql.kill.KillOptions;
import io.tidba.ql.kill.KillPredicate;
import io.tidba.ql.kill.KillSessionException;
import io.tidba.ql.kill.KillSummary;
import io.tidba.ql.kill.SessionKillService;
import io.tidba.ql.session.SessionContext;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

/**
 * Options and flow shared by the kill subcommands. On the logged in cluster
 * the session's connection is borrowed; any other cluster is reached through
 * the registry.
 */
public abstract class AbstractKillCommand extends ConsoleCommand {

    @Option(names = {"-c", "--cluster"}, paramLabel = "<clusterName>",
            description = "cluster to kill sessions on, defaults to the logged in cluster")
    String clusterName;

    @Option(names = "--duration", paramLabel = "<seconds>", defaultValue = "0",
            description = "stop after this many seconds, 0 keeps killing until Ctrl+C (default: ${DEFAULT-VALUE})")
    int durationSeconds;

    @Option(names = "--interval", paramLabel = "<millis>",
            description = "sleep between two kill rounds, in milliseconds (default: tidba.kill.interval.ms)")
    Integer intervalMillis;

    @Option(names = "--concurrency", paramLabel = "<n>",
            description = "sessions killed in parallel within a round (default: tidba.kill.concurrency)")
    Integer concurrency;

    protected abstract KillPredicate predicate();

    protected abstract KillSummary kill(SessionKillService service, CancellationToken token, String cluster,
                                        int duration, int interval, int concurrency) throws KillSessionException;

    @Override
    public Integer call() throws Exception {
        final Console console = console();
        SessionContext session = console.getSession();
        TidbaConf conf = console.getConf();

        String cluster = StringUtils.isBlank(clusterName) ? session.getClusterName() : clusterName.trim();
        if(cluster.isEmpty()) {
            throw new ParameterException(spec.commandLine(),
                    "the cluster_name cannot be empty, required flag(s) -c {clusterName} not set");
        }
        final int interval = intervalMillis != null ? intervalMillis
                : TidbaConf.getIntVar(conf, ConfVars.KILL_INTERVAL_MS);
        final int parallel = concurrency != null ? concurrency
                : TidbaConf.getIntVar(conf, ConfVars.KILL_CONCURRENCY);

        final KillPredicate predicate;
        final KillOptions options;
        try {
            predicate = predicate();
            options = KillOptions.fromFlags(durationSeconds, interval, parallel);
        } catch(IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        console.getLog().printInfo("Start killing the sessions of " + predicate + " on cluster [" + cluster
                + "] (" + options + "), press Ctrl+C to stop");
        final CancellationToken token = new CancellationToken();
        KillSummary summary;
        try(InterruptScope ignored = InterruptScope.install(token, console.getLog())) {
            if(cluster.equals(session.getClusterName())) {
                final SessionKillService service = console.getKillService();
                summary = session.withConnection(console.getRegistry(),
                        new SessionContext.ConnectionCallback<KillSummary, KillSessionException>() {
                            @Override
                            public KillSummary call(ClusterConnection connection) throws KillSessionException {
                                return service.kill(token, connection, predicate, options);
                            }
                        });
            } else {
                summary = kill(console.getKillService(), token, cluster, durationSeconds, interval, parallel);
            }
        }
        console.getLog().printInfo("Kill " + predicate + " on cluster [" + cluster + "] " + summary);
        return 0;
    }
}
