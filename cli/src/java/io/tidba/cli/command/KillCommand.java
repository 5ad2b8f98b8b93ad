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

import java.util.List;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import io.tidba.ql.exec.CancellationToken;
import io.tidba.ql.kill.KillPredicate;
import io.tidba.ql.kill.KillSessionException;
import io.tidba.ql.kill.KillSummary;
import io.tidba.ql.kill.SessionKillService;

@Command(name = "kill", description = "Repeatedly kill the sessions matching a predicate on every tidb instance.",
        subcommands = {KillCommand.SqlCommand.class, KillCommand.UserCommand.class})
public class KillCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "sql", description = "Kill the sessions running statements with the given sql digests.")
    public static class SqlCommand extends AbstractKillCommand {

        @Option(names = "--digest", required = true, split = ",", paramLabel = "<digest>",
                description = "comma separated sql digests, see information_schema.cluster_statements_summary")
        List<String> digests;

        @Override
        protected KillPredicate predicate() {
            return KillPredicate.digests(digests);
        }

        @Override
        protected KillSummary kill(SessionKillService service, CancellationToken token, String cluster,
                                   int duration, int interval, int concurrency) throws KillSessionException {
            return service.killByDigest(token, cluster, digests, duration, interval, concurrency);
        }
    }

    @Command(name = "user", description = "Kill the sessions of the given users.")
    public static class UserCommand extends AbstractKillCommand {

        @Option(names = "--username", required = true, split = ",", paramLabel = "<username>",
                description = "comma separated user names")
        List<String> usernames;

        @Override
        protected KillPredicate predicate() {
            return KillPredicate.usernames(usernames);
        }

        @Override
        protected KillSummary kill(SessionKillService service, CancellationToken token, String cluster,
                                   int duration, int interval, int concurrency) throws KillSessionException {
            return service.killByUsername(token, cluster, usernames, duration, interval, concurrency);
        }
    }
}
