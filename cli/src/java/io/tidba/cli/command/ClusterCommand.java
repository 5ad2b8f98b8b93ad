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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import io.tidba.cli.Console;
import io.tidba.ql.jdbc.QueryResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(name = "cluster", description = "Inspect the configured clusters.",
        subcommands = {ClusterCommand.ListCommand.class})
public class ClusterCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    @Command(name = "list", description = "List the configured clusters, '*' marks the logged in one.")
    public static class ListCommand extends ConsoleCommand {

        @Override
        public Integer call() {
            Console console = console();
            String active = console.getSession().getClusterName();
            List<Map<String, String>> rows = new ArrayList<Map<String, String>>();
            for(String name : console.getRegistry().getClusterNames()) {
                Map<String, String> row = new LinkedHashMap<String, String>();
                row.put("Cluster", name);
                row.put("Active", name.equals(active) ? "*" : "");
                rows.add(row);
            }
            console.getPrinter().printTable(new QueryResult(ImmutableList.of("Cluster", "Active"), rows), 0);
            return 0;
        }
    }
}
