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

import io.tidba.cli.Console;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

@Command(name = "login", description = "Log in to a configured cluster; sql statements run against it.")
public class LoginCommand extends ConsoleCommand {

    @Option(names = {"-c", "--cluster"}, required = true, paramLabel = "<clusterName>",
            description = "name of a cluster configured with tidba.cluster.<clusterName>.* properties")
    String clusterName;

    @Override
    public Integer call() {
        Console console = console();
        String name = clusterName.trim();
        if(!console.getRegistry().isRegistered(name)) {
            throw new ParameterException(spec.commandLine(), "the cluster name [" + name
                    + "] is not registered, run [cluster list] to view the configured clusters");
        }
        console.getSession().login(name);
        console.getLog().printInfo("Login cluster [" + name + "] success");
        return 0;
    }
}
