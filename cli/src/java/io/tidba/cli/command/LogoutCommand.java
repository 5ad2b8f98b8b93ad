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

@Command(name = "logout", description = "Log out of the current cluster.")
public class LogoutCommand extends ConsoleCommand {

    @Override
    public Integer call() {
        Console console = console();
        String cluster = console.getSession().getClusterName();
        if(cluster.isEmpty()) {
            console.getLog().printInfo("No cluster is logged in");
            return 0;
        }
        console.getSession().logout();
        console.getLog().printInfo("Logout cluster [" + cluster + "] success");
        return 0;
    }
}
