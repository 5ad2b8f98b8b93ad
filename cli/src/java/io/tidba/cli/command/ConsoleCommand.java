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

import java.util.concurrent.Callable;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;

import io.tidba.cli.Console;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Base of every command that works with the console. The console is bound by
 * {@link ConsoleCommandFactory} when picocli instantiates the command.
 */
public abstract class ConsoleCommand implements Callable<Integer> {

    @Spec
    protected CommandSpec spec;

    private Supplier<Console> console;

    void bind(Supplier<Console> console) {
        this.console = console;
    }

    protected Console console() {
        Preconditions.checkState(console != null, "command %s is not bound to a console", getClass().getSimpleName());
        return console.get();
    }
}
