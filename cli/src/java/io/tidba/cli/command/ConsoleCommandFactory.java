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

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;

import io.tidba.cli.Console;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * picocli factory that hands the console to every {@link ConsoleCommand}.
 */
public class ConsoleCommandFactory implements IFactory {

    private final IFactory delegate = CommandLine.defaultFactory();
    private final Supplier<Console> console;

    public ConsoleCommandFactory(Supplier<Console> console) {
        this.console = Preconditions.checkNotNull(console, "console");
    }

    @Override
    public <K> K create(Class<K> cls) throws Exception {
        K obj = delegate.create(cls);
        if(obj instanceof ConsoleCommand) {
            ((ConsoleCommand) obj).bind(console);
        }
        return obj;
    }
}
