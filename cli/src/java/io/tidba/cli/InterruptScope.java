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

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.tidba.ql.exec.CancellationToken;
import sun.misc.Signal;
import sun.misc.SignalHandler;

/**
 * Routes Ctrl+C and SIGTERM to a {@link CancellationToken} while a statement
 * or a kill loop runs. A second Ctrl+C kills the JVM. Closing the scope puts
 * the previous handlers back.
 */
public final class InterruptScope implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(InterruptScope.class);

    private static final String[] SIGNALS = {"INT", "TERM"};

    private final Map<Signal, SignalHandler> previous = new LinkedHashMap<Signal, SignalHandler>();

    private InterruptScope() {
    }

    public static InterruptScope install(final CancellationToken token, final ConsoleLog console) {
        InterruptScope scope = new InterruptScope();
        SignalHandler handler = new SignalHandler() {
            private boolean interruptRequested;

            @Override
            public void handle(Signal signal) {
                boolean initialRequest = !interruptRequested;
                interruptRequested = true;

                // Kill the VM on second ctrl+c
                if(!initialRequest) {
                    console.printInfo("Exiting the JVM");
                    System.exit(127);
                }

                console.printInfo("Interrupting... waiting for the running statements to be cancelled.");
                console.printInfo("Press Ctrl+C again to kill JVM");
                token.cancel(CancellationToken.Reason.INTERRUPTED);
            }
        };
        for(String name : SIGNALS) {
            try {
                Signal signal = new Signal(name);
                scope.previous.put(signal, Signal.handle(signal, handler));
            } catch(IllegalArgumentException e) {
                // e.g. the JVM runs with -Xrs or the platform lacks the signal
                LOG.debug("Unable to handle signal SIG{}, it will not cancel the operation", name, e);
            }
        }
        return scope;
    }

    @Override
    public void close() {
        for(Map.Entry<Signal, SignalHandler> entry : previous.entrySet()) {
            Signal.handle(entry.getKey(), entry.getValue());
        }
        previous.clear();
    }
}
