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

import java.io.PrintStream;

import org.slf4j.Logger;

/**
 * Operator facing output. Everything printed is mirrored to the log file.
 */
public class ConsoleLog {

    private final Logger LOG;
    private final PrintStream out;
    private final PrintStream info;
    private final PrintStream err;

    public ConsoleLog(Logger LOG, PrintStream out, PrintStream info, PrintStream err) {
        this.LOG = LOG;
        this.out = out;
        this.info = info;
        this.err = err;
    }

    /**
     * Stream for query results and command output.
     */
    public PrintStream getOutStream() {
        return out;
    }

    public PrintStream getInfoStream() {
        return info;
    }

    public PrintStream getErrStream() {
        return err;
    }

    public void printInfo(String msg) {
        info.println(msg);
        LOG.info(msg);
    }

    public void printError(String error) {
        printError(error, null);
    }

    /**
     * Prints the error to the operator; the detail (usually a stack trace)
     * only goes to the log.
     */
    public void printError(String error, Throwable detail) {
        err.println(error);
        if(detail != null) {
            LOG.error(error, detail);
        } else {
            LOG.error(error);
        }
    }
}
