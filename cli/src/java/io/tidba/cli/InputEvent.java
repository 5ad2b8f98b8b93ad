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

import com.google.common.base.Preconditions;

/**
 * One result of reading from the line console.
 */
public final class InputEvent {

    public enum Kind {
        LINE,
        END_OF_INPUT,
        INTERRUPT,
        READ_ERROR
    }

    private static final InputEvent END_OF_INPUT = new InputEvent(Kind.END_OF_INPUT, null, null);
    private static final InputEvent INTERRUPT = new InputEvent(Kind.INTERRUPT, null, null);

    private final Kind kind;
    private final String line;
    private final Throwable error;

    private InputEvent(Kind kind, String line, Throwable error) {
        this.kind = kind;
        this.line = line;
        this.error = error;
    }

    public static InputEvent line(String line) {
        return new InputEvent(Kind.LINE, Preconditions.checkNotNull(line, "line"), null);
    }

    public static InputEvent endOfInput() {
        return END_OF_INPUT;
    }

    public static InputEvent interrupt() {
        return INTERRUPT;
    }

    public static InputEvent readError(Throwable error) {
        return new InputEvent(Kind.READ_ERROR, null, Preconditions.checkNotNull(error, "error"));
    }

    public Kind getKind() {
        return kind;
    }

    public String getLine() {
        return line;
    }

    public Throwable getError() {
        return error;
    }

    @Override
    public String toString() {
        return kind == Kind.LINE ? kind + "[" + line + "]" : kind.toString();
    }
}
