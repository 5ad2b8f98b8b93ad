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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;

/**
 * Lines of a statement that is still being typed.
 */
public class StatementBuffer {

    private final List<String> lines = new ArrayList<String>();

    public void append(String line) {
        lines.add(line);
    }

    /**
     * Lines joined with newlines, so line comments end where the line ends.
     */
    public String joined() {
        return Joiner.on('\n').join(lines);
    }

    /**
     * Single line form recorded to the history file.
     */
    public String joinedForHistory() {
        return Joiner.on(' ').join(lines);
    }

    public void clear() {
        lines.clear();
    }
}
