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

/**
 * Splits a command line into words the way a POSIX shell does: blanks
 * separate words, single quotes are literal, double quotes allow backslash
 * escapes, a backslash outside quotes escapes the next character.
 */
public final class ShellWords {

    public static class ParseException extends Exception {
        private static final long serialVersionUID = 1L;

        public ParseException(String message) {
            super(message);
        }
    }

    private ShellWords() {
    }

    public static String[] parse(String line) throws ParseException {
        List<String> words = new ArrayList<String>();
        StringBuilder word = new StringBuilder();
        boolean inWord = false;
        boolean insideSingleQuote = false;
        boolean insideDoubleQuote = false;
        boolean escape = false;

        for(int index = 0; index < line.length(); index++) {
            char c = line.charAt(index);
            if(escape) {
                word.append(c);
                escape = false;
                continue;
            }
            if(insideSingleQuote) {
                if(c == '\'') {
                    insideSingleQuote = false;
                } else {
                    word.append(c);
                }
                continue;
            }
            if(insideDoubleQuote) {
                if(c == '"') {
                    insideDoubleQuote = false;
                } else if(c == '\\' && index + 1 < line.length() && "\"\\$`".indexOf(line.charAt(index + 1)) >= 0) {
                    word.append(line.charAt(++index));
                } else {
                    word.append(c);
                }
                continue;
            }
            if(Character.isWhitespace(c)) {
                if(inWord) {
                    words.add(word.toString());
                    word.setLength(0);
                    inWord = false;
                }
                continue;
            }
            inWord = true;
            if(c == '\\') {
                escape = true;
            } else if(c == '\'') {
                insideSingleQuote = true;
            } else if(c == '"') {
                insideDoubleQuote = true;
            } else {
                word.append(c);
            }
        }

        if(escape) {
            throw new ParseException("invalid command line string, trailing backslash");
        }
        if(insideSingleQuote || insideDoubleQuote) {
            throw new ParseException("invalid command line string, unterminated " + (insideSingleQuote ? "single" : "double") + " quote");
        }
        if(inWord) {
            words.add(word.toString());
        }
        return words.toArray(new String[0]);
    }
}
