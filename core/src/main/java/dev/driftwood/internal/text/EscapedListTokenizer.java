/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.driftwood.internal.text;

import java.util.ArrayList;
import java.util.List;

import dev.driftwood.FormatException;

/**
 * Splits a line into tokens on any of a set of delimiter characters.
 * <p>
 * A backslash escapes the following backslash, quote or delimiter character ({@code \n}
 * yields a newline); any other escape is rejected. Delimiters inside double quotes do not
 * split, and the quotes themselves are not part of the token. A line always produces at
 * least one token, and a trailing delimiter produces a trailing empty token.
 * </p>
 */
public final class EscapedListTokenizer {

    private static final char ESCAPE = '\\';
    private static final char QUOTE = '"';

    private final String delimiters;

    public EscapedListTokenizer(String delimiters) {
        if (delimiters == null || delimiters.isEmpty()) {
            throw new IllegalArgumentException("At least one delimiter character must be specified");
        }
        this.delimiters = delimiters;
    }

    public List<String> tokenize(CharSequence line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        boolean inQuote = false;

        int length = line.length();
        for (int i = 0; i < length; i++) {
            char c = line.charAt(i);
            if (c == ESCAPE) {
                if (i + 1 >= length) {
                    throw new FormatException("Escape character at end of line: " + line);
                }
                char escaped = line.charAt(++i);
                if (escaped == 'n') {
                    token.append('\n');
                }
                else if (escaped == ESCAPE || escaped == QUOTE || isDelimiter(escaped)) {
                    token.append(escaped);
                }
                else {
                    throw new FormatException("Unknown escape sequence '\\" + escaped + "' in line: " + line);
                }
            }
            else if (c == QUOTE) {
                inQuote = !inQuote;
            }
            else if (!inQuote && isDelimiter(c)) {
                tokens.add(token.toString());
                token.setLength(0);
            }
            else {
                token.append(c);
            }
        }
        tokens.add(token.toString());
        return tokens;
    }

    private boolean isDelimiter(char c) {
        return delimiters.indexOf(c) >= 0;
    }
}
