/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Estimates the size of the program a regular expression compiles to, following the instruction counts of an
 * RE2 style compiler: one instruction per literal or character class, one split per alternation or repetition
 * operator, two per capture, and counted repetitions expanded in full.
 * <p>The input is expected to have compiled already; this does not report syntax errors.</p>
 */
final class RegexProgramSize {

    // match and fail instructions present in every program
    private static final long BASE_SIZE = 2;
    private static final int MAX_REPEAT = 1000;

    private final String regex;
    private int pos;

    private RegexProgramSize(String regex) {
        this.regex = regex;
    }

    static long estimate(String regex) {
        var estimator = new RegexProgramSize(regex);
        long size = estimator.alternation();
        // unbalanced closing parentheses are left to the compiler to reject
        while (estimator.pos < regex.length()) {
            estimator.pos++;
            size += estimator.alternation();
        }
        return BASE_SIZE + size;
    }

    private boolean atEnd() {
        return pos >= regex.length();
    }

    private char peek() {
        return regex.charAt(pos);
    }

    private long alternation() {
        long size = concatenation();
        while (!atEnd() && peek() == '|') {
            pos++;
            size += concatenation() + 1;
        }
        return size;
    }

    private long concatenation() {
        long size = 0;
        while (!atEnd() && peek() != '|' && peek() != ')') {
            size += repetition(atom());
        }
        return size;
    }

    private long atom() {
        char c = regex.charAt(pos++);
        switch (c) {
            case '(':
                return group();
            case '[':
                skipCharacterClass();
                return 1;
            case '\\':
                skipEscape();
                return 1;
            default:
                return 1;
        }
    }

    private long group() {
        boolean capturing = true;
        if (!atEnd() && peek() == '?') {
            pos++;
            if (!atEnd() && peek() == 'P') {
                // named capture (?P<name>...)
                skipPast('>');
            }
            else if (!atEnd() && peek() == '<') {
                skipPast('>');
            }
            else {
                // flags, either (?i) on their own or (?i:...)
                capturing = false;
                while (!atEnd() && peek() != ')' && peek() != ':') {
                    pos++;
                }
                if (!atEnd() && peek() == ')') {
                    pos++;
                    return 0;
                }
                pos++;
            }
        }
        long inner = alternation();
        if (!atEnd() && peek() == ')') {
            pos++;
        }
        return capturing ? inner + 2 : inner;
    }

    private void skipPast(char terminator) {
        while (!atEnd() && regex.charAt(pos++) != terminator) {
            // consume
        }
    }

    private void skipCharacterClass() {
        if (!atEnd() && peek() == '^') {
            pos++;
        }
        if (!atEnd() && peek() == ']') {
            pos++;
        }
        while (!atEnd() && peek() != ']') {
            if (peek() == '\\') {
                pos++;
                skipEscape();
            }
            else if (peek() == '[' && pos + 1 < regex.length() && regex.charAt(pos + 1) == ':') {
                // [:alpha:]
                pos = Math.max(regex.indexOf(":]", pos + 2) + 2, pos + 1);
            }
            else {
                pos++;
            }
        }
        if (!atEnd()) {
            pos++;
        }
    }

    private void skipEscape() {
        if (atEnd()) {
            return;
        }
        char c = regex.charAt(pos++);
        if ((c == 'p' || c == 'P' || c == 'x') && !atEnd() && peek() == '{') {
            skipPast('}');
        }
        else if (c == 'x') {
            pos = Math.min(pos + 2, regex.length());
        }
    }

    private long repetition(long atomSize) {
        long size = atomSize;
        while (!atEnd()) {
            char c = peek();
            if (c == '*' || c == '+' || c == '?') {
                pos++;
                size = size + 1;
            }
            else if (c == '{') {
                int[] bounds = counted();
                if (bounds == null) {
                    return size;
                }
                size = expand(size, bounds[0], bounds[1]);
            }
            else {
                return size;
            }
            if (!atEnd() && peek() == '?') {
                // non-greedy modifier
                pos++;
            }
        }
        return size;
    }

    private static long expand(long size, int min, int max) {
        if (max < 0) {
            // {n,} is n copies followed by a star
            return size * Math.max(min, 1) + 1;
        }
        return size * max + (max - min);
    }

    /**
     * Parses {@code {n}}, {@code {n,}} or {@code {n,m}} at the current position.
     * @return the bounds with -1 meaning unbounded, or null (leaving the position unchanged) if this is a literal brace
     */
    @Nullable
    private int[] counted() {
        int close = regex.indexOf('}', pos);
        if (close < 0) {
            return null;
        }
        String body = regex.substring(pos + 1, close);
        if (!body.matches("\\d{1,4}(,\\d{0,4})?")) {
            return null;
        }
        pos = close + 1;
        int comma = body.indexOf(',');
        if (comma < 0) {
            int n = Math.min(Integer.parseInt(body), MAX_REPEAT);
            return new int[]{ n, n };
        }
        int min = Math.min(Integer.parseInt(body.substring(0, comma)), MAX_REPEAT);
        String upper = body.substring(comma + 1);
        int max = upper.isEmpty() ? -1 : Math.min(Integer.parseInt(upper), MAX_REPEAT);
        return new int[]{ min, max };
    }
}
