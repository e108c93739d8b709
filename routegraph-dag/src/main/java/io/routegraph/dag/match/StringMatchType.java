/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.util.Locale;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The ways a header or query parameter value can be matched.
 */
public enum StringMatchType {
    EXACT,
    PREFIX,
    SUFFIX,
    CONTAINS,
    REGEX,
    PRESENT;

    boolean evaluate(String candidate, @Nullable String expected, boolean ignoreCase) {
        if (this == PRESENT) {
            return true;
        }
        if (expected == null) {
            return false;
        }
        if (this == REGEX) {
            return Regexes.compile(ignoreCase ? "(?i)" + expected : expected).matcher(candidate).matches();
        }
        String c = ignoreCase ? candidate.toLowerCase(Locale.ROOT) : candidate;
        String e = ignoreCase ? expected.toLowerCase(Locale.ROOT) : expected;
        return switch (this) {
            case EXACT -> c.equals(e);
            case PREFIX -> c.startsWith(e);
            case SUFFIX -> c.endsWith(e);
            case CONTAINS -> c.contains(e);
            default -> throw new IllegalStateException("Unexpected match type " + this);
        };
    }
}
