/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A predicate on one request header.
 * <p>Negative forms ({@code NotExact}, {@code NotContains}, {@code NotPresent}) are positive matches with {@code invert} set.
 * {@code treatMissingAsEmpty} only has meaning on an inverted match, where it makes an absent header match as though it
 * were present with an empty value.</p>
 *
 * @param name the header name, held in lower case
 * @param type how the value is matched
 * @param value the expected value, absent for {@link StringMatchType#PRESENT}
 * @param invert negate the result
 * @param ignoreCase compare case-insensitively
 * @param treatMissingAsEmpty evaluate an absent header as the empty string
 */
public record HeaderMatch(String name,
                          StringMatchType type,
                          @Nullable String value,
                          boolean invert,
                          boolean ignoreCase,
                          boolean treatMissingAsEmpty) {

    public static final Comparator<HeaderMatch> CANONICAL_ORDER = Comparator.comparing(HeaderMatch::toString);

    public HeaderMatch {
        name = Objects.requireNonNull(name).toLowerCase(Locale.ROOT);
        Objects.requireNonNull(type);
    }

    public static HeaderMatch of(String name, StringMatchType type, @Nullable String value) {
        return new HeaderMatch(name, type, value, false, false, false);
    }

    /**
     * @param headers request headers, keyed by lower case name
     * @return whether the predicate holds
     */
    public boolean matches(Map<String, String> headers) {
        String actual = headers.get(name);
        if (actual == null) {
            if (!treatMissingAsEmpty) {
                return invert;
            }
            actual = "";
        }
        return type.evaluate(actual, value, ignoreCase) != invert;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("header: ").append(name).append(' ');
        if (invert) {
            sb.append("not");
        }
        sb.append(type.name().toLowerCase(Locale.ROOT));
        if (value != null) {
            sb.append(' ').append(value);
        }
        if (ignoreCase) {
            sb.append(" (ignoreCase)");
        }
        if (treatMissingAsEmpty) {
            sb.append(" (treatMissingAsEmpty)");
        }
        return sb.toString();
    }
}
