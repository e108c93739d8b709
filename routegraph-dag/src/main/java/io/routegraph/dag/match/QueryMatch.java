/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A predicate on one query parameter. It holds when any value of the parameter matches.
 */
public record QueryMatch(String name, StringMatchType type, @Nullable String value, boolean ignoreCase) {

    public static final Comparator<QueryMatch> CANONICAL_ORDER = Comparator.comparing(QueryMatch::toString);

    public QueryMatch {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
    }

    public static QueryMatch of(String name, StringMatchType type, @Nullable String value) {
        return new QueryMatch(name, type, value, false);
    }

    public boolean matches(Map<String, List<String>> queryParameters) {
        List<String> values = queryParameters.get(name);
        if (values == null) {
            return false;
        }
        return values.stream().anyMatch(v -> type.evaluate(v, value, ignoreCase));
    }

    @Override
    public String toString() {
        return "query: " + name + " " + type.name().toLowerCase(Locale.ROOT) + (value == null ? "" : " " + value) + (ignoreCase ? " (ignoreCase)" : "");
    }
}
