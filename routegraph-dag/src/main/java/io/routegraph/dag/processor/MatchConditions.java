/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

import io.routegraph.dag.match.HeaderMatch;
import io.routegraph.dag.match.PathMatch;
import io.routegraph.dag.match.QueryMatch;
import io.routegraph.dag.match.StringMatchType;
import io.routegraph.kubernetes.api.v1.HeaderMatchCondition;
import io.routegraph.kubernetes.api.v1.MatchCondition;
import io.routegraph.kubernetes.api.v1.QueryParameterMatchCondition;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Validation and combination of HTTPProxy match conditions.
 * <p>Conditions inherited through includes are ANDed with those of the including object: path prefixes are
 * concatenated on segment boundaries and header and query predicates accumulate.</p>
 */
final class MatchConditions {

    private MatchConditions() {
    }

    /**
     * An include may only carry a single prefix, which must start with a slash.
     * @return a description of the problem, or null
     */
    @Nullable
    static String includePathProblem(List<MatchCondition> conditions) {
        int prefixes = 0;
        for (MatchCondition condition : conditions) {
            if (condition.exact() != null || condition.regex() != null) {
                return "include conditions may only use prefix path matching";
            }
            if (condition.prefix() != null) {
                prefixes++;
                if (!condition.prefix().startsWith("/")) {
                    return "prefix conditions must start with /, " + condition.prefix() + " was supplied";
                }
            }
        }
        if (prefixes > 1) {
            return "more than one prefix is not allowed in a condition block";
        }
        return null;
    }

    /**
     * A route may carry at most one path condition of any kind.
     * @return a description of the problem, or null
     */
    @Nullable
    static String routePathProblem(List<MatchCondition> conditions) {
        int paths = 0;
        for (MatchCondition condition : conditions) {
            if (condition.prefix() != null) {
                paths++;
                if (!condition.prefix().startsWith("/")) {
                    return "prefix conditions must start with /, " + condition.prefix() + " was supplied";
                }
            }
            if (condition.exact() != null) {
                paths++;
                if (!condition.exact().startsWith("/")) {
                    return "exact conditions must start with /, " + condition.exact() + " was supplied";
                }
            }
            if (condition.regex() != null) {
                paths++;
            }
        }
        if (paths > 1) {
            return "more than one path condition is not allowed in a condition block";
        }
        return null;
    }

    /**
     * Detects header conditions that are malformed or can never all hold.
     * @return a description of the problem, or null
     */
    @Nullable
    static String headerProblem(List<MatchCondition> conditions) {
        Map<String, Set<String>> kindsByHeader = new HashMap<>();
        Map<String, Set<String>> exactValues = new HashMap<>();
        Map<String, Set<String>> notExactValues = new HashMap<>();
        Map<String, Set<String>> containsValues = new HashMap<>();
        Map<String, Set<String>> notContainsValues = new HashMap<>();
        for (MatchCondition condition : conditions) {
            HeaderMatchCondition header = condition.header();
            if (header == null) {
                continue;
            }
            if (header.name() == null || header.name().isEmpty()) {
                return "header conditions must name a header";
            }
            if (operatorCount(header) != 1) {
                return "header condition for \"" + header.name() + "\" must specify exactly one match operator";
            }
            String name = header.name().toLowerCase(Locale.ROOT);
            Set<String> kinds = kindsByHeader.computeIfAbsent(name, n -> new TreeSet<>());
            if (header.present()) {
                kinds.add("present");
            }
            if (header.notpresent()) {
                kinds.add("notpresent");
            }
            add(exactValues, name, header.exact());
            add(notExactValues, name, header.notexact());
            add(containsValues, name, header.contains());
            add(notContainsValues, name, header.notcontains());
        }
        for (Map.Entry<String, Set<String>> entry : kindsByHeader.entrySet()) {
            String name = entry.getKey();
            if (entry.getValue().containsAll(List.of("present", "notpresent"))) {
                return "cannot specify contradictory 'present' and 'notpresent' conditions for the same header \"" + name + "\"";
            }
            Set<String> exact = exactValues.getOrDefault(name, Set.of());
            if (exact.size() > 1) {
                return "cannot specify multiple 'exact' conditions with different values for the same header \"" + name + "\"";
            }
            if (exact.stream().anyMatch(notExactValues.getOrDefault(name, Set.of())::contains)) {
                return "cannot specify contradictory 'exact' and 'notexact' conditions for the same header \"" + name + "\" and value";
            }
            if (containsValues.getOrDefault(name, Set.of()).stream().anyMatch(notContainsValues.getOrDefault(name, Set.of())::contains)) {
                return "cannot specify contradictory 'contains' and 'notcontains' conditions for the same header \"" + name + "\" and value";
            }
        }
        return null;
    }

    /**
     * @return a description of the problem, or null
     */
    @Nullable
    static String queryProblem(List<MatchCondition> conditions) {
        for (MatchCondition condition : conditions) {
            QueryParameterMatchCondition query = condition.queryParameter();
            if (query == null) {
                continue;
            }
            if (query.name() == null || query.name().isEmpty()) {
                return "query parameter conditions must name a parameter";
            }
            long operators = Stream.of(query.exact(), query.prefix(), query.suffix(), query.regex(), query.contains()).filter(Objects::nonNull).count()
                    + (query.present() ? 1 : 0);
            if (operators != 1) {
                return "query parameter condition for \"" + query.name() + "\" must specify exactly one match operator";
            }
        }
        return null;
    }

    /**
     * @return every regular expression in the conditions
     */
    static List<String> regexes(List<MatchCondition> conditions) {
        List<String> result = new ArrayList<>();
        for (MatchCondition condition : conditions) {
            if (condition.regex() != null) {
                result.add(condition.regex());
            }
            if (condition.header() != null && condition.header().regex() != null) {
                result.add(condition.header().regex());
            }
            if (condition.queryParameter() != null && condition.queryParameter().regex() != null) {
                result.add(condition.queryParameter().regex());
            }
        }
        return result;
    }

    /**
     * Combines the path conditions of an inclusion chain into one effective match.
     * All but the last object in the chain contribute prefixes only.
     * @param conditions inherited conditions followed by the route's own
     * @return the effective path match
     */
    static PathMatch path(List<MatchCondition> conditions) {
        StringBuilder prefix = new StringBuilder();
        String exact = null;
        String regex = null;
        for (MatchCondition condition : conditions) {
            if (condition.prefix() != null) {
                prefix.append('/').append(condition.prefix());
            }
            if (condition.exact() != null) {
                exact = condition.exact();
            }
            if (condition.regex() != null) {
                regex = condition.regex();
            }
        }
        String joinedPrefix = normalise(prefix.toString());
        if (exact != null) {
            return PathMatch.exact(joinedPrefix.equals("/") ? exact : normalise(joinedPrefix + "/" + exact));
        }
        if (regex != null) {
            return PathMatch.regex(joinedPrefix.equals("/") ? regex : quoteMeta(joinedPrefix) + regex);
        }
        return PathMatch.prefix(joinedPrefix);
    }

    static List<HeaderMatch> headers(List<MatchCondition> conditions) {
        return conditions.stream()
                .map(MatchCondition::header)
                .filter(Objects::nonNull)
                .map(MatchConditions::header)
                .toList();
    }

    static List<QueryMatch> queryParameters(List<MatchCondition> conditions) {
        return conditions.stream()
                .map(MatchCondition::queryParameter)
                .filter(Objects::nonNull)
                .map(MatchConditions::query)
                .toList();
    }

    /**
     * A canonical rendering of an include's conditions, used to find includes that duplicate one another.
     * @return the rendering, or null if the conditions are empty or only match the root prefix
     */
    @Nullable
    static String duplicateKey(List<MatchCondition> conditions) {
        PathMatch path = path(conditions);
        List<HeaderMatch> headers = headers(conditions);
        List<QueryMatch> queries = queryParameters(conditions);
        if (path.isRootPrefix() && headers.isEmpty() && queries.isEmpty()) {
            return null;
        }
        TreeSet<String> parts = new TreeSet<>();
        headers.forEach(h -> parts.add(h.toString()));
        queries.forEach(q -> parts.add(q.toString()));
        return path + " " + parts;
    }

    static String quoteMeta(String literal) {
        StringBuilder quoted = new StringBuilder(literal.length());
        for (char c : literal.toCharArray()) {
            if ("\\.+*?()|[]{}^$".indexOf(c) >= 0) {
                quoted.append('\\');
            }
            quoted.append(c);
        }
        return quoted.toString();
    }

    private static String normalise(String path) {
        String collapsed = path.replaceAll("/{2,}", "/");
        if (collapsed.isEmpty()) {
            return "/";
        }
        if (collapsed.length() > 1 && collapsed.endsWith("/")) {
            return collapsed.substring(0, collapsed.length() - 1);
        }
        return collapsed;
    }

    private static HeaderMatch header(HeaderMatchCondition condition) {
        boolean ignoreCase = condition.ignoreCase();
        if (condition.present()) {
            return new HeaderMatch(condition.name(), StringMatchType.PRESENT, null, false, false, false);
        }
        if (condition.notpresent()) {
            return new HeaderMatch(condition.name(), StringMatchType.PRESENT, null, true, false, false);
        }
        if (condition.contains() != null) {
            return new HeaderMatch(condition.name(), StringMatchType.CONTAINS, condition.contains(), false, ignoreCase, false);
        }
        if (condition.notcontains() != null) {
            return new HeaderMatch(condition.name(), StringMatchType.CONTAINS, condition.notcontains(), true, ignoreCase, condition.treatMissingAsEmpty());
        }
        if (condition.exact() != null) {
            return new HeaderMatch(condition.name(), StringMatchType.EXACT, condition.exact(), false, ignoreCase, false);
        }
        if (condition.notexact() != null) {
            return new HeaderMatch(condition.name(), StringMatchType.EXACT, condition.notexact(), true, ignoreCase, condition.treatMissingAsEmpty());
        }
        if (condition.prefix() != null) {
            return new HeaderMatch(condition.name(), StringMatchType.PREFIX, condition.prefix(), false, ignoreCase, false);
        }
        if (condition.suffix() != null) {
            return new HeaderMatch(condition.name(), StringMatchType.SUFFIX, condition.suffix(), false, ignoreCase, false);
        }
        return new HeaderMatch(condition.name(), StringMatchType.REGEX, condition.regex(), false, ignoreCase, false);
    }

    private static QueryMatch query(QueryParameterMatchCondition condition) {
        boolean ignoreCase = condition.ignoreCase();
        if (condition.present()) {
            return new QueryMatch(condition.name(), StringMatchType.PRESENT, null, false);
        }
        if (condition.exact() != null) {
            return new QueryMatch(condition.name(), StringMatchType.EXACT, condition.exact(), ignoreCase);
        }
        if (condition.prefix() != null) {
            return new QueryMatch(condition.name(), StringMatchType.PREFIX, condition.prefix(), ignoreCase);
        }
        if (condition.suffix() != null) {
            return new QueryMatch(condition.name(), StringMatchType.SUFFIX, condition.suffix(), ignoreCase);
        }
        if (condition.contains() != null) {
            return new QueryMatch(condition.name(), StringMatchType.CONTAINS, condition.contains(), ignoreCase);
        }
        return new QueryMatch(condition.name(), StringMatchType.REGEX, condition.regex(), ignoreCase);
    }

    private static long operatorCount(HeaderMatchCondition header) {
        return Stream.of(header.contains(), header.notcontains(), header.exact(), header.notexact(), header.prefix(), header.suffix(), header.regex())
                .filter(Objects::nonNull)
                .count()
                + (header.present() ? 1 : 0)
                + (header.notpresent() ? 1 : 0);
    }

    private static void add(Map<String, Set<String>> values, String name, @Nullable String value) {
        if (value != null) {
            values.computeIfAbsent(name, n -> new TreeSet<>()).add(value);
        }
    }
}
