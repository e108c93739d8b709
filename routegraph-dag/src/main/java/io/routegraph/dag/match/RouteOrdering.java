/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import io.routegraph.dag.model.Route;

/**
 * The evaluation order of the routes of one virtual host.
 * <ol>
 * <li>exact path matches, then regex, then prefix</li>
 * <li>routes matching on the HTTP method first, whatever the length of their match string</li>
 * <li>longer match strings first</li>
 * <li>more header predicates first, then more query predicates first</li>
 * <li>the match strings, then the predicate renderings, in ascending lexicographic order</li>
 * <li>finally the conflict tie-break of the declaring objects, so the order is total</li>
 * </ol>
 */
public final class RouteOrdering {

    public static final Comparator<RouteMatch> MATCH_ORDER = Comparator.<RouteMatch, PathMatch.Type> comparing(m -> m.path().type())
            .thenComparing(m -> m.method() == null)
            .thenComparing(m -> m.path().value().length(), Comparator.reverseOrder())
            .thenComparing(m -> m.headers().size(), Comparator.reverseOrder())
            .thenComparing(m -> m.queryParameters().size(), Comparator.reverseOrder())
            .thenComparing(m -> m.path().value())
            .thenComparing(m -> m.path().segmentPrefix())
            .thenComparing(RouteOrdering::predicates)
            .thenComparing(m -> m.method() == null ? "" : m.method());

    public static final Comparator<Route> ROUTE_ORDER = Comparator.comparing(Route::match, MATCH_ORDER)
            .thenComparing(Route::origin, ConflictTieBreak.WINNER_FIRST);

    private RouteOrdering() {
    }

    private static String predicates(RouteMatch match) {
        return match.headers().stream().map(HeaderMatch::toString).collect(Collectors.joining(","))
                + ";" + match.queryParameters().stream().map(QueryMatch::toString).collect(Collectors.joining(","));
    }

    public static List<Route> sort(List<Route> routes) {
        return routes.stream().sorted(ROUTE_ORDER).toList();
    }
}
