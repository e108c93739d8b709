/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The complete, fully qualified match of a route: after inclusion, every inherited condition is already part of it.
 * Header and query predicates are held in canonical order so that two matches that differ only in declaration
 * order are equal.
 *
 * @param path the path match
 * @param headers header predicates, all of which must hold
 * @param queryParameters query parameter predicates, all of which must hold
 * @param method the HTTP method, if the route matches on it
 */
public record RouteMatch(PathMatch path, List<HeaderMatch> headers, List<QueryMatch> queryParameters, @Nullable String method) {

    public RouteMatch {
        Objects.requireNonNull(path);
        headers = headers.stream().distinct().sorted(HeaderMatch.CANONICAL_ORDER).toList();
        queryParameters = queryParameters.stream().distinct().sorted(QueryMatch.CANONICAL_ORDER).toList();
    }

    public static RouteMatch of(PathMatch path) {
        return new RouteMatch(path, List.of(), List.of(), null);
    }

    public RouteMatch withHeaders(List<HeaderMatch> additional) {
        return new RouteMatch(path, Stream.concat(headers.stream(), additional.stream()).toList(), queryParameters, method);
    }

    public boolean matches(MatchRequest request) {
        return path.matches(request.path())
                && (method == null || method.equals(request.method()))
                && headers.stream().allMatch(h -> h.matches(request.headers()))
                && queryParameters.stream().allMatch(q -> q.matches(request.queryParameters()));
    }

    /**
     * A canonical rendering of the match. Two routes with equal keys can never be told apart by a request.
     * @return the key
     */
    public String key() {
        return Stream.of(
                Stream.of(path.toString()),
                method == null ? Stream.<String> empty() : Stream.of("method: " + method),
                headers.stream().map(HeaderMatch::toString),
                queryParameters.stream().map(QueryMatch::toString))
                .flatMap(s -> s)
                .collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return key();
    }
}
