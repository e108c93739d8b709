/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.routegraph.dag.model.Route;
import io.routegraph.dag.model.RouteOrigin;
import io.routegraph.kubernetes.api.common.NamespacedName;

import static org.assertj.core.api.Assertions.assertThat;

class RouteOrderingTest {

    private static final RouteOrigin ORIGIN = new RouteOrigin("HTTPProxy", new NamespacedName("default", "proxy"), Instant.EPOCH);

    @Test
    void exactBeforeRegexBeforePrefix() {
        List<Route> sorted = RouteOrdering.sort(List.of(
                route(RouteMatch.of(PathMatch.prefix("/a"))),
                route(RouteMatch.of(PathMatch.regex("/a.*"))),
                route(RouteMatch.of(PathMatch.exact("/a")))));

        assertThat(sorted).extracting(r -> r.match().path().type())
                .containsExactly(PathMatch.Type.EXACT, PathMatch.Type.REGEX, PathMatch.Type.PREFIX);
    }

    @Test
    void longerPrefixFirst() {
        List<Route> sorted = RouteOrdering.sort(List.of(
                route(RouteMatch.of(PathMatch.ROOT)),
                route(RouteMatch.of(PathMatch.prefix("/api/v1"))),
                route(RouteMatch.of(PathMatch.prefix("/api")))));

        assertThat(sorted).extracting(r -> r.match().path().value())
                .containsExactly("/api/v1", "/api", "/");
    }

    @Test
    void moreSpecificPredicatesFirstForSamePath() {
        RouteMatch plain = RouteMatch.of(PathMatch.prefix("/api"));
        RouteMatch withHeader = plain.withHeaders(List.of(HeaderMatch.of("x-a", StringMatchType.PRESENT, null)));
        RouteMatch withMethod = new RouteMatch(PathMatch.prefix("/api"), List.of(), List.of(), "GET");

        List<Route> sorted = RouteOrdering.sort(List.of(route(plain), route(withHeader), route(withMethod)));

        assertThat(sorted).extracting(Route::match).containsExactly(withMethod, withHeader, plain);
    }

    @Test
    void methodMatchPrecedesLongerPaths() {
        RouteMatch longWithHeader = RouteMatch.of(PathMatch.prefix("/api/v1/users"))
                .withHeaders(List.of(HeaderMatch.of("x-a", StringMatchType.PRESENT, null)));
        RouteMatch longPlain = RouteMatch.of(PathMatch.prefix("/api/v1"));
        RouteMatch shortWithMethod = new RouteMatch(PathMatch.prefix("/a"), List.of(), List.of(), "POST");

        List<Route> sorted = RouteOrdering.sort(List.of(route(longPlain), route(longWithHeader), route(shortWithMethod)));

        assertThat(sorted).extracting(Route::match).containsExactly(shortWithMethod, longWithHeader, longPlain);
    }

    @Test
    void exactStillPrecedesPrefixWithMethod() {
        RouteMatch exact = RouteMatch.of(PathMatch.exact("/a"));
        RouteMatch prefixWithMethod = new RouteMatch(PathMatch.prefix("/a"), List.of(), List.of(), "GET");

        assertThat(RouteOrdering.sort(List.of(route(prefixWithMethod), route(exact)))).extracting(Route::match).containsExactly(exact, prefixWithMethod);
    }

    @Test
    void orderDoesNotDependOnInput() {
        List<Route> routes = List.of(
                route(RouteMatch.of(PathMatch.prefix("/b"))),
                route(RouteMatch.of(PathMatch.prefix("/a"))),
                route(RouteMatch.of(PathMatch.stringPrefix("/a"))));

        assertThat(RouteOrdering.sort(routes)).isEqualTo(RouteOrdering.sort(List.of(routes.get(2), routes.get(0), routes.get(1))));
    }

    private static Route route(RouteMatch match) {
        return Route.builder(match, ORIGIN).build();
    }
}
