/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import io.routegraph.dag.model.RouteOrigin;
import io.routegraph.kubernetes.api.common.NamespacedName;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictTieBreakTest {

    private static final Instant OLDER = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant NEWER = Instant.parse("2024-06-01T00:00:00Z");

    @Test
    void olderObjectWins() {
        RouteOrigin older = new RouteOrigin("Ingress", new NamespacedName("z", "z"), OLDER);
        RouteOrigin newer = new RouteOrigin("HTTPProxy", new NamespacedName("a", "a"), NEWER);

        assertThat(ConflictTieBreak.winner(newer, older)).isSameAs(older);
        assertThat(ConflictTieBreak.winner(older, newer)).isSameAs(older);
    }

    @Test
    void missingTimestampLoses() {
        RouteOrigin unknown = new RouteOrigin("HTTPProxy", new NamespacedName("a", "a"), null);
        RouteOrigin known = new RouteOrigin("HTTPProxy", new NamespacedName("b", "b"), NEWER);

        assertThat(ConflictTieBreak.winner(unknown, known)).isSameAs(known);
    }

    @Test
    void sameTimestampFallsBackToName() {
        RouteOrigin a = new RouteOrigin("HTTPRoute", new NamespacedName("default", "a"), OLDER);
        RouteOrigin b = new RouteOrigin("HTTPRoute", new NamespacedName("default", "b"), OLDER);

        assertThat(ConflictTieBreak.winner(b, a)).isSameAs(a);
    }

    @Test
    void sameNameFallsBackToKind() {
        RouteOrigin proxy = new RouteOrigin("HTTPProxy", new NamespacedName("default", "a"), OLDER);
        RouteOrigin route = new RouteOrigin("HTTPRoute", new NamespacedName("default", "a"), OLDER);

        assertThat(ConflictTieBreak.winner(route, proxy)).isSameAs(proxy);
    }
}
