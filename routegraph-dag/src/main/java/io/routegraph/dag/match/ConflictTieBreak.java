/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.time.Instant;
import java.util.Comparator;

import io.routegraph.dag.model.RouteOrigin;

/**
 * Decides between independently authored objects that produce the same effective configuration.
 * The oldest object wins. Objects created at the same instant are ordered by {@code namespace/name}.
 */
public final class ConflictTieBreak {

    /**
     * Orders origins so that the winner of a conflict comes first.
     * An origin without a creation timestamp loses to one that has one.
     */
    public static final Comparator<RouteOrigin> WINNER_FIRST = Comparator.comparing(RouteOrigin::creationTimestamp,
            Comparator.nullsLast(Instant::compareTo))
            .thenComparing(origin -> origin.name().toString())
            .thenComparing(RouteOrigin::kind);

    private ConflictTieBreak() {
    }

    public static RouteOrigin winner(RouteOrigin a, RouteOrigin b) {
        return WINNER_FIRST.compare(a, b) <= 0 ? a : b;
    }
}
