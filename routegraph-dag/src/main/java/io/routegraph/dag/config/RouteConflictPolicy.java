/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.config;

import java.util.Comparator;
import java.util.List;

import io.routegraph.dag.match.ConflictTieBreak;
import io.routegraph.dag.model.RouteOrigin;

/**
 * How a collision between routes declared by objects of different kinds is decided.
 */
public enum RouteConflictPolicy {
    /**
     * The same rule as within one kind: the oldest object wins, then the smaller {@code namespace/name}.
     */
    OLDEST_WINS,
    /**
     * The object whose kind comes first in the configured schema priority wins. Objects of equal priority fall back
     * to {@link #OLDEST_WINS}.
     */
    SCHEMA_PRIORITY;

    /**
     * @param schemaPriority kinds in decreasing priority, used by {@link #SCHEMA_PRIORITY}
     * @return a comparator ordering the winning origin first
     */
    public Comparator<RouteOrigin> winnerFirst(List<String> schemaPriority) {
        if (this == OLDEST_WINS) {
            return ConflictTieBreak.WINNER_FIRST;
        }
        return Comparator.<RouteOrigin> comparingInt(origin -> {
            int index = schemaPriority.indexOf(origin.kind());
            return index < 0 ? Integer.MAX_VALUE : index;
        }).thenComparing(ConflictTieBreak.WINNER_FIRST);
    }
}
