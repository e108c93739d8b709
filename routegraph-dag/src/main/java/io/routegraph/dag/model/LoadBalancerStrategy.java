/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.util.Arrays;

import edu.umd.cs.findbugs.annotations.Nullable;

public enum LoadBalancerStrategy {
    ROUND_ROBIN("RoundRobin"),
    WEIGHTED_LEAST_REQUEST("WeightedLeastRequest"),
    RANDOM("Random"),
    REQUEST_HASH("RequestHash"),
    COOKIE("Cookie");

    private final String value;

    LoadBalancerStrategy(String value) {
        this.value = value;
    }

    /**
     * Unknown or absent strategies fall back to round robin.
     * @param value the strategy name as declared
     * @return the strategy
     */
    public static LoadBalancerStrategy fromValue(@Nullable String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst()
                .orElse(ROUND_ROBIN);
    }

    public String value() {
        return value;
    }
}
