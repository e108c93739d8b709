/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param local a token bucket local to each proxy instance
 * @param globalDescriptors descriptors sent to the global rate limit service, absent when global limiting is off
 */
public record RateLimitPolicy(@Nullable LocalRateLimit local, @Nullable List<String> globalDescriptors) {

    public record LocalRateLimit(int requests, String unit, int burst) {}

    public RateLimitPolicy {
        globalDescriptors = globalDescriptors == null ? null : List.copyOf(globalDescriptors);
    }

    public boolean isEmpty() {
        return local == null && globalDescriptors == null;
    }
}
