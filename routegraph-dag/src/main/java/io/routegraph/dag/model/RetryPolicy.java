/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.time.Duration;
import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

public record RetryPolicy(List<String> retryOn,
                          int numRetries,
                          @Nullable Duration perTryTimeout,
                          List<Integer> retriableStatusCodes) {

    public RetryPolicy {
        retryOn = List.copyOf(retryOn);
        retriableStatusCodes = List.copyOf(retriableStatusCodes);
    }
}
