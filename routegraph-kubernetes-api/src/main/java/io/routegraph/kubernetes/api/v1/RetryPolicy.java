/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RetryPolicy(
                          @Nullable Integer count,
                          @Nullable String perTryTimeout,
                          List<String> retryOn,
                          List<Integer> retriableStatusCodes) {

    public RetryPolicy {
        retryOn = retryOn == null ? List.of() : List.copyOf(retryOn);
        retriableStatusCodes = retriableStatusCodes == null ? List.of() : List.copyOf(retriableStatusCodes);
    }
}
