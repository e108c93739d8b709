/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A layer 4 route rule, forwarding to the weighted backends.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackendRouteRule(List<BackendRef> backendRefs) {

    public BackendRouteRule {
        backendRefs = backendRefs == null ? List.of() : List.copyOf(backendRefs);
    }
}
