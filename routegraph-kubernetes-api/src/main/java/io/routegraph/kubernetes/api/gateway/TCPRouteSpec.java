/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TCPRouteSpec(List<ParentReference> parentRefs, List<BackendRouteRule> rules) {

    public TCPRouteSpec {
        parentRefs = parentRefs == null ? List.of() : List.copyOf(parentRefs);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }
}
