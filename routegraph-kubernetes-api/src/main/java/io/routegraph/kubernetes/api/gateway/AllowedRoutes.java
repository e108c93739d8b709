/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AllowedRoutes(@Nullable RouteNamespaces namespaces, List<RouteGroupKind> kinds) {

    public AllowedRoutes {
        kinds = kinds == null ? List.of() : List.copyOf(kinds);
    }
}
