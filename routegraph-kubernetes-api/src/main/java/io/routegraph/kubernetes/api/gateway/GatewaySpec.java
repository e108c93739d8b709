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
public record GatewaySpec(@Nullable String gatewayClassName, List<Listener> listeners) {

    public GatewaySpec {
        listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }
}
