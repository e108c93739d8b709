/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.Condition;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GatewayStatus(List<Condition> conditions, List<ListenerStatus> listeners) {

    public GatewayStatus {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }
}
