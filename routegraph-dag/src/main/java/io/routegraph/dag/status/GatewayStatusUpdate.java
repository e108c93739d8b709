/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.List;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.HasMetadata;

import io.routegraph.kubernetes.api.gateway.Gateway;
import io.routegraph.kubernetes.api.gateway.GatewayStatus;
import io.routegraph.kubernetes.api.gateway.ListenerStatus;

/**
 * The status of the managed Gateway and its listeners.
 */
public record GatewayStatusUpdate(
                                  ObjectKey key,
                                  long generation,
                                  List<Condition> conditions,
                                  List<ListenerStatus> listeners)
        implements StatusUpdate {

    public GatewayStatusUpdate {
        conditions = List.copyOf(conditions);
        listeners = List.copyOf(listeners);
    }

    public Optional<ListenerStatus> listener(String name) {
        return listeners.stream().filter(l -> l.name().equals(name)).findFirst();
    }

    @Override
    public Class<? extends HasMetadata> resourceType() {
        return Gateway.class;
    }

    @Override
    public boolean applyTo(HasMetadata live) {
        Gateway gateway = (Gateway) live;
        GatewayStatus stored = gateway.getStatus();
        List<Condition> mergedConditions = ConditionMerger.merge(stored == null ? List.of() : stored.conditions(), conditions);
        List<ListenerStatus> mergedListeners = listeners.stream()
                .map(l -> {
                    List<Condition> storedListenerConditions = stored == null ? List.of()
                            : stored.listeners().stream()
                                    .filter(s -> s.name().equals(l.name()))
                                    .findFirst()
                                    .map(ListenerStatus::conditions)
                                    .orElse(List.of());
                    return new ListenerStatus(l.name(), l.supportedKinds(), l.attachedRoutes(), ConditionMerger.merge(storedListenerConditions, l.conditions()));
                })
                .toList();
        gateway.setStatus(new GatewayStatus(mergedConditions, mergedListeners));
        return true;
    }
}
