/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.CustomResource;

import io.routegraph.kubernetes.api.gateway.ParentReference;
import io.routegraph.kubernetes.api.gateway.RouteParentStatus;
import io.routegraph.kubernetes.api.gateway.RouteStatus;

/**
 * The status of a gateway route of any kind, one entry per parent reference.
 * <p>Parent entries written by other controllers are left untouched when applied.</p>
 */
public record RouteStatusUpdate(
                                ObjectKey key,
                                long generation,
                                Class<? extends HasMetadata> resourceType,
                                String controllerName,
                                List<RouteParentStatus> parents)
        implements StatusUpdate {

    public RouteStatusUpdate {
        parents = List.copyOf(parents);
    }

    public Optional<RouteParentStatus> parent(ParentReference parentRef) {
        return parents.stream().filter(p -> p.parentRef().equals(parentRef)).findFirst();
    }

    public Optional<Condition> condition(ParentReference parentRef, String type) {
        return parent(parentRef).flatMap(p -> p.conditions().stream().filter(c -> type.equals(c.getType())).findFirst());
    }

    @Override
    @SuppressWarnings("unchecked")
    public boolean applyTo(HasMetadata live) {
        CustomResource<?, RouteStatus> route = (CustomResource<?, RouteStatus>) live;
        List<RouteParentStatus> stored = route.getStatus() == null ? List.of() : route.getStatus().parents();
        List<RouteParentStatus> result = new ArrayList<>();
        stored.stream()
                .filter(p -> !controllerName.equals(p.controllerName()))
                .forEach(result::add);
        for (RouteParentStatus parent : parents) {
            List<Condition> storedConditions = stored.stream()
                    .filter(p -> controllerName.equals(p.controllerName()) && Objects.equals(parent.parentRef(), p.parentRef()))
                    .findFirst()
                    .map(RouteParentStatus::conditions)
                    .orElse(List.of());
            result.add(new RouteParentStatus(parent.parentRef(), controllerName, ConditionMerger.merge(storedConditions, parent.conditions())));
        }
        route.setStatus(new RouteStatus(result));
        return true;
    }
}
