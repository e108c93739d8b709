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
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;

/**
 * Conditions computed for an Ingress.
 * <p>The Ingress status schema has nowhere to store conditions, so these are reported through the build result and
 * logs only.</p>
 */
public record IngressStatusUpdate(
                                  ObjectKey key,
                                  long generation,
                                  List<Condition> conditions)
        implements StatusUpdate {

    public IngressStatusUpdate {
        conditions = List.copyOf(conditions);
    }

    public Optional<Condition> condition(String type) {
        return conditions.stream().filter(c -> type.equals(c.getType())).findFirst();
    }

    @Override
    public Class<? extends HasMetadata> resourceType() {
        return Ingress.class;
    }

    @Override
    public boolean applyTo(HasMetadata live) {
        return false;
    }
}
