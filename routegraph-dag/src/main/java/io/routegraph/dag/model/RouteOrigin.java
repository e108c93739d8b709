/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.time.Instant;

import io.routegraph.kubernetes.api.common.NamespacedName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The object a route was declared by, used for status attribution and conflict tie-breaks.
 *
 * @param kind the kind of the declaring object
 * @param name the declaring object
 * @param creationTimestamp when the object was created, absent if the object does not say
 */
public record RouteOrigin(String kind, NamespacedName name, @Nullable Instant creationTimestamp) {

    @Override
    public String toString() {
        return kind + " " + name;
    }
}
