/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.Comparator;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.routegraph.dag.ResourcesUtil;
import io.routegraph.kubernetes.api.common.NamespacedName;

/**
 * The identity of a source object that conditions are attached to.
 */
public record ObjectKey(String kind, NamespacedName name) implements Comparable<ObjectKey> {

    private static final Comparator<ObjectKey> COMPARATOR = Comparator.comparing(ObjectKey::kind)
            .thenComparing(ObjectKey::name, NamespacedName.COMPARATOR);

    public static ObjectKey of(HasMetadata resource) {
        return new ObjectKey(ResourcesUtil.kind(resource), ResourcesUtil.namespacedName(resource));
    }

    @Override
    public int compareTo(ObjectKey o) {
        return COMPARATOR.compare(this, o);
    }

    @Override
    public String toString() {
        return kind + " " + name;
    }
}
