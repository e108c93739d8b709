/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.util.Objects;

import io.routegraph.dag.cache.ObjectCacheView;
import io.routegraph.kubernetes.api.gateway.ReferenceGrant;
import io.routegraph.kubernetes.api.gateway.ReferenceGrantFrom;
import io.routegraph.kubernetes.api.gateway.ReferenceGrantTo;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Decides whether a cross-namespace reference is permitted by a ReferenceGrant in the target namespace.
 */
final class ReferenceGrants {

    static final String GATEWAY_GROUP = "gateway.networking.k8s.io";
    static final String CORE_GROUP = "";

    private ReferenceGrants() {
    }

    /**
     * References within one namespace are always permitted.
     * @param cache the objects
     * @param fromGroup the group of the referencing kind
     * @param fromKind the referencing kind
     * @param fromNamespace the referencing namespace
     * @param toGroup the group of the referenced kind
     * @param toKind the referenced kind
     * @param toNamespace the referenced namespace
     * @param toName the referenced name
     * @return whether the reference is permitted
     */
    static boolean permits(ObjectCacheView cache, String fromGroup, String fromKind, String fromNamespace,
                           String toGroup, String toKind, String toNamespace, String toName) {
        if (fromNamespace.equals(toNamespace)) {
            return true;
        }
        for (ReferenceGrant grant : cache.referenceGrants(toNamespace)) {
            if (grant.getSpec() == null) {
                continue;
            }
            boolean fromMatches = grant.getSpec().from().stream().anyMatch(from -> matches(from, fromGroup, fromKind, fromNamespace));
            boolean toMatches = grant.getSpec().to().stream().anyMatch(to -> matches(to, toGroup, toKind, toName));
            if (fromMatches && toMatches) {
                return true;
            }
        }
        return false;
    }

    private static boolean matches(ReferenceGrantFrom from, String group, String kind, String namespace) {
        return group(from.group()).equals(group) && from.kind().equals(kind) && from.namespace().equals(namespace);
    }

    private static boolean matches(ReferenceGrantTo to, String group, String kind, String name) {
        return group(to.group()).equals(group) && to.kind().equals(kind) && (to.name() == null || to.name().isEmpty() || Objects.equals(to.name(), name));
    }

    private static String group(@Nullable String group) {
        return group == null ? CORE_GROUP : group;
    }
}
