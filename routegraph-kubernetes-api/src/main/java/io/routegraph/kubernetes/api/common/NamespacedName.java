/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.common;

import java.util.Comparator;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Identifies a namespaced object by namespace and name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NamespacedName(String namespace, String name) {

    public static final Comparator<NamespacedName> COMPARATOR = Comparator.comparing(NamespacedName::namespace)
            .thenComparing(NamespacedName::name);

    public NamespacedName {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
    }

    /**
     * Parses a reference of the form {@code namespace/name}, or just {@code name} relative to the given namespace.
     * @param defaultNamespace the namespace used when the reference carries none
     * @param reference the reference
     * @return the name
     */
    public static NamespacedName parse(String defaultNamespace, String reference) {
        int slash = reference.indexOf('/');
        if (slash < 0) {
            return new NamespacedName(defaultNamespace, reference);
        }
        return new NamespacedName(reference.substring(0, slash), reference.substring(slash + 1));
    }

    @JsonIgnore
    public boolean isBlank() {
        return namespace.isBlank() || name.isBlank();
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
