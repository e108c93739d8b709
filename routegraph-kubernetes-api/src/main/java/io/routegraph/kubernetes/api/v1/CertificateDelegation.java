/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Permits the secret to be referenced from the target namespaces. {@code *} matches every namespace.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CertificateDelegation(String secretName, List<String> targetNamespaces) {

    public CertificateDelegation {
        targetNamespaces = targetNamespaces == null ? List.of() : List.copyOf(targetNamespaces);
    }
}
