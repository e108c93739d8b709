/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A reference to a backend, by default a core {@code Service} in the route's namespace.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackendRef(
                         @Nullable String group,
                         @Nullable String kind,
                         String name,
                         @Nullable String namespace,
                         @Nullable Integer port,
                         @Nullable Integer weight) {}
