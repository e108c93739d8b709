/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Names the gateway, and optionally the listener, a route attaches to.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParentReference(
                              @Nullable String group,
                              @Nullable String kind,
                              @Nullable String namespace,
                              String name,
                              @Nullable String sectionName,
                              @Nullable Integer port) {}
