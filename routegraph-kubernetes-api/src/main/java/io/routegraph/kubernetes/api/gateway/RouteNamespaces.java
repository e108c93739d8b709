/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.LabelSelector;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param from {@code Same}, {@code All} or {@code Selector}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RouteNamespaces(@Nullable String from, @Nullable LabelSelector selector) {}
