/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Durations use the {@code 1h2m3s4ms} form; {@code infinity} disables the timeout.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimeoutPolicy(@Nullable String response, @Nullable String idle) {}
