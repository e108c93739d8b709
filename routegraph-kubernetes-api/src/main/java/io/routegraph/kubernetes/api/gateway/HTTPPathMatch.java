/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param type {@code Exact}, {@code PathPrefix} or {@code RegularExpression}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HTTPPathMatch(@Nullable String type, @Nullable String value) {}
