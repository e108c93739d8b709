/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryParameterMatchCondition(
                                           String name,
                                           @Nullable String exact,
                                           @Nullable String prefix,
                                           @Nullable String suffix,
                                           @Nullable String regex,
                                           @Nullable String contains,
                                           boolean present,
                                           boolean ignoreCase) {}
