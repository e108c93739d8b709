/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HeaderMatchCondition(
                                   String name,
                                   boolean present,
                                   boolean notpresent,
                                   @Nullable String contains,
                                   @Nullable String notcontains,
                                   @Nullable String exact,
                                   @Nullable String notexact,
                                   @Nullable String prefix,
                                   @Nullable String suffix,
                                   @Nullable String regex,
                                   boolean ignoreCase,
                                   boolean treatMissingAsEmpty) {}
