/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A single condition. Exactly one of the members is expected to be set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchCondition(
                             @Nullable String prefix,
                             @Nullable String exact,
                             @Nullable String regex,
                             @Nullable HeaderMatchCondition header,
                             @Nullable QueryParameterMatchCondition queryParameter) {}
