/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.common;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One error or warning that contributes to a {@link DetailedCondition}.
 *
 * @param type the kind of problem, for example {@code IncludeError}
 * @param status {@code True} while the problem is present
 * @param reason a CamelCase programmatic identifier
 * @param message human readable detail
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubCondition(
                           String type,
                           String status,
                           String reason,
                           String message) {}
