/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.routegraph.kubernetes.api.common.DetailedCondition;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param currentStatus one of {@code valid}, {@code invalid} or {@code orphaned}
 * @param description a one line summary
 * @param conditions the detailed conditions
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HTTPProxyStatus(
                              @Nullable String currentStatus,
                              @Nullable String description,
                              List<DetailedCondition> conditions) {

    public HTTPProxyStatus {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
