/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Includes the routes of another HTTPProxy.
 *
 * @param name the included proxy
 * @param namespace the namespace of the included proxy, defaulting to that of the includer
 * @param conditions conditions ANDed onto every route of the included proxy
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Include(
                      String name,
                      @Nullable String namespace,
                      List<MatchCondition> conditions) {

    public Include {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
