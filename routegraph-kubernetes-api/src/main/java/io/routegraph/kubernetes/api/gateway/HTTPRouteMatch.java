/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A missing path is treated as a {@code PathPrefix} of {@code /}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HTTPRouteMatch(
                             @Nullable HTTPPathMatch path,
                             List<HTTPHeaderMatch> headers,
                             List<HTTPQueryParamMatch> queryParams,
                             @Nullable String method) {

    public HTTPRouteMatch {
        headers = headers == null ? List.of() : List.copyOf(headers);
        queryParams = queryParams == null ? List.of() : List.copyOf(queryParams);
    }
}
