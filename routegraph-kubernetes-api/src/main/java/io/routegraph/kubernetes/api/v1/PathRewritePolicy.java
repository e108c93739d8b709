/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PathRewritePolicy(List<ReplacePrefix> replacePrefix) {

    public PathRewritePolicy {
        replacePrefix = replacePrefix == null ? List.of() : List.copyOf(replacePrefix);
    }
}
