/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.common;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A condition that carries the individual errors and warnings which led to its status.
 * <p>Used on {@code HTTPProxy} status, where a single {@code Valid} condition summarises any number of
 * independently detected problems.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetailedCondition(
                                String type,
                                String status,
                                @Nullable Long observedGeneration,
                                @Nullable String lastTransitionTime,
                                String reason,
                                String message,
                                List<SubCondition> errors,
                                List<SubCondition> warnings) {

    public DetailedCondition {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
