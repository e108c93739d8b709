/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.builder;

import java.util.List;

import io.routegraph.dag.model.Dag;
import io.routegraph.dag.status.StatusUpdate;

/**
 * The product of one successful build.
 *
 * @param dag the snapshot
 * @param statusUpdates the conditions of every object touched by the build, in object order
 */
public record BuildResult(Dag dag, List<StatusUpdate> statusUpdates) {

    public BuildResult {
        statusUpdates = List.copyOf(statusUpdates);
    }
}
