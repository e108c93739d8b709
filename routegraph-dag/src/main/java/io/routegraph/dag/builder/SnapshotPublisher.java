/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.builder;

import io.routegraph.dag.model.Dag;

/**
 * Receives each snapshot once it is complete. Translating it for the data plane is the publisher's business.
 */
@FunctionalInterface
public interface SnapshotPublisher {

    void publish(Dag dag);
}
