/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.builder;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import io.routegraph.dag.model.Dag;

/**
 * Holds the most recently published snapshot for readers on other threads.
 * Nothing is available until the first snapshot, which is built only after the initial sync.
 */
public class LatestSnapshotHolder implements SnapshotPublisher {

    private final AtomicReference<Dag> latest = new AtomicReference<>();

    @Override
    public void publish(Dag dag) {
        latest.accumulateAndGet(dag, (current, candidate) -> current == null || candidate.version() > current.version() ? candidate : current);
    }

    public Optional<Dag> current() {
        return Optional.ofNullable(latest.get());
    }
}
