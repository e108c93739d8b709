/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;

import static io.micrometer.core.instrument.Metrics.globalRegistry;

/**
 * The meters published by the graph builder, all registered with the Micrometer global registry.
 */
public class Metrics {

    public static final String KIND_LABEL = "kind";

    private static final String DAG_REBUILD_METER_NAME = "routegraph_dag_rebuild";
    private static final String DAG_REBUILD_FAILURES_METER_NAME = "routegraph_dag_rebuild_failures";
    private static final String STATUS_WRITE_FAILURES_METER_NAME = "routegraph_status_write_failures";

    private Metrics() {
    }

    public static Timer rebuildTimer() {
        return Timer.builder(DAG_REBUILD_METER_NAME)
                .description("Time taken to build a routing graph snapshot")
                .register(globalRegistry);
    }

    public static Counter rebuildFailureCounter() {
        return Counter.builder(DAG_REBUILD_FAILURES_METER_NAME)
                .description("Builds abandoned because of a defect in the builder")
                .register(globalRegistry);
    }

    public static Counter statusWriteFailureCounter(String kind) {
        return Counter.builder(STATUS_WRITE_FAILURES_METER_NAME)
                .description("Status updates that could not be written after all attempts")
                .tag(KIND_LABEL, kind)
                .register(globalRegistry);
    }
}
