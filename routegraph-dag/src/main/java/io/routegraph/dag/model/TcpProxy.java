/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.util.List;

public record TcpProxy(List<Cluster> clusters) {
    public TcpProxy {
        clusters = List.copyOf(clusters);
    }
}
