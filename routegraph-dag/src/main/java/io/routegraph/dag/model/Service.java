/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.util.Comparator;

import io.routegraph.kubernetes.api.common.NamespacedName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A reference to a Kubernetes Service port. Endpoint membership is resolved outside the graph.
 *
 * @param name the Service
 * @param port the Service port number
 * @param portName the name of the port, if it has one
 * @param appProtocol the application protocol declared on the port
 */
public record Service(NamespacedName name, int port, @Nullable String portName, @Nullable String appProtocol) {

    public static final Comparator<Service> COMPARATOR = Comparator.comparing(Service::name, NamespacedName.COMPARATOR)
            .thenComparingInt(Service::port);

    @Override
    public String toString() {
        return name + ":" + port;
    }
}
