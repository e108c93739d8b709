/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * gRPC routing rules attached to gateway listeners.
 */
@Group("gateway.networking.k8s.io")
@Version("v1")
public class GRPCRoute extends CustomResource<GRPCRouteSpec, RouteStatus> implements Namespaced {
}
