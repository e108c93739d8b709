/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A weighted binding of a route or TCP proxy to a backend service, with the per-backend policies.
 *
 * @param service the backend
 * @param weight relative weight, zero meaning no traffic unless all weights are zero
 * @param protocol upstream protocol: {@code h2}, {@code h2c}, {@code tls} or empty for HTTP/1.1
 * @param upstreamValidation how the backend's certificate is validated
 * @param loadBalancerStrategy the load balancing strategy
 * @param healthCheck active health checking
 * @param requestHeaders request header mutations for this backend
 * @param responseHeaders response header mutations for this backend
 */
public record Cluster(Service service,
                      int weight,
                      String protocol,
                      @Nullable PeerValidation upstreamValidation,
                      LoadBalancerStrategy loadBalancerStrategy,
                      @Nullable HealthCheck healthCheck,
                      HeadersPolicy requestHeaders,
                      HeadersPolicy responseHeaders) {

    public static Cluster of(Service service, int weight) {
        return new Cluster(service, weight, "", null, LoadBalancerStrategy.ROUND_ROBIN, null, HeadersPolicy.EMPTY, HeadersPolicy.EMPTY);
    }
}
