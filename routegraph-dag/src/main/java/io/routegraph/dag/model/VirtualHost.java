/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A hostname-scoped routing table on one listener.
 *
 * @param hostname the hostname, {@code *} for the catch-all, or a {@code *.}-prefixed wildcard
 * @param routes the routes in evaluation order
 * @param tls TLS settings, present on secure virtual hosts only
 * @param tcpProxy for TLS virtual hosts that forward the stream rather than routing HTTP
 * @param externalAuthorization the authorization server, if any
 * @param rateLimitPolicy the virtual host wide rate limit
 * @param filterOrder relative order of the authorization and rate limit filters
 * @param routesSorted false when routes are kept in declaration order
 */
public record VirtualHost(String hostname,
                          List<Route> routes,
                          @Nullable TlsContext tls,
                          @Nullable TcpProxy tcpProxy,
                          @Nullable ExternalAuthorization externalAuthorization,
                          @Nullable RateLimitPolicy rateLimitPolicy,
                          FilterOrder filterOrder,
                          boolean routesSorted) {

    public VirtualHost {
        routes = List.copyOf(routes);
    }

    public boolean isSecure() {
        return tls != null;
    }
}
