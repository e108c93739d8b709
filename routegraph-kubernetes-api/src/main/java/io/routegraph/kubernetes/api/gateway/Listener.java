/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param name unique within the gateway
 * @param hostname restricts the hosts served, optionally {@code *.}-prefixed
 * @param port the port
 * @param protocol {@code HTTP}, {@code HTTPS}, {@code TLS} or {@code TCP}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Listener(
                       String name,
                       @Nullable String hostname,
                       int port,
                       String protocol,
                       @Nullable GatewayTLSConfig tls,
                       @Nullable AllowedRoutes allowedRoutes) {}
