/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param fqdn the fully qualified domain name of the virtual host, optionally {@code *.}-prefixed
 * @param tls the TLS configuration
 * @param authorization the external authorization server protecting this virtual host
 * @param rateLimitPolicy the rate limit policy applied to every route
 * @param disableRouteSorting when true routes are emitted in declaration order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VirtualHost(
                          @Nullable String fqdn,
                          @Nullable TLS tls,
                          @Nullable AuthorizationServer authorization,
                          @Nullable RateLimitPolicy rateLimitPolicy,
                          boolean disableRouteSorting) {}
