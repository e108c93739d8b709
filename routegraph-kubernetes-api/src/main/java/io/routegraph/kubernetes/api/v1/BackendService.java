/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A Kubernetes Service that a route or TCP proxy sends traffic to.
 *
 * @param name the Service name, in the namespace of the HTTPProxy
 * @param port the Service port
 * @param weight the relative weight
 * @param mirror copy traffic to this service, discarding the responses
 * @param protocol {@code h2}, {@code h2c} or {@code tls}; otherwise taken from the port's appProtocol
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackendService(
                             String name,
                             int port,
                             @Nullable Integer weight,
                             boolean mirror,
                             @Nullable String protocol,
                             @Nullable UpstreamValidation validation,
                             @Nullable HeadersPolicy requestHeadersPolicy,
                             @Nullable HeadersPolicy responseHeadersPolicy) {}
