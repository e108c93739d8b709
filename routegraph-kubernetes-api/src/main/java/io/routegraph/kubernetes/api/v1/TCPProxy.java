/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param services the backends, when the TCP proxy is defined here
 * @param include another HTTPProxy whose TCP proxy is used instead
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TCPProxy(List<BackendService> services, @Nullable TCPProxyInclude include) {

    public TCPProxy {
        services = services == null ? List.of() : List.copyOf(services);
    }
}
