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
 * The desired state of an {@link HTTPProxy}.
 * <p>An HTTPProxy with a {@code virtualhost} is a root. Others are only reachable by inclusion.</p>
 *
 * @param virtualhost the virtual host, for roots only
 * @param routes the routes declared directly by this proxy
 * @param includes the proxies whose routes are included, with the conditions prepended to them
 * @param tcpproxy the TCP proxy configuration, for TLS virtual hosts
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HTTPProxySpec(
                            @Nullable VirtualHost virtualhost,
                            List<Route> routes,
                            List<Include> includes,
                            @Nullable TCPProxy tcpproxy) {

    public HTTPProxySpec {
        routes = routes == null ? List.of() : List.copyOf(routes);
        includes = includes == null ? List.of() : List.copyOf(includes);
    }
}
