/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.util.List;
import java.util.Optional;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A port the proxy binds.
 *
 * @param name unique listener name, for example {@code ingress_http} or {@code https-443}
 * @param address bind address
 * @param port the port the proxy binds
 * @param declaredPort the port as declared by the source object, which may differ from {@code port} for privileged ports
 * @param protocol the listener protocol
 * @param virtualHosts the virtual hosts, ordered by hostname
 * @param tcpProxy the single TCP target of a {@link Protocol#TCP} listener
 */
public record Listener(String name,
                       String address,
                       int port,
                       int declaredPort,
                       Protocol protocol,
                       List<VirtualHost> virtualHosts,
                       @Nullable TcpProxy tcpProxy) {

    public enum Protocol {
        HTTP,
        HTTPS,
        TCP
    }

    public Listener {
        virtualHosts = List.copyOf(virtualHosts);
    }

    public Optional<VirtualHost> virtualHost(String hostname) {
        return virtualHosts.stream().filter(v -> v.hostname().equals(hostname)).findFirst();
    }
}
