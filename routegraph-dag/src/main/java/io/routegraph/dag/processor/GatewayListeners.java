/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.util.List;
import java.util.Optional;

import io.routegraph.dag.model.Listener.Protocol;
import io.routegraph.dag.model.TlsContext;
import io.routegraph.kubernetes.api.gateway.Gateway;
import io.routegraph.kubernetes.api.gateway.RouteGroupKind;
import io.routegraph.kubernetes.api.gateway.RouteNamespaces;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The validated listeners of the managed Gateway.
 *
 * @param gateway the Gateway
 * @param listeners the listeners in declaration order, valid or not
 */
public record GatewayListeners(Gateway gateway, List<GatewayListener> listeners) {

    public GatewayListeners {
        listeners = List.copyOf(listeners);
    }

    public Optional<GatewayListener> listener(String name) {
        return listeners.stream().filter(l -> l.name().equals(name)).findFirst();
    }

    /**
     * One Gateway listener.
     *
     * @param name the listener name on the Gateway
     * @param hostname the hostname the listener is restricted to, or null for any
     * @param declaredPort the port on the Gateway
     * @param protocol the Gateway protocol: {@code HTTP}, {@code HTTPS}, {@code TLS} or {@code TCP}
     * @param dagListener the name of the listener built for it
     * @param dagProtocol the protocol of that listener
     * @param tls TLS termination, absent for plain and passthrough listeners
     * @param passthrough TLS is forwarded without termination
     * @param allowedNamespaces which namespaces may attach routes
     * @param supportedKinds the route kinds that may attach
     * @param valid whether routes may attach at all
     */
    public record GatewayListener(
                                  String name,
                                  @Nullable String hostname,
                                  int declaredPort,
                                  String protocol,
                                  String dagListener,
                                  Protocol dagProtocol,
                                  @Nullable TlsContext tls,
                                  boolean passthrough,
                                  @Nullable RouteNamespaces allowedNamespaces,
                                  List<RouteGroupKind> supportedKinds,
                                  boolean valid) {

        public GatewayListener {
            supportedKinds = List.copyOf(supportedKinds);
        }

        public boolean supportsKind(String kind) {
            return supportedKinds.stream().anyMatch(k -> k.kind().equals(kind));
        }
    }
}
