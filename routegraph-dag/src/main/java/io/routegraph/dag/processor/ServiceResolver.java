/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;

import io.fabric8.kubernetes.api.model.ServicePort;

import io.routegraph.dag.cache.ObjectCacheView;
import io.routegraph.dag.model.Service;
import io.routegraph.kubernetes.api.common.NamespacedName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Resolves references to Service ports. A Service that has disappeared, or lacks the port, does not resolve.
 */
final class ServiceResolver {

    private final ObjectCacheView cache;

    ServiceResolver(ObjectCacheView cache) {
        this.cache = cache;
    }

    Optional<Service> resolve(NamespacedName name, int port) {
        return resolve(name, p -> p.getPort() != null && p.getPort() == port);
    }

    Optional<Service> resolve(NamespacedName name, String portName) {
        return resolve(name, p -> portName.equals(p.getName()));
    }

    /**
     * @param name the Service
     * @return the first port of the Service, for references that do not name one
     */
    Optional<Service> resolveFirstPort(NamespacedName name) {
        return resolve(name, p -> true);
    }

    private Optional<Service> resolve(NamespacedName name, Predicate<ServicePort> portFilter) {
        return cache.service(name)
                .filter(s -> s.getSpec() != null && s.getSpec().getPorts() != null)
                .flatMap(s -> s.getSpec().getPorts().stream().filter(portFilter).findFirst())
                .map(p -> new Service(name, p.getPort(), p.getName(), p.getAppProtocol()));
    }

    /**
     * The upstream protocol for a backend: the declared one, otherwise derived from the port's application protocol.
     * @param declared the protocol declared on the route, if any
     * @param service the resolved backend
     * @return {@code h2}, {@code h2c}, {@code tls}, or empty for HTTP/1.1
     */
    static String protocol(@Nullable String declared, Service service) {
        if (declared != null && !declared.isEmpty()) {
            return declared.toLowerCase(Locale.ROOT);
        }
        String appProtocol = service.appProtocol();
        if (appProtocol == null) {
            return "";
        }
        return switch (appProtocol.toLowerCase(Locale.ROOT)) {
            case "h2", "kubernetes.io/h2" -> "h2";
            case "h2c", "kubernetes.io/h2c", "grpc" -> "h2c";
            case "tls", "https", "kubernetes.io/wss" -> "tls";
            default -> "";
        };
    }

    static boolean isValidPort(int port) {
        return port >= 1 && port <= 65535;
    }

    static List<String> knownProtocols() {
        return List.of("h2", "h2c", "tls");
    }
}
