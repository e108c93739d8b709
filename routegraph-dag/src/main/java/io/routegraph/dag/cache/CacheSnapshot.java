/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.cache;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;

import io.routegraph.dag.ResourcesUtil;
import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.gateway.GRPCRoute;
import io.routegraph.kubernetes.api.gateway.Gateway;
import io.routegraph.kubernetes.api.gateway.HTTPRoute;
import io.routegraph.kubernetes.api.gateway.ReferenceGrant;
import io.routegraph.kubernetes.api.gateway.TCPRoute;
import io.routegraph.kubernetes.api.gateway.TLSRoute;
import io.routegraph.kubernetes.api.v1.HTTPProxy;
import io.routegraph.kubernetes.api.v1.TLSCertificateDelegation;

/**
 * An immutable copy of the contents of a {@link KubernetesCache} taken at one instant.
 */
final class CacheSnapshot implements ObjectCacheView {

    private static final Comparator<HasMetadata> BY_NAME = Comparator.comparing(ResourcesUtil::namespacedName, NamespacedName.COMPARATOR);

    private final Map<Class<? extends HasMetadata>, Map<NamespacedName, HasMetadata>> objects;

    CacheSnapshot(Map<Class<? extends HasMetadata>, Map<NamespacedName, HasMetadata>> objects) {
        this.objects = objects;
    }

    private <T extends HasMetadata> List<T> all(Class<T> type) {
        return objects.getOrDefault(type, Map.of()).values().stream()
                .map(type::cast)
                .sorted(BY_NAME)
                .toList();
    }

    private <T extends HasMetadata> List<T> inNamespace(Class<T> type, String namespace) {
        return all(type).stream()
                .filter(o -> namespace.equals(o.getMetadata().getNamespace()))
                .toList();
    }

    private <T extends HasMetadata> Optional<T> get(Class<T> type, NamespacedName name) {
        return Optional.ofNullable(objects.getOrDefault(type, Map.of()).get(name)).map(type::cast);
    }

    @Override
    public List<HTTPProxy> httpProxies() {
        return all(HTTPProxy.class);
    }

    @Override
    public Optional<HTTPProxy> httpProxy(NamespacedName name) {
        return get(HTTPProxy.class, name);
    }

    @Override
    public List<TLSCertificateDelegation> certificateDelegations(String namespace) {
        return inNamespace(TLSCertificateDelegation.class, namespace);
    }

    @Override
    public List<Ingress> ingresses() {
        return all(Ingress.class);
    }

    @Override
    public Optional<Secret> secret(NamespacedName name) {
        return get(Secret.class, name);
    }

    @Override
    public Optional<Service> service(NamespacedName name) {
        return get(Service.class, name);
    }

    @Override
    public Map<String, String> namespaceLabels(String namespace) {
        return objects.getOrDefault(Namespace.class, Map.of()).values().stream()
                .filter(ns -> namespace.equals(ns.getMetadata().getName()))
                .findFirst()
                .map(ns -> ns.getMetadata().getLabels())
                .orElse(Map.of());
    }

    @Override
    public Optional<Gateway> gateway(NamespacedName name) {
        return get(Gateway.class, name);
    }

    @Override
    public List<HTTPRoute> httpRoutes() {
        return all(HTTPRoute.class);
    }

    @Override
    public List<GRPCRoute> grpcRoutes() {
        return all(GRPCRoute.class);
    }

    @Override
    public List<TLSRoute> tlsRoutes() {
        return all(TLSRoute.class);
    }

    @Override
    public List<TCPRoute> tcpRoutes() {
        return all(TCPRoute.class);
    }

    @Override
    public List<ReferenceGrant> referenceGrants(String namespace) {
        return inNamespace(ReferenceGrant.class, namespace);
    }

    int size() {
        return objects.values().stream().map(Map::values).mapToInt(Collection::size).sum();
    }
}
