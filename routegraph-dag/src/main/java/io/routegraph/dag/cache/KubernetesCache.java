/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.cache;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.networking.v1.IngressTLS;

import io.routegraph.dag.ResourcesUtil;
import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.gateway.Gateway;
import io.routegraph.kubernetes.api.gateway.GatewayTLSConfig;
import io.routegraph.kubernetes.api.gateway.Listener;
import io.routegraph.kubernetes.api.v1.BackendService;
import io.routegraph.kubernetes.api.v1.DownstreamValidation;
import io.routegraph.kubernetes.api.v1.HTTPProxy;
import io.routegraph.kubernetes.api.v1.HTTPProxySpec;
import io.routegraph.kubernetes.api.v1.Route;
import io.routegraph.kubernetes.api.v1.TLS;

/**
 * The thread-safe store of cluster objects, fed by watch events, from which builds take snapshots.
 * <p>{@link #insert(HasMetadata)} and {@link #remove(HasMetadata)} report whether the change could alter the graph.
 * Secrets that no object references do not trigger a rebuild: they are only validated once referenced.</p>
 */
public class KubernetesCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesCache.class);

    private final Set<String> watchedNamespaces;
    private final Map<Class<? extends HasMetadata>, Map<NamespacedName, HasMetadata>> objects = new ConcurrentHashMap<>();

    /**
     * @param watchedNamespaces namespaces whose objects are kept; empty means every namespace
     */
    public KubernetesCache(Set<String> watchedNamespaces) {
        this.watchedNamespaces = Set.copyOf(watchedNamespaces);
    }

    /**
     * Adds or replaces an object.
     * @param resource the object
     * @return true if the change may alter the graph
     */
    public boolean insert(HasMetadata resource) {
        if (!isWatched(resource)) {
            LOGGER.atDebug()
                    .setMessage("ignoring {} {} outside the watched namespaces")
                    .addArgument(ResourcesUtil.kind(resource))
                    .addArgument(ResourcesUtil.namespacedName(resource))
                    .log();
            return false;
        }
        HasMetadata previous = objects.computeIfAbsent(resource.getClass(), k -> new ConcurrentHashMap<>())
                .put(ResourcesUtil.namespacedName(resource), resource);
        if (previous != null && Objects.equals(previous.getMetadata().getResourceVersion(), resource.getMetadata().getResourceVersion())
                && previous.getMetadata().getResourceVersion() != null) {
            return false;
        }
        return triggersRebuild(resource);
    }

    /**
     * Removes an object.
     * @param resource the object
     * @return true if the object was known and its removal may alter the graph
     */
    public boolean remove(HasMetadata resource) {
        Map<NamespacedName, HasMetadata> ofType = objects.get(resource.getClass());
        if (ofType == null || ofType.remove(ResourcesUtil.namespacedName(resource)) == null) {
            return false;
        }
        return triggersRebuild(resource);
    }

    /**
     * @param resource an object
     * @return true if this cache holds the same version of the object
     */
    public boolean contains(HasMetadata resource) {
        HasMetadata held = objects.getOrDefault(resource.getClass(), Map.of()).get(ResourcesUtil.namespacedName(resource));
        return held != null && Objects.equals(held.getMetadata().getResourceVersion(), resource.getMetadata().getResourceVersion());
    }

    public ObjectCacheView snapshot() {
        Map<Class<? extends HasMetadata>, Map<NamespacedName, HasMetadata>> copy = new HashMap<>();
        objects.forEach((type, byName) -> copy.put(type, Map.copyOf(byName)));
        return new CacheSnapshot(Map.copyOf(copy));
    }

    private boolean isWatched(HasMetadata resource) {
        String namespace = resource.getMetadata().getNamespace();
        return watchedNamespaces.isEmpty() || namespace == null || resource instanceof Namespace || watchedNamespaces.contains(namespace);
    }

    private boolean triggersRebuild(HasMetadata resource) {
        if (resource instanceof Secret secret) {
            return isReferenced(ResourcesUtil.namespacedName(secret));
        }
        return true;
    }

    private boolean isReferenced(NamespacedName secret) {
        ObjectCacheView view = snapshot();
        boolean byProxy = view.httpProxies().stream()
                .anyMatch(proxy -> secretReferences(proxy).anyMatch(secret::equals));
        boolean byIngress = view.ingresses().stream()
                .anyMatch(ingress -> ingress.getSpec() != null && ingress.getSpec().getTls() != null && ingress.getSpec().getTls().stream()
                        .map(IngressTLS::getSecretName)
                        .filter(Objects::nonNull)
                        .map(ref -> NamespacedName.parse(ResourcesUtil.namespace(ingress), ref))
                        .anyMatch(secret::equals));
        boolean byGateway = objects.getOrDefault(Gateway.class, Map.of()).values().stream()
                .map(Gateway.class::cast)
                .filter(gateway -> gateway.getSpec() != null)
                .anyMatch(gateway -> gateway.getSpec().listeners().stream()
                        .map(Listener::tls)
                        .filter(Objects::nonNull)
                        .map(GatewayTLSConfig::certificateRefs)
                        .flatMap(List::stream)
                        .map(ref -> new NamespacedName(ref.namespace() == null ? ResourcesUtil.namespace(gateway) : ref.namespace(), ref.name()))
                        .anyMatch(secret::equals));
        return byProxy || byIngress || byGateway;
    }

    private static Stream<NamespacedName> secretReferences(HTTPProxy proxy) {
        HTTPProxySpec spec = proxy.getSpec();
        if (spec == null) {
            return Stream.empty();
        }
        String namespace = ResourcesUtil.namespace(proxy);
        Stream<String> vhostSecrets = Stream.empty();
        if (spec.virtualhost() != null && spec.virtualhost().tls() != null) {
            TLS tls = spec.virtualhost().tls();
            DownstreamValidation validation = tls.clientValidation();
            vhostSecrets = Stream.of(tls.secretName(),
                    validation == null ? null : validation.caSecret(),
                    validation == null ? null : validation.crlSecret());
        }
        Stream<String> upstreamSecrets = spec.routes().stream()
                .map(Route::services)
                .flatMap(List::stream)
                .map(BackendService::validation)
                .filter(Objects::nonNull)
                .map(v -> v.caSecret());
        return Stream.concat(vhostSecrets, upstreamSecrets)
                .filter(Objects::nonNull)
                .map(ref -> NamespacedName.parse(namespace, ref));
    }
}
