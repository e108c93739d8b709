/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.cache;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.NamespaceBuilder;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.SecretBuilder;
import io.fabric8.kubernetes.api.model.ServiceBuilder;

import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.v1.HTTPProxy;
import io.routegraph.kubernetes.api.v1.HTTPProxySpec;
import io.routegraph.kubernetes.api.v1.TLS;
import io.routegraph.kubernetes.api.v1.VirtualHost;

import static org.assertj.core.api.Assertions.assertThat;

class KubernetesCacheTest {

    @Test
    void shouldIgnoreObjectsOutsideWatchedNamespaces() {
        KubernetesCache cache = new KubernetesCache(Set.of("team-a"));
        HasMetadata service = service("team-b", "api", "1");

        assertThat(cache.insert(service)).isFalse();
        assertThat(cache.contains(service)).isFalse();
        assertThat(cache.snapshot().service(new NamespacedName("team-b", "api"))).isEmpty();
    }

    @Test
    void shouldKeepObjectsInWatchedNamespaces() {
        KubernetesCache cache = new KubernetesCache(Set.of("team-a"));

        assertThat(cache.insert(service("team-a", "api", "1"))).isTrue();
        assertThat(cache.snapshot().service(new NamespacedName("team-a", "api"))).isPresent();
    }

    @Test
    void namespacesAreAlwaysKept() {
        KubernetesCache cache = new KubernetesCache(Set.of("team-a"));

        // @formatter:off
        cache.insert(new NamespaceBuilder()
                .withNewMetadata()
                    .withName("team-b")
                    .addToLabels("env", "prod")
                .endMetadata()
                .build());
        // @formatter:on

        assertThat(cache.snapshot().namespaceLabels("team-b")).containsEntry("env", "prod");
        assertThat(cache.snapshot().namespaceLabels("unknown")).isEmpty();
    }

    @Test
    void unchangedResourceVersionDoesNotTriggerRebuild() {
        KubernetesCache cache = new KubernetesCache(Set.of());

        assertThat(cache.insert(service("default", "api", "1"))).isTrue();
        assertThat(cache.insert(service("default", "api", "1"))).isFalse();
        assertThat(cache.insert(service("default", "api", "2"))).isTrue();
    }

    @Test
    void unreferencedSecretDoesNotTriggerRebuild() {
        KubernetesCache cache = new KubernetesCache(Set.of());
        Secret secret = secret("certs", "www");

        assertThat(cache.insert(secret)).isFalse();
        assertThat(cache.contains(secret)).isTrue();
    }

    @Test
    void secretReferencedByProxyTriggersRebuild() {
        KubernetesCache cache = new KubernetesCache(Set.of());
        cache.insert(proxy("default", "root", "certs/www"));

        assertThat(cache.insert(secret("certs", "www"))).isTrue();
        assertThat(cache.insert(secret("certs", "other"))).isFalse();
    }

    @Test
    void removeReportsWhetherObjectWasKnown() {
        KubernetesCache cache = new KubernetesCache(Set.of());
        HasMetadata service = service("default", "api", "1");
        cache.insert(service);

        assertThat(cache.remove(service)).isTrue();
        assertThat(cache.remove(service)).isFalse();
        assertThat(cache.contains(service)).isFalse();
    }

    @Test
    void snapshotIsSortedAndIsolated() {
        KubernetesCache cache = new KubernetesCache(Set.of());
        cache.insert(proxy("b", "one", null));
        cache.insert(proxy("a", "two", null));
        cache.insert(proxy("a", "one", null));

        ObjectCacheView snapshot = cache.snapshot();
        cache.insert(proxy("a", "zzz", null));

        List<HTTPProxy> proxies = snapshot.httpProxies();
        assertThat(proxies).extracting(p -> p.getMetadata().getNamespace() + "/" + p.getMetadata().getName())
                .containsExactly("a/one", "a/two", "b/one");
    }

    private static HasMetadata service(String namespace, String name, String resourceVersion) {
        // @formatter:off
        return new ServiceBuilder()
                .withNewMetadata()
                    .withNamespace(namespace)
                    .withName(name)
                    .withResourceVersion(resourceVersion)
                .endMetadata()
                .withNewSpec()
                    .addNewPort()
                        .withPort(80)
                    .endPort()
                .endSpec()
                .build();
        // @formatter:on
    }

    private static Secret secret(String namespace, String name) {
        return new SecretBuilder().withNewMetadata().withNamespace(namespace).withName(name).endMetadata().build();
    }

    private static HTTPProxy proxy(String namespace, String name, String secretName) {
        var proxy = new HTTPProxy();
        proxy.setMetadata(new ObjectMetaBuilder().withNamespace(namespace).withName(name).build());
        TLS tls = secretName == null ? null : new TLS(secretName, false, null, null);
        proxy.setSpec(new HTTPProxySpec(new VirtualHost(name + ".example.com", tls, null, null, false), List.of(), List.of(), null));
        return proxy;
    }
}
