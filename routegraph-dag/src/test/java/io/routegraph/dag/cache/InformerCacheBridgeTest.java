/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.cache;

import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;

import io.routegraph.kubernetes.api.common.NamespacedName;

import static org.assertj.core.api.Assertions.assertThat;

@EnableKubernetesMockClient(crud = true)
class InformerCacheBridgeTest {

    KubernetesClient client;

    private InformerCacheBridge bridge;

    @AfterEach
    void tearDown() {
        if (bridge != null) {
            bridge.close();
        }
    }

    @Test
    void shouldSignalInitialSyncOnceListingIsDelivered() throws Exception {
        // Given
        client.resource(service("default", "api")).create();
        KubernetesCache cache = new KubernetesCache(Set.of());
        CountDownLatch synced = new CountDownLatch(1);
        AtomicInteger syncCalls = new AtomicInteger();
        bridge = new InformerCacheBridge(client, cache, Set.of(), () -> {
        }, () -> {
            syncCalls.incrementAndGet();
            synced.countDown();
        });

        // When
        bridge.start();

        // Then
        assertThat(synced.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(cache.snapshot().service(new NamespacedName("default", "api"))).isPresent();
        assertThat(bridge.checkInitialSync()).isTrue();
        assertThat(syncCalls).hasValue(1);
    }

    @Test
    void shouldNotifyChangesAfterSync() throws Exception {
        // Given
        KubernetesCache cache = new KubernetesCache(Set.of());
        CountDownLatch synced = new CountDownLatch(1);
        CountDownLatch changed = new CountDownLatch(1);
        bridge = new InformerCacheBridge(client, cache, Set.of(), changed::countDown, synced::countDown);
        bridge.start();
        assertThat(synced.await(10, TimeUnit.SECONDS)).isTrue();

        // When
        client.resource(service("default", "web")).create();

        // Then
        assertThat(changed.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(cache.snapshot().service(new NamespacedName("default", "web"))).isPresent();
    }

    @Test
    void shouldOnlyInformWatchedNamespaces() throws Exception {
        // Given
        client.resource(service("team-a", "api")).create();
        client.resource(service("team-b", "api")).create();
        KubernetesCache cache = new KubernetesCache(Set.of("team-a"));
        CountDownLatch synced = new CountDownLatch(1);
        bridge = new InformerCacheBridge(client, cache, Set.of("team-a"), () -> {
        }, synced::countDown);

        // When
        bridge.start();

        // Then
        assertThat(synced.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(cache.snapshot().service(new NamespacedName("team-a", "api"))).isPresent();
        assertThat(cache.snapshot().service(new NamespacedName("team-b", "api"))).isEmpty();
    }

    private static Service service(String namespace, String name) {
        // @formatter:off
        return new ServiceBuilder()
                .withNewMetadata()
                    .withNamespace(namespace)
                    .withName(name)
                .endMetadata()
                .withNewSpec()
                    .addNewPort()
                        .withName("http")
                        .withPort(80)
                    .endPort()
                .endSpec()
                .build();
        // @formatter:on
    }
}
