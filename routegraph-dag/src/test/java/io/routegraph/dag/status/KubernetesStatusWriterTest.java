/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;

import io.routegraph.kubernetes.api.v1.HTTPProxy;
import io.routegraph.kubernetes.api.v1.HTTPProxySpec;
import io.routegraph.kubernetes.api.v1.VirtualHost;

import static io.routegraph.dag.status.StatusFixtures.CONTROLLER;
import static io.routegraph.dag.status.StatusFixtures.TEST_CLOCK;
import static io.routegraph.dag.status.StatusFixtures.proxy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@EnableKubernetesMockClient(crud = true)
class KubernetesStatusWriterTest {

    KubernetesClient client;

    private KubernetesStatusWriter writer;
    private StatusCache statusCache;

    @BeforeEach
    void setUp() {
        writer = new KubernetesStatusWriter(client);
        statusCache = new StatusCache(new ConditionFactory(TEST_CLOCK), CONTROLLER);
    }

    @Test
    void shouldWriteProxyStatus() {
        // Given
        HTTPProxy proxy = proxy("root", 1);
        proxy.setSpec(new HTTPProxySpec(new VirtualHost("www.example.com", null, null, null, false), List.of(), List.of(), null));
        client.resource(proxy).create();
        statusCache.proxy(proxy).addError("VirtualHostError", "DuplicateVhost", "fqdn \"www.example.com\" is used in multiple HTTPProxies");

        // When
        writer.write(statusCache.updates().get(0));

        // Then
        HTTPProxy stored = client.resources(HTTPProxy.class).inNamespace("default").withName("root").get();
        assertThat(stored.getStatus()).isNotNull();
        assertThat(stored.getStatus().currentStatus()).isEqualTo("invalid");
        assertThat(stored.getStatus().conditions()).singleElement()
                .satisfies(c -> assertThat(c.errors()).singleElement().satisfies(e -> assertThat(e.reason()).isEqualTo("DuplicateVhost")));
        assertThat(stored.getSpec().virtualhost().fqdn()).isEqualTo("www.example.com");
    }

    @Test
    void shouldSkipDeletedObject() {
        // Given
        statusCache.proxy(proxy("gone", 1));

        // When / Then
        assertThatCode(() -> writer.write(statusCache.updates().get(0))).doesNotThrowAnyException();
        assertThat(client.resources(HTTPProxy.class).inNamespace("default").withName("gone").get()).isNull();
    }
}
