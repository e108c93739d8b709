/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;

import io.routegraph.dag.cache.ObjectCacheView;
import io.routegraph.kubernetes.api.gateway.ReferenceGrant;
import io.routegraph.kubernetes.api.gateway.ReferenceGrantFrom;
import io.routegraph.kubernetes.api.gateway.ReferenceGrantSpec;
import io.routegraph.kubernetes.api.gateway.ReferenceGrantTo;

import static io.routegraph.dag.processor.ReferenceGrants.CORE_GROUP;
import static io.routegraph.dag.processor.ReferenceGrants.GATEWAY_GROUP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReferenceGrantsTest {

    @Mock
    ObjectCacheView cache;

    @Test
    void sameNamespaceIsAlwaysPermitted() {
        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "HTTPRoute", "apps", CORE_GROUP, "Service", "apps", "web")).isTrue();
        verifyNoInteractions(cache);
    }

    @Test
    void crossNamespaceWithoutGrantIsRefused() {
        when(cache.referenceGrants("backends")).thenReturn(List.of());

        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "HTTPRoute", "apps", CORE_GROUP, "Service", "backends", "web")).isFalse();
    }

    @Test
    void grantForAnyNamePermitsEveryService() {
        // Given
        when(cache.referenceGrants("backends")).thenReturn(List.of(grant(
                new ReferenceGrantFrom(GATEWAY_GROUP, "HTTPRoute", "apps"),
                new ReferenceGrantTo(null, "Service", null))));

        // When / Then
        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "HTTPRoute", "apps", CORE_GROUP, "Service", "backends", "web")).isTrue();
        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "HTTPRoute", "apps", CORE_GROUP, "Service", "backends", "api")).isTrue();
    }

    @Test
    void namedGrantOnlyPermitsThatObject() {
        when(cache.referenceGrants("backends")).thenReturn(List.of(grant(
                new ReferenceGrantFrom(GATEWAY_GROUP, "HTTPRoute", "apps"),
                new ReferenceGrantTo("", "Service", "web"))));

        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "HTTPRoute", "apps", CORE_GROUP, "Service", "backends", "web")).isTrue();
        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "HTTPRoute", "apps", CORE_GROUP, "Service", "backends", "api")).isFalse();
    }

    @Test
    void grantMustNameTheReferencingKindAndNamespace() {
        when(cache.referenceGrants("backends")).thenReturn(List.of(grant(
                new ReferenceGrantFrom(GATEWAY_GROUP, "GRPCRoute", "apps"),
                new ReferenceGrantTo(null, "Service", null))));

        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "HTTPRoute", "apps", CORE_GROUP, "Service", "backends", "web")).isFalse();
        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "GRPCRoute", "other", CORE_GROUP, "Service", "backends", "web")).isFalse();
        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "GRPCRoute", "apps", CORE_GROUP, "Service", "backends", "web")).isTrue();
    }

    @Test
    void secretGrantDoesNotPermitService() {
        when(cache.referenceGrants("certs")).thenReturn(List.of(grant(
                new ReferenceGrantFrom(GATEWAY_GROUP, "Gateway", "infra"),
                new ReferenceGrantTo(null, "Secret", null))));

        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "Gateway", "infra", CORE_GROUP, "Secret", "certs", "tls")).isTrue();
        assertThat(ReferenceGrants.permits(cache, GATEWAY_GROUP, "Gateway", "infra", CORE_GROUP, "Service", "certs", "tls")).isFalse();
    }

    private static ReferenceGrant grant(ReferenceGrantFrom from, ReferenceGrantTo to) {
        ReferenceGrant grant = new ReferenceGrant();
        grant.setMetadata(new ObjectMetaBuilder().withName("grant").build());
        grant.setSpec(new ReferenceGrantSpec(List.of(from), List.of(to)));
        return grant;
    }
}
