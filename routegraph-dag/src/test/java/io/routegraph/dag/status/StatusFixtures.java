/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBuilder;

import io.routegraph.kubernetes.api.gateway.Gateway;
import io.routegraph.kubernetes.api.gateway.HTTPRoute;
import io.routegraph.kubernetes.api.gateway.ParentReference;
import io.routegraph.kubernetes.api.v1.HTTPProxy;

final class StatusFixtures {

    static final Clock TEST_CLOCK = Clock.fixed(Instant.EPOCH, ZoneId.of("Z"));
    static final String EPOCH = "1970-01-01T00:00:00Z";
    static final String CONTROLLER = "example.com/controller";
    static final ParentReference GATEWAY_REF = new ParentReference(null, null, null, "main", null, null);
    static final ParentReference OTHER_GATEWAY_REF = new ParentReference(null, null, "gateways", "other", "https", null);

    private StatusFixtures() {
    }

    static HTTPProxy proxy(String name, long generation) {
        var proxy = new HTTPProxy();
        proxy.setMetadata(new ObjectMetaBuilder().withNamespace("default").withName(name).withGeneration(generation).build());
        return proxy;
    }

    static HTTPRoute route(String name, long generation) {
        var route = new HTTPRoute();
        route.setMetadata(new ObjectMetaBuilder().withNamespace("default").withName(name).withGeneration(generation).build());
        return route;
    }

    static Gateway gateway(String name, long generation) {
        var gateway = new Gateway();
        gateway.setMetadata(new ObjectMetaBuilder().withNamespace("default").withName(name).withGeneration(generation).build());
        return gateway;
    }

    static Ingress ingress(String name, long generation) {
        return new IngressBuilder()
                .withMetadata(new ObjectMetaBuilder().withNamespace("default").withName(name).withGeneration(generation).build())
                .build();
    }
}
