/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import java.io.IOException;
import java.io.InputStream;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import io.fabric8.kubernetes.api.model.HasMetadata;

import static org.assertj.core.api.Assertions.assertThat;

class HTTPProxyTest {

    private static final YAMLMapper YAML_MAPPER = new YAMLMapper();

    @Test
    void shouldDeserializeRootProxy() throws IOException {
        HTTPProxy proxy = read("/root-proxy.yaml");

        assertThat(proxy.getMetadata().getNamespace()).isEqualTo("default");
        assertThat(HasMetadata.getApiVersion(HTTPProxy.class)).isEqualTo("routegraph.io/v1");
        HTTPProxySpec spec = proxy.getSpec();
        assertThat(spec.virtualhost()).isNotNull();
        assertThat(spec.virtualhost().fqdn()).isEqualTo("www.example.com");
        assertThat(spec.virtualhost().tls().secretName()).isEqualTo("certs/www");
        assertThat(spec.virtualhost().tls().passthrough()).isFalse();
        assertThat(spec.routes()).singleElement().satisfies(route -> {
            assertThat(route.conditions()).singleElement().extracting(MatchCondition::prefix).isEqualTo("/api");
            assertThat(route.services()).singleElement().satisfies(service -> {
                assertThat(service.name()).isEqualTo("api");
                assertThat(service.port()).isEqualTo(8080);
                assertThat(service.weight()).isNull();
            });
            assertThat(route.permitInsecure()).isTrue();
        });
        assertThat(spec.includes()).singleElement().satisfies(include -> {
            assertThat(include.name()).isEqualTo("blog");
            assertThat(include.namespace()).isEqualTo("marketing");
            assertThat(include.conditions()).singleElement().extracting(MatchCondition::prefix).isEqualTo("/blog");
        });
    }

    @Test
    void shouldDefaultMissingListsToEmpty() {
        HTTPProxySpec spec = new HTTPProxySpec(null, null, null, null);

        assertThat(spec.routes()).isEmpty();
        assertThat(spec.includes()).isEmpty();
    }

    private static HTTPProxy read(String resource) throws IOException {
        try (InputStream in = HTTPProxyTest.class.getResourceAsStream(resource)) {
            return YAML_MAPPER.readValue(in, HTTPProxy.class);
        }
    }
}
