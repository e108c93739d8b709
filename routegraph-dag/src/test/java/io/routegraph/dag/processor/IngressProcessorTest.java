/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPath;
import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPathBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBuilder;

import io.routegraph.dag.ResourceFixtures;
import io.routegraph.dag.builder.BuildResult;
import io.routegraph.dag.builder.GraphBuilder;
import io.routegraph.dag.cache.KubernetesCache;
import io.routegraph.dag.config.BuilderConfiguration;
import io.routegraph.dag.match.PathMatch;
import io.routegraph.dag.model.Redirect;
import io.routegraph.dag.model.Route;
import io.routegraph.dag.model.VirtualHost;
import io.routegraph.dag.status.Conditions;
import io.routegraph.dag.status.IngressConditions;
import io.routegraph.dag.status.IngressStatusUpdate;
import io.routegraph.kubernetes.api.common.NamespacedName;

import static io.routegraph.dag.PkiFixtures.keyPair;
import static io.routegraph.dag.assertj.RouteGraphAssertions.assertThatCondition;
import static io.routegraph.dag.processor.HTTPProxyProcessorTest.route;
import static io.routegraph.dag.processor.HTTPProxyProcessorTest.vhost;
import static org.assertj.core.api.Assertions.assertThat;

class IngressProcessorTest {

    private static final Clock TEST_CLOCK = Clock.fixed(Instant.EPOCH, ZoneId.of("Z"));
    private static final String SERVICES = "/IngressProcessorTest/services.yaml";

    @ParameterizedTest
    @CsvSource(nullValues = "null", value = {
            "null, null, true",
            "routegraph, null, true",
            "nginx, null, false",
            "null, internal, false",
            "internal, internal, true",
            "routegraph, internal, false"
    })
    void shouldSelectIngressByClass(String declared, String configured, boolean expected) {
        Ingress ingress = new IngressBuilder().withNewMetadata().withName("i").endMetadata().withNewSpec().withIngressClassName(declared).endSpec().build();

        assertThat(IngressProcessor.matchesClass(ingress, configured)).isEqualTo(expected);
    }

    @Test
    void shouldFallBackToClassAnnotation() {
        Ingress ingress = new IngressBuilder().withNewMetadata().withName("i").addToAnnotations("kubernetes.io/ingress.class", "internal").endMetadata().build();

        assertThat(IngressProcessor.matchesClass(ingress, "internal")).isTrue();
        assertThat(IngressProcessor.matchesClass(ingress, null)).isFalse();
    }

    @ParameterizedTest
    @CsvSource(nullValues = "null", value = {
            "/app, Prefix, string-prefix: /app",
            "/app, Exact, exact: /app",
            "/app, ImplementationSpecific, string-prefix: /app",
            "/img/.*, ImplementationSpecific, regex: /img/.*",
            "/img/.*, Prefix, string-prefix: /img/.*",
            "null, Prefix, string-prefix: /",
            "/v[12], null, regex: /v[12]"
    })
    void shouldTranslatePath(String path, String pathType, String expected) {
        HTTPIngressPath declared = new HTTPIngressPathBuilder().withPath(path).withPathType(pathType).build();

        assertThat(IngressProcessor.pathMatch(declared)).hasToString(expected);
    }

    @Test
    void shouldBuildRoutesOfSelectedIngresses() {
        // When
        BuildResult result = build("classes.yaml");

        // Then
        VirtualHost vhost = vhost(result.dag(), "ingress_http", "www.example.com");
        assertThat(vhost.routes()).extracting(r -> r.match().path().toString())
                .containsExactlyInAnyOrder("string-prefix: /app", "exact: /exact", "regex: /img/.*");
        assertThat(route(vhost, "/exact").clusters()).singleElement().satisfies(c -> {
            assertThat(c.service().port()).isEqualTo(9000);
            assertThat(c.protocol()).isEqualTo("h2c");
        });
        assertThat(vhost(result.dag(), "ingress_http", "*").routes()).extracting(r -> r.match().path())
                .containsExactly(PathMatch.stringPrefix("/"));
        assertThat(result.dag().virtualHost("ingress_http", "other.example.com")).isEmpty();
        assertThat(result.statusUpdates()).extracting(u -> u.key().name().name()).doesNotContain("other-controller");
    }

    @Test
    void shouldApplyRouteAnnotations() {
        // When
        Route app = route(vhost(build("classes.yaml").dag(), "ingress_http", "www.example.com"), "/app");

        // Then
        assertThat(app.timeoutPolicy().response()).isEqualTo(Duration.ofSeconds(10));
        assertThat(app.retryPolicy()).isNotNull();
        assertThat(app.retryPolicy().retryOn()).containsExactly("5xx", "gateway-error");
        assertThat(app.retryPolicy().numRetries()).isEqualTo(3);
        assertThat(app.websocket()).isTrue();
        assertThat(route(vhost(build("classes.yaml").dag(), "ingress_http", "www.example.com"), "/exact").websocket()).isFalse();
    }

    @Test
    void shouldReportMissingBackend() {
        // When
        BuildResult result = build("missing-backend.yaml");

        // Then
        assertThat(vhost(result.dag(), "ingress_http", "www.example.com").routes()).extracting(r -> r.match().path().value()).containsExactly("/ok");
        assertThatCondition(ingressStatus(result, "broken").conditions(), Conditions.TYPE_RESOLVED_REFS)
                .isResolvedRefsFalse(IngressProcessor.REASON_BACKEND_NOT_FOUND)
                .hasMessage("Service default/nosuch or its port not found")
                .hasObservedGeneration(2L);
    }

    @Test
    void shouldKeepOlderIngressOnConflict() {
        // When
        BuildResult result = build("conflict.yaml");

        // Then
        Route app = route(vhost(result.dag(), "ingress_http", "www.example.com"), "/app");
        assertThat(app.origin().name()).isEqualTo(new NamespacedName("default", "older"));
        assertThatCondition(ingressStatus(result, "newer").conditions(), Conditions.TYPE_CONFLICTED)
                .isConflicted("RouteConflict")
                .hasMessage("route \"string-prefix: /app\" on ingress_http www.example.com conflicts with Ingress default/older");
        assertThat(ingressStatus(result, "older").condition(Conditions.TYPE_CONFLICTED)).isEmpty();
    }

    @Test
    void shouldReportLosingSomePathsSeparatelyFromLosingAll() {
        // When
        BuildResult result = build("partial-conflict.yaml");

        // Then
        VirtualHost www = vhost(result.dag(), "ingress_http", "www.example.com");
        assertThat(route(www, "/app").origin().name()).isEqualTo(new NamespacedName("default", "older"));
        assertThat(route(www, "/other").origin().name()).isEqualTo(new NamespacedName("default", "partial"));
        assertThatCondition(ingressStatus(result, "partial").conditions(), Conditions.TYPE_CONFLICTED)
                .isConflicted(IngressConditions.REASON_ROUTE_PARTIALLY_CONFLICT);
        assertThatCondition(ingressStatus(result, "full").conditions(), Conditions.TYPE_CONFLICTED)
                .isConflicted(IngressConditions.REASON_ROUTE_CONFLICT)
                .hasMessage("route \"string-prefix: /app\" on ingress_http www.example.com conflicts with Ingress default/older");
    }

    @Test
    void shouldRejectPathWithOversizedRegex() {
        // When
        BuildResult result = build("invalid-regex.yaml");

        // Then
        assertThat(vhost(result.dag(), "ingress_http", "www.example.com").routes()).extracting(r -> r.match().path().value()).containsExactly("/ok");
        assertThatCondition(ingressStatus(result, "regex").conditions(), IngressConditions.TYPE_INVALID_PATH)
                .hasStatus(Conditions.STATUS_TRUE)
                .hasReason(IngressProcessor.REASON_REGEX_NOT_VALID)
                .hasMessageContaining("/a{1000}[xyz]*")
                .hasObservedGeneration(3L);
    }

    @Test
    void shouldRedirectToTlsWhenForced() {
        // When
        BuildResult result = buildWithCertificate("tls.yaml");

        // Then
        VirtualHost secure = vhost(result.dag(), "ingress_https", "secure.example.com");
        assertThat(secure.tls().minimumProtocolVersion()).isEqualTo("1.3");
        assertThat(route(secure, "/").clusters()).isNotEmpty();
        assertThat(route(vhost(result.dag(), "ingress_http", "secure.example.com"), "/").redirect()).isEqualTo(Redirect.toHttps());
    }

    @Test
    void shouldNotServePlaintextWhenHttpDisallowed() {
        // When
        BuildResult result = buildWithCertificate("tls.yaml");

        // Then
        assertThat(result.dag().virtualHost("ingress_https", "only.example.com")).isPresent();
        assertThat(result.dag().virtualHost("ingress_http", "only.example.com")).isEmpty();
    }

    @Test
    void shouldServePlaintextWhenCertificateMissing() {
        // When
        BuildResult result = buildWithCertificate("tls.yaml");

        // Then
        assertThat(result.dag().virtualHost("ingress_https", "nocert.example.com")).isEmpty();
        assertThat(route(vhost(result.dag(), "ingress_http", "nocert.example.com"), "/").clusters()).isNotEmpty();
        assertThatCondition(ingressStatus(result, "missing-secret").conditions(), IngressConditions.TYPE_TLS_ERROR)
                .hasStatus("True")
                .hasReason("SecretNotFound");
    }

    @Test
    void shouldOnlyProcessConfiguredClass() {
        // Given
        BuilderConfiguration configuration = new BuilderConfiguration(false, null, null, null, null, "nginx", null, null, null, null, null, null, null);

        // When
        BuildResult result = new GraphBuilder(configuration, TEST_CLOCK).build(ResourceFixtures.snapshot(SERVICES, "/IngressProcessorTest/classes.yaml"));

        // Then
        assertThat(result.dag().listeners()).singleElement().satisfies(l -> assertThat(l.virtualHosts()).extracting(VirtualHost::hostname)
                .containsExactly("other.example.com"));
    }

    private static BuildResult build(String... fixtures) {
        String[] resources = Stream.concat(Stream.of(SERVICES), Arrays.stream(fixtures).map(f -> "/IngressProcessorTest/" + f)).toArray(String[]::new);
        return new GraphBuilder(BuilderConfiguration.defaults(), TEST_CLOCK).build(ResourceFixtures.snapshot(resources));
    }

    private static BuildResult buildWithCertificate(String fixture) {
        KubernetesCache cache = ResourceFixtures.cache(SERVICES, "/IngressProcessorTest/" + fixture);
        cache.insert(keyPair("default", "tls-cert"));
        return new GraphBuilder(BuilderConfiguration.defaults(), TEST_CLOCK).build(cache.snapshot());
    }

    private static IngressStatusUpdate ingressStatus(BuildResult result, String name) {
        return result.statusUpdates().stream()
                .filter(IngressStatusUpdate.class::isInstance)
                .map(IngressStatusUpdate.class::cast)
                .filter(u -> u.key().name().equals(new NamespacedName("default", name)))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no status for Ingress " + name));
    }
}
