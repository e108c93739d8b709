/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.builder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBuilder;

import io.routegraph.dag.match.ConflictTieBreak;
import io.routegraph.dag.match.PathMatch;
import io.routegraph.dag.match.RouteMatch;
import io.routegraph.dag.model.Cluster;
import io.routegraph.dag.model.Dag;
import io.routegraph.dag.model.Listener;
import io.routegraph.dag.model.Route;
import io.routegraph.dag.model.RouteOrigin;
import io.routegraph.dag.model.Service;
import io.routegraph.dag.model.TcpProxy;
import io.routegraph.dag.model.TlsContext;
import io.routegraph.dag.model.TlsSecret;
import io.routegraph.dag.model.VirtualHost;
import io.routegraph.dag.status.ConditionFactory;
import io.routegraph.dag.status.Conditions;
import io.routegraph.dag.status.IngressStatusUpdate;
import io.routegraph.dag.status.ProxyStatusUpdate;
import io.routegraph.dag.status.StatusCache;
import io.routegraph.dag.status.StatusUpdate;
import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.v1.HTTPProxy;

import static org.assertj.core.api.Assertions.assertThat;

class DagBuilderTest {

    private static final Clock TEST_CLOCK = Clock.fixed(Instant.EPOCH, ZoneId.of("Z"));
    private static final RouteOrigin OLD_PROXY = new RouteOrigin("HTTPProxy", new NamespacedName("default", "proxy"), Instant.parse("2024-01-01T00:00:00Z"));
    private static final RouteOrigin NEW_INGRESS = new RouteOrigin("Ingress", new NamespacedName("default", "ingress"), Instant.parse("2024-02-01T00:00:00Z"));
    private static final Service API = new Service(new NamespacedName("default", "api"), 8080, "http", null);
    private static final Service WEB = new Service(new NamespacedName("default", "web"), 80, null, null);

    private StatusCache statusCache;
    private DagBuilder dagBuilder;

    @BeforeEach
    void setUp() {
        statusCache = new StatusCache(new ConditionFactory(TEST_CLOCK), "example.com/controller");
        dagBuilder = new DagBuilder(ConflictTieBreak.WINNER_FIRST, statusCache);
    }

    @Test
    void listenerIsCreatedOnce() {
        DagBuilder.ListenerBuilder first = dagBuilder.listener("ingress_http", "0.0.0.0", 8080, 80, Listener.Protocol.HTTP);
        DagBuilder.ListenerBuilder second = dagBuilder.listener("ingress_http", "0.0.0.0", 9999, 99, Listener.Protocol.HTTP);

        assertThat(second).isSameAs(first);
        assertThat(second.port()).isEqualTo(8080);
        assertThat(dagBuilder.findListener("ingress_http")).containsSame(first);
        assertThat(dagBuilder.listeners(Listener.Protocol.HTTP)).containsExactly(first);
        assertThat(dagBuilder.listeners(Listener.Protocol.HTTPS)).isEmpty();
    }

    @Test
    void olderRouteWinsConflict() {
        registerLosers();
        DagBuilder.VirtualHostBuilder vhost = vhost("www.example.com");
        RouteMatch match = RouteMatch.of(PathMatch.prefix("/"));

        assertThat(vhost.addRoute(route(match, NEW_INGRESS, WEB))).isTrue();
        assertThat(vhost.addRoute(route(match, OLD_PROXY, API))).isTrue();

        assertThat(vhost.route(match)).get().extracting(Route::origin).isEqualTo(OLD_PROXY);
        dagBuilder.freeze(1, false);
        IngressStatusUpdate ingress = update(IngressStatusUpdate.class);
        assertThat(ingress.condition(Conditions.TYPE_CONFLICTED)).get().satisfies(c -> {
            assertThat(c.getReason()).isEqualTo("RouteConflict");
            assertThat(c.getMessage()).isEqualTo("route \"prefix: /\" on ingress_http www.example.com conflicts with HTTPProxy default/proxy");
        });
        assertThat(update(ProxyStatusUpdate.class).isValid()).isTrue();
    }

    @Test
    void newerRouteLosesConflict() {
        registerLosers();
        DagBuilder.VirtualHostBuilder vhost = vhost("www.example.com");
        RouteMatch match = RouteMatch.of(PathMatch.prefix("/"));

        vhost.addRoute(route(match, OLD_PROXY, API));

        assertThat(vhost.addRoute(route(match, NEW_INGRESS, WEB))).isFalse();
        assertThat(vhost.route(match)).get().extracting(Route::origin).isEqualTo(OLD_PROXY);
    }

    @Test
    void losingSomeRoutesIsReportedAsPartialConflict() {
        // Given
        registerLosers();
        DagBuilder.VirtualHostBuilder vhost = vhost("www.example.com");
        vhost.addRoute(route(RouteMatch.of(PathMatch.prefix("/")), OLD_PROXY, API));

        // When
        vhost.addRoute(route(RouteMatch.of(PathMatch.prefix("/")), NEW_INGRESS, WEB));
        vhost.addRoute(route(RouteMatch.of(PathMatch.prefix("/static")), NEW_INGRESS, WEB));
        dagBuilder.freeze(1, false);

        // Then
        assertThat(update(IngressStatusUpdate.class).condition(Conditions.TYPE_CONFLICTED)).get()
                .satisfies(c -> assertThat(c.getReason()).isEqualTo("RoutePartiallyConflict"));
    }

    @Test
    void routeEvictedByLaterWinnerIsReportedAsFullConflict() {
        // Given
        registerLosers();
        DagBuilder.VirtualHostBuilder vhost = vhost("www.example.com");
        vhost.addRoute(route(RouteMatch.of(PathMatch.prefix("/")), NEW_INGRESS, WEB));
        vhost.addRoute(route(RouteMatch.of(PathMatch.prefix("/static")), NEW_INGRESS, WEB));

        // When
        vhost.addRoute(route(RouteMatch.of(PathMatch.prefix("/")), OLD_PROXY, API));
        vhost.addRoute(route(RouteMatch.of(PathMatch.prefix("/static")), OLD_PROXY, API));
        dagBuilder.freeze(1, false);

        // Then
        assertThat(update(IngressStatusUpdate.class).condition(Conditions.TYPE_CONFLICTED)).get().satisfies(c -> {
            assertThat(c.getReason()).isEqualTo("RouteConflict");
            assertThat(c.getMessage()).contains("\"prefix: /\"", "\"prefix: /static\"");
        });
    }

    @Test
    void conflictsAreNotReportedBeforeFreeze() {
        registerLosers();
        DagBuilder.VirtualHostBuilder vhost = vhost("www.example.com");
        vhost.addRoute(route(RouteMatch.of(PathMatch.prefix("/")), OLD_PROXY, API));
        vhost.addRoute(route(RouteMatch.of(PathMatch.prefix("/")), NEW_INGRESS, WEB));

        assertThat(update(IngressStatusUpdate.class).condition(Conditions.TYPE_CONFLICTED)).isEmpty();
    }

    @Test
    void sameOriginReplacesItsRoute() {
        DagBuilder.VirtualHostBuilder vhost = vhost("www.example.com");
        RouteMatch match = RouteMatch.of(PathMatch.prefix("/"));

        vhost.addRoute(route(match, OLD_PROXY, API));
        assertThat(vhost.addRoute(route(match, OLD_PROXY, WEB))).isTrue();

        assertThat(vhost.route(match)).get().satisfies(r -> assertThat(r.clusters()).extracting(Cluster::service).containsExactly(WEB));
        assertThat(statusCache.updates()).isEmpty();
    }

    @Test
    void differentTlsIsRefused() {
        DagBuilder.VirtualHostBuilder vhost = vhost("www.example.com");
        TlsContext tls = new TlsContext(TlsSecret.of(new NamespacedName("default", "a"), TlsSecret.Kind.KEY_PAIR, Map.of()), "1.2", false, null);

        assertThat(vhost.tls(tls)).isTrue();
        assertThat(vhost.tls(tls)).isTrue();
        assertThat(vhost.tls(TlsContext.forPassthrough())).isFalse();
        assertThat(vhost.tls()).contains(tls);
    }

    @Test
    void freezeDropsEmptyVirtualHostsAndListeners() {
        vhost("empty.example.com");
        dagBuilder.listener("ingress_https", "0.0.0.0", 8443, 443, Listener.Protocol.HTTPS).virtualHost("also-empty.example.com");
        vhost("www.example.com").addRoute(route(RouteMatch.of(PathMatch.ROOT), OLD_PROXY, API));

        Dag dag = dagBuilder.freeze(7, false);

        assertThat(dag.version()).isEqualTo(7);
        assertThat(dag.listeners()).extracting(Listener::name).containsExactly("ingress_http");
        assertThat(dag.listener("ingress_http").orElseThrow().virtualHosts()).extracting(VirtualHost::hostname).containsExactly("www.example.com");
    }

    @Test
    void freezeKeepsTcpProxyListener() {
        dagBuilder.listener("tcp-9000", "0.0.0.0", 9000, 9000, Listener.Protocol.TCP).tcpProxy(new TcpProxy(List.of(Cluster.of(API, 1))));

        Dag dag = dagBuilder.freeze(1, false);

        assertThat(dag.listener("tcp-9000")).get().satisfies(l -> assertThat(l.tcpProxy()).isNotNull());
        assertThat(dag.services()).containsExactly(API);
    }

    @Test
    void freezeSortsRoutesUnlessDisabled() {
        DagBuilder.VirtualHostBuilder vhost = vhost("www.example.com");
        vhost.addRoute(route(RouteMatch.of(PathMatch.ROOT), OLD_PROXY, API));
        vhost.addRoute(route(RouteMatch.of(PathMatch.prefix("/longer")), OLD_PROXY, API));

        VirtualHost sorted = dagBuilder.freeze(1, false).virtualHost("ingress_http", "www.example.com").orElseThrow();
        VirtualHost unsorted = dagBuilder.freeze(2, true).virtualHost("ingress_http", "www.example.com").orElseThrow();

        assertThat(sorted.routesSorted()).isTrue();
        assertThat(sorted.routes()).extracting(r -> r.match().path().value()).containsExactly("/longer", "/");
        assertThat(unsorted.routesSorted()).isFalse();
        assertThat(unsorted.routes()).extracting(r -> r.match().path().value()).containsExactly("/", "/longer");
    }

    @Test
    void virtualHostSortingOverridesDefault() {
        DagBuilder.VirtualHostBuilder vhost = vhost("www.example.com");
        vhost.disableRouteSorting(true);
        vhost.addRoute(route(RouteMatch.of(PathMatch.ROOT), OLD_PROXY, API));

        assertThat(dagBuilder.freeze(1, false).virtualHost("ingress_http", "www.example.com").orElseThrow().routesSorted()).isFalse();
    }

    @Test
    void freezeCollectsServicesAndSecrets() {
        TlsSecret secret = TlsSecret.of(new NamespacedName("certs", "www"), TlsSecret.Kind.KEY_PAIR, Map.of("tls.crt", "x"));
        DagBuilder.VirtualHostBuilder secure = dagBuilder.listener("ingress_https", "0.0.0.0", 8443, 443, Listener.Protocol.HTTPS)
                .virtualHost("www.example.com");
        secure.tls(new TlsContext(secret, "1.2", false, null));
        secure.addRoute(route(RouteMatch.of(PathMatch.ROOT), OLD_PROXY, WEB));
        vhost("www.example.com").addRoute(route(RouteMatch.of(PathMatch.ROOT), OLD_PROXY, WEB));
        vhost("api.example.com").addRoute(route(RouteMatch.of(PathMatch.ROOT), OLD_PROXY, API));

        Dag dag = dagBuilder.freeze(1, false);

        assertThat(dag.services()).containsExactly(API, WEB);
        assertThat(dag.secrets()).containsOnlyKeys(new NamespacedName("certs", "www"));
        assertThat(dag.virtualHost("ingress_https", "www.example.com")).get().satisfies(v -> assertThat(v.isSecure()).isTrue());
    }

    @Test
    void equalInputsFreezeToEqualContent() {
        vhost("www.example.com").addRoute(route(RouteMatch.of(PathMatch.ROOT), OLD_PROXY, API));
        Dag first = dagBuilder.freeze(1, false);
        Dag second = dagBuilder.freeze(2, false);

        assertThat(first.sameContentAs(second)).isTrue();
        assertThat(first).isNotEqualTo(second);
    }

    private DagBuilder.VirtualHostBuilder vhost(String hostname) {
        return dagBuilder.listener("ingress_http", "0.0.0.0", 8080, 80, Listener.Protocol.HTTP).virtualHost(hostname);
    }

    private void registerLosers() {
        var proxy = new HTTPProxy();
        proxy.setMetadata(new ObjectMetaBuilder().withNamespace("default").withName("proxy").build());
        statusCache.proxy(proxy);
        statusCache.ingress(new IngressBuilder().withNewMetadata().withNamespace("default").withName("ingress").endMetadata().build());
    }

    private <T extends StatusUpdate> T update(Class<T> type) {
        return statusCache.updates().stream().filter(type::isInstance).map(type::cast).findFirst().orElseThrow();
    }

    private static Route route(RouteMatch match, RouteOrigin origin, Service service) {
        return Route.builder(match, origin).addCluster(Cluster.of(service, 1)).build();
    }
}
