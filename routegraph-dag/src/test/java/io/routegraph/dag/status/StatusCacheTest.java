/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.Condition;

import io.routegraph.dag.model.RouteOrigin;
import io.routegraph.kubernetes.api.common.DetailedCondition;
import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.common.SubCondition;
import io.routegraph.kubernetes.api.gateway.ListenerStatus;

import static io.routegraph.dag.assertj.RouteGraphAssertions.assertThatCondition;
import static io.routegraph.dag.status.StatusFixtures.CONTROLLER;
import static io.routegraph.dag.status.StatusFixtures.EPOCH;
import static io.routegraph.dag.status.StatusFixtures.GATEWAY_REF;
import static io.routegraph.dag.status.StatusFixtures.OTHER_GATEWAY_REF;
import static io.routegraph.dag.status.StatusFixtures.TEST_CLOCK;
import static io.routegraph.dag.status.StatusFixtures.gateway;
import static io.routegraph.dag.status.StatusFixtures.ingress;
import static io.routegraph.dag.status.StatusFixtures.proxy;
import static io.routegraph.dag.status.StatusFixtures.route;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StatusCacheTest {

    private StatusCache statusCache;

    @BeforeEach
    void setUp() {
        statusCache = new StatusCache(new ConditionFactory(TEST_CLOCK), CONTROLLER);
    }

    @Test
    void proxyWithoutErrorsIsValid() {
        statusCache.proxy(proxy("root", 3));

        ProxyStatusUpdate update = single(ProxyStatusUpdate.class);
        assertThat(update.isValid()).isTrue();
        assertThat(update.currentStatus()).isEqualTo("valid");
        assertThat(update.description()).isEqualTo("Valid HTTPProxy");
        assertThat(update.generation()).isEqualTo(3);
        assertThat(update.condition()).isEqualTo(
                new DetailedCondition("Valid", "True", 3L, EPOCH, "Valid", "Valid HTTPProxy", List.of(), List.of()));
    }

    @Test
    void proxyWithErrorIsInvalid() {
        ProxyConditions conditions = statusCache.proxy(proxy("root", 1));
        conditions.addError("IncludeError", "IncludeNotFound", "include default/missing not found");
        conditions.addError("IncludeError", "IncludeNotFound", "include default/missing not found");
        conditions.addWarning("TLSError", "MinimumVersion", "1.1 is not supported");

        ProxyStatusUpdate update = single(ProxyStatusUpdate.class);
        assertThat(update.currentStatus()).isEqualTo("invalid");
        assertThat(update.description()).isEqualTo("At least one error present, see Errors for details");
        assertThat(update.condition().status()).isEqualTo("False");
        assertThat(update.condition().reason()).isEqualTo("ErrorPresent");
        assertThat(update.errors()).containsExactly(new SubCondition("IncludeError", "True", "IncludeNotFound", "include default/missing not found"));
        assertThat(update.warnings()).hasSize(1);
    }

    @Test
    void orphanedProxyHasOrphanedStatus() {
        ProxyConditions conditions = statusCache.proxy(proxy("child", 1));
        conditions.orphaned();

        ProxyStatusUpdate update = single(ProxyStatusUpdate.class);
        assertThat(conditions.isOrphaned()).isTrue();
        assertThat(update.currentStatus()).isEqualTo("orphaned");
        assertThat(update.description()).isEqualTo("this HTTPProxy is not part of a delegation chain from a root HTTPProxy");
    }

    @Test
    void orphanedProxyWithOtherErrorsIsInvalid() {
        ProxyConditions conditions = statusCache.proxy(proxy("child", 1));
        conditions.orphaned();
        conditions.addError("RouteError", "PathMatchInvalid", "bad prefix");

        assertThat(single(ProxyStatusUpdate.class).currentStatus()).isEqualTo("invalid");
    }

    @Test
    void routeParentDefaultsToAcceptedAndResolved() {
        statusCache.route(route("web", 2)).parent(GATEWAY_REF);

        RouteStatusUpdate update = single(RouteStatusUpdate.class);
        assertThat(update.controllerName()).isEqualTo(CONTROLLER);
        List<Condition> conditions = update.parent(GATEWAY_REF).orElseThrow().conditions();
        assertThatCondition(conditions, Conditions.TYPE_ACCEPTED).isAcceptedTrue().hasObservedGeneration(2L).hasLastTransitionTime(EPOCH);
        assertThatCondition(conditions, Conditions.TYPE_RESOLVED_REFS).isResolvedRefsTrue();
    }

    @Test
    void negativeConditionWinsAndMessagesAccumulate() {
        RouteConditions conditions = statusCache.route(route("web", 1));
        conditions.parent(GATEWAY_REF).unresolvedRefs("BackendNotFound", "service default/a not found");
        conditions.parent(GATEWAY_REF).unresolvedRefs("BackendNotFound", "service default/b not found");
        conditions.parent(GATEWAY_REF).notAccepted("NotAllowedByListeners", "no listener allows this route");
        conditions.parent(GATEWAY_REF).accepted();

        RouteStatusUpdate update = single(RouteStatusUpdate.class);
        assertThat(conditions.parent(GATEWAY_REF).isAccepted()).isFalse();
        assertThat(update.condition(GATEWAY_REF, Conditions.TYPE_RESOLVED_REFS)).get()
                .satisfies(c -> assertThat(c.getMessage()).isEqualTo("service default/a not found; service default/b not found"));
        assertThat(update.condition(GATEWAY_REF, Conditions.TYPE_ACCEPTED)).get()
                .satisfies(c -> assertThat(c.getReason()).isEqualTo("NotAllowedByListeners"));
    }

    @Test
    void conflictWithProxyRecordsRouteError() {
        statusCache.proxy(proxy("root", 1));

        statusCache.crossSchemaConflict(origin("HTTPProxy", "root"), "route \"prefix: /\" conflicts", false);

        assertThat(single(ProxyStatusUpdate.class).errors())
                .containsExactly(new SubCondition("RouteError", "True", "DuplicateMatchConditions", "route \"prefix: /\" conflicts"));
    }

    @Test
    void partialConflictWithRouteMarksEveryParentPartiallyInvalid() {
        RouteConditions conditions = statusCache.route(route("web", 1));
        conditions.parent(GATEWAY_REF);
        conditions.parent(OTHER_GATEWAY_REF);

        statusCache.crossSchemaConflict(origin("HTTPRoute", "web"), "conflict", true);

        RouteStatusUpdate update = single(RouteStatusUpdate.class);
        assertThatCondition(update.parent(GATEWAY_REF).orElseThrow().conditions(), Conditions.TYPE_PARTIALLY_INVALID)
                .isPartiallyInvalid("RuleMatchPartiallyConflict").hasMessage("conflict");
        assertThatCondition(update.parent(OTHER_GATEWAY_REF).orElseThrow().conditions(), Conditions.TYPE_PARTIALLY_INVALID)
                .isPartiallyInvalid("RuleMatchPartiallyConflict");
        assertThat(update.condition(GATEWAY_REF, Conditions.TYPE_ACCEPTED)).get()
                .satisfies(c -> assertThat(c.getStatus()).isEqualTo(Conditions.STATUS_TRUE));
    }

    @Test
    void fullConflictWithRouteRejectsItOnEveryParent() {
        RouteConditions conditions = statusCache.route(route("web", 1));
        conditions.parent(GATEWAY_REF).accepted();
        conditions.parent(OTHER_GATEWAY_REF);

        statusCache.crossSchemaConflict(origin("HTTPRoute", "web"), "conflict", false);

        RouteStatusUpdate update = single(RouteStatusUpdate.class);
        for (var parentRef : List.of(GATEWAY_REF, OTHER_GATEWAY_REF)) {
            assertThat(update.condition(parentRef, Conditions.TYPE_ACCEPTED)).get().satisfies(c -> {
                assertThat(c.getStatus()).isEqualTo(Conditions.STATUS_FALSE);
                assertThat(c.getReason()).isEqualTo("RuleMatchConflict");
                assertThat(c.getMessage()).isEqualTo("conflict");
            });
        }
    }

    @Test
    void fullConflictWithIngressMarksItConflicted() {
        statusCache.ingress(ingress("legacy", 1));

        statusCache.crossSchemaConflict(origin("Ingress", "legacy"), "conflict", false);

        assertThat(single(IngressStatusUpdate.class).condition(Conditions.TYPE_CONFLICTED)).get()
                .satisfies(c -> assertThat(c.getReason()).isEqualTo("RouteConflict"));
    }

    @Test
    void partialConflictWithIngressIsDistinguished() {
        statusCache.ingress(ingress("legacy", 1));

        statusCache.crossSchemaConflict(origin("Ingress", "legacy"), "conflict", true);

        assertThat(single(IngressStatusUpdate.class).condition(Conditions.TYPE_CONFLICTED)).get()
                .satisfies(c -> assertThat(c.getReason()).isEqualTo("RoutePartiallyConflict"));
    }

    @Test
    void conflictWithUnknownObjectIsABug() {
        assertThatThrownBy(() -> statusCache.crossSchemaConflict(origin("HTTPProxy", "ghost"), "conflict", false))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void gatewayDefaultsToAcceptedAndProgrammed() {
        GatewayConditions conditions = statusCache.gateway(gateway("main", 4));
        conditions.listener("http-80").supportedKinds(List.of()).attachRoute();

        GatewayStatusUpdate update = single(GatewayStatusUpdate.class);
        assertThatCondition(update.conditions(), Conditions.TYPE_ACCEPTED).isAcceptedTrue().hasObservedGeneration(4L);
        assertThatCondition(update.conditions(), Conditions.TYPE_PROGRAMMED).hasStatus(Conditions.STATUS_TRUE);
        ListenerStatus listener = update.listener("http-80").orElseThrow();
        assertThat(listener.attachedRoutes()).isEqualTo(1);
        assertThatCondition(listener.conditions(), Conditions.TYPE_CONFLICTED).hasStatus(Conditions.STATUS_FALSE).hasReason("NoConflicts");
        assertThatCondition(listener.conditions(), Conditions.TYPE_PROGRAMMED).hasStatus(Conditions.STATUS_TRUE);
    }

    @Test
    void invalidListenerIsNotProgrammed() {
        GatewayConditions.ListenerConditions listener = statusCache.gateway(gateway("main", 1)).listener("http-80");
        listener.conflicted("HostnameConflict", "another listener uses the hostname");

        GatewayStatusUpdate update = single(GatewayStatusUpdate.class);
        assertThat(listener.isValid()).isFalse();
        List<Condition> conditions = update.listener("http-80").orElseThrow().conditions();
        assertThatCondition(conditions, Conditions.TYPE_CONFLICTED).isConflicted("HostnameConflict");
        assertThatCondition(conditions, Conditions.TYPE_PROGRAMMED).isProgrammedFalse().hasReason("Invalid");
    }

    @Test
    void ingressDefaultsToResolved() {
        statusCache.ingress(ingress("legacy", 1)).tlsError("SecretNotFound", "tls secret missing");

        IngressStatusUpdate update = single(IngressStatusUpdate.class);
        assertThat(update.condition(Conditions.TYPE_RESOLVED_REFS)).get().satisfies(c -> assertThat(c.getStatus()).isEqualTo("True"));
        assertThat(update.condition(IngressConditions.TYPE_TLS_ERROR)).get().satisfies(c -> assertThat(c.getStatus()).isEqualTo("True"));
    }

    @Test
    void updatesAreOrderedByKindThenName() {
        statusCache.ingress(ingress("a", 1));
        statusCache.route(route("b", 1));
        statusCache.proxy(proxy("z", 1));
        statusCache.proxy(proxy("a", 1));
        statusCache.gateway(gateway("main", 1));

        assertThat(statusCache.updates()).extracting(StatusUpdate::key).extracting(ObjectKey::toString)
                .containsExactly("Gateway default/main", "HTTPProxy default/a", "HTTPProxy default/z", "HTTPRoute default/b", "Ingress default/a");
    }

    private <T extends StatusUpdate> T single(Class<T> type) {
        List<StatusUpdate> updates = statusCache.updates();
        assertThat(updates).hasSize(1);
        return type.cast(updates.get(0));
    }

    private static RouteOrigin origin(String kind, String name) {
        return new RouteOrigin(kind, new NamespacedName("default", name), null);
    }
}
