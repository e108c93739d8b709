/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.routegraph.kubernetes.api.gateway.ListenerStatus;
import io.routegraph.kubernetes.api.gateway.RouteGroupKind;

/**
 * Conditions of the managed Gateway and of each of its listeners.
 */
public class GatewayConditions {

    private final ObjectKey key;
    private final long generation;
    private final ConditionFactory factory;
    private final ConditionSet gateway;
    private final Map<String, ListenerConditions> listeners = new LinkedHashMap<>();

    GatewayConditions(ObjectKey key, long generation, ConditionFactory factory) {
        this.key = key;
        this.generation = generation;
        this.factory = factory;
        this.gateway = new ConditionSet(factory, generation);
    }

    public void notAccepted(String reason, String message) {
        gateway.add(Conditions.TYPE_ACCEPTED, Conditions.STATUS_FALSE, reason, message, Conditions.STATUS_TRUE);
    }

    public void notProgrammed(String reason, String message) {
        gateway.add(Conditions.TYPE_PROGRAMMED, Conditions.STATUS_FALSE, reason, message, Conditions.STATUS_TRUE);
    }

    public ListenerConditions listener(String name) {
        return listeners.computeIfAbsent(name, n -> new ListenerConditions(new ConditionSet(factory, generation)));
    }

    GatewayStatusUpdate toUpdate() {
        gateway.addIfAbsent(Conditions.TYPE_ACCEPTED, Conditions.STATUS_TRUE, Conditions.TYPE_ACCEPTED, "Gateway is accepted");
        gateway.addIfAbsent(Conditions.TYPE_PROGRAMMED, Conditions.STATUS_TRUE, Conditions.TYPE_PROGRAMMED, "Valid Gateway");
        List<ListenerStatus> listenerStatuses = listeners.entrySet().stream()
                .map(e -> e.getValue().toStatus(e.getKey()))
                .toList();
        return new GatewayStatusUpdate(key, generation, gateway.toList(), listenerStatuses);
    }

    /**
     * Conditions, supported kinds and the attached route count of one listener.
     */
    public static final class ListenerConditions {

        private final ConditionSet conditions;
        private List<RouteGroupKind> supportedKinds = List.of();
        private int attachedRoutes;

        ListenerConditions(ConditionSet conditions) {
            this.conditions = conditions;
        }

        public ListenerConditions notAccepted(String reason, String message) {
            conditions.add(Conditions.TYPE_ACCEPTED, Conditions.STATUS_FALSE, reason, message, Conditions.STATUS_TRUE);
            conditions.add(Conditions.TYPE_PROGRAMMED, Conditions.STATUS_FALSE, "Invalid", "Invalid listener, see other listener conditions for details",
                    Conditions.STATUS_TRUE);
            return this;
        }

        public ListenerConditions unresolvedRefs(String reason, String message) {
            conditions.add(Conditions.TYPE_RESOLVED_REFS, Conditions.STATUS_FALSE, reason, message, Conditions.STATUS_TRUE);
            conditions.add(Conditions.TYPE_PROGRAMMED, Conditions.STATUS_FALSE, "Invalid", "Invalid listener, see other listener conditions for details",
                    Conditions.STATUS_TRUE);
            return this;
        }

        /**
         * @param reason the reason
         * @param message names the unsupported kinds
         * @param noneSupported none of the declared kinds is supported, so no route can attach
         */
        public ListenerConditions invalidRouteKinds(String reason, String message, boolean noneSupported) {
            conditions.add(Conditions.TYPE_RESOLVED_REFS, Conditions.STATUS_FALSE, reason, message, Conditions.STATUS_TRUE);
            if (noneSupported) {
                conditions.add(Conditions.TYPE_PROGRAMMED, Conditions.STATUS_FALSE, "Invalid", "Invalid listener, see other listener conditions for details",
                        Conditions.STATUS_TRUE);
            }
            return this;
        }

        public ListenerConditions conflicted(String reason, String message) {
            conditions.add(Conditions.TYPE_CONFLICTED, Conditions.STATUS_TRUE, reason, message, Conditions.STATUS_FALSE);
            conditions.add(Conditions.TYPE_PROGRAMMED, Conditions.STATUS_FALSE, "Invalid", "Invalid listener, see other listener conditions for details",
                    Conditions.STATUS_TRUE);
            return this;
        }

        public ListenerConditions supportedKinds(List<RouteGroupKind> kinds) {
            this.supportedKinds = List.copyOf(kinds);
            return this;
        }

        public void attachRoute() {
            attachedRoutes++;
        }

        public boolean isValid() {
            return !conditions.has(Conditions.TYPE_PROGRAMMED, Conditions.STATUS_FALSE);
        }

        public int attachedRoutes() {
            return attachedRoutes;
        }

        ListenerStatus toStatus(String name) {
            conditions.addIfAbsent(Conditions.TYPE_ACCEPTED, Conditions.STATUS_TRUE, Conditions.TYPE_ACCEPTED, "Listener accepted");
            conditions.addIfAbsent(Conditions.TYPE_RESOLVED_REFS, Conditions.STATUS_TRUE, Conditions.TYPE_RESOLVED_REFS, "Listener references resolved");
            conditions.addIfAbsent(Conditions.TYPE_CONFLICTED, Conditions.STATUS_FALSE, "NoConflicts", "No conflicts");
            conditions.addIfAbsent(Conditions.TYPE_PROGRAMMED, Conditions.STATUS_TRUE, Conditions.TYPE_PROGRAMMED, "Valid listener");
            return new ListenerStatus(name, supportedKinds, attachedRoutes, conditions.toList());
        }
    }
}
