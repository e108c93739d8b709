/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

/**
 * Conditions of one Ingress.
 */
public class IngressConditions {

    public static final String TYPE_TLS_ERROR = "TLSError";
    public static final String TYPE_INVALID_PATH = "InvalidPath";
    public static final String REASON_ROUTE_CONFLICT = "RouteConflict";
    public static final String REASON_ROUTE_PARTIALLY_CONFLICT = "RoutePartiallyConflict";

    private final ObjectKey key;
    private final long generation;
    private final ConditionSet conditions;

    IngressConditions(ObjectKey key, long generation, ConditionFactory factory) {
        this.key = key;
        this.generation = generation;
        this.conditions = new ConditionSet(factory, generation);
    }

    public void tlsError(String reason, String message) {
        conditions.add(TYPE_TLS_ERROR, Conditions.STATUS_TRUE, reason, message, Conditions.STATUS_FALSE);
    }

    public void unresolvedRefs(String reason, String message) {
        conditions.add(Conditions.TYPE_RESOLVED_REFS, Conditions.STATUS_FALSE, reason, message, Conditions.STATUS_TRUE);
    }

    /**
     * A path that cannot be turned into a route, such as a regex the engine refuses.
     */
    public void invalidPath(String reason, String message) {
        conditions.add(TYPE_INVALID_PATH, Conditions.STATUS_TRUE, reason, message, Conditions.STATUS_FALSE);
    }

    public void conflicted(String reason, String message) {
        conditions.add(Conditions.TYPE_CONFLICTED, Conditions.STATUS_TRUE, reason, message, Conditions.STATUS_FALSE);
    }

    IngressStatusUpdate toUpdate() {
        conditions.addIfAbsent(Conditions.TYPE_RESOLVED_REFS, Conditions.STATUS_TRUE, Conditions.TYPE_RESOLVED_REFS, "resolved all references");
        return new IngressStatusUpdate(key, generation, conditions.toList());
    }
}
