/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.LinkedHashMap;
import java.util.Map;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.routegraph.kubernetes.api.gateway.ParentReference;
import io.routegraph.kubernetes.api.gateway.RouteParentStatus;

/**
 * Conditions of one gateway route, kept separately for each parent reference.
 */
public class RouteConditions {

    public static final String REASON_RULE_MATCH_CONFLICT = "RuleMatchConflict";
    public static final String REASON_RULE_MATCH_PARTIALLY_CONFLICT = "RuleMatchPartiallyConflict";

    private final ObjectKey key;
    private final long generation;
    private final Class<? extends HasMetadata> resourceType;
    private final ConditionFactory factory;
    private final Map<ParentReference, ConditionSet> parents = new LinkedHashMap<>();

    RouteConditions(ObjectKey key, long generation, Class<? extends HasMetadata> resourceType, ConditionFactory factory) {
        this.key = key;
        this.generation = generation;
        this.resourceType = resourceType;
        this.factory = factory;
    }

    public ParentConditions parent(ParentReference parentRef) {
        return new ParentConditions(parents.computeIfAbsent(parentRef, p -> new ConditionSet(factory, generation)));
    }

    void conflictOnAllParents(boolean partial, String message) {
        for (ConditionSet set : parents.values()) {
            if (partial) {
                new ParentConditions(set).partiallyInvalid(REASON_RULE_MATCH_PARTIALLY_CONFLICT, message);
            }
            else {
                new ParentConditions(set).notAccepted(REASON_RULE_MATCH_CONFLICT, message);
            }
        }
    }

    RouteStatusUpdate toUpdate(String controllerName) {
        return new RouteStatusUpdate(key, generation, resourceType, controllerName, parents.entrySet().stream()
                .map(e -> {
                    ConditionSet set = e.getValue();
                    set.addIfAbsent(Conditions.TYPE_ACCEPTED, Conditions.STATUS_TRUE, Conditions.TYPE_ACCEPTED, "Accepted " + key.kind());
                    set.addIfAbsent(Conditions.TYPE_RESOLVED_REFS, Conditions.STATUS_TRUE, Conditions.TYPE_RESOLVED_REFS, "resolved all references");
                    return new RouteParentStatus(e.getKey(), controllerName, set.toList());
                })
                .toList());
    }

    /**
     * The conditions a route carries for one of its parents.
     */
    public static final class ParentConditions {

        private final ConditionSet conditions;

        ParentConditions(ConditionSet conditions) {
            this.conditions = conditions;
        }

        public ParentConditions notAccepted(String reason, String message) {
            conditions.add(Conditions.TYPE_ACCEPTED, Conditions.STATUS_FALSE, reason, message, Conditions.STATUS_TRUE);
            return this;
        }

        public ParentConditions accepted() {
            conditions.add(Conditions.TYPE_ACCEPTED, Conditions.STATUS_TRUE, Conditions.TYPE_ACCEPTED, "Accepted", Conditions.STATUS_TRUE);
            return this;
        }

        public ParentConditions unresolvedRefs(String reason, String message) {
            conditions.add(Conditions.TYPE_RESOLVED_REFS, Conditions.STATUS_FALSE, reason, message, Conditions.STATUS_TRUE);
            return this;
        }

        public ParentConditions partiallyInvalid(String reason, String message) {
            conditions.add(Conditions.TYPE_PARTIALLY_INVALID, Conditions.STATUS_TRUE, reason, message, Conditions.STATUS_FALSE);
            return this;
        }

        public boolean isAccepted() {
            return !conditions.has(Conditions.TYPE_ACCEPTED, Conditions.STATUS_FALSE);
        }
    }
}
