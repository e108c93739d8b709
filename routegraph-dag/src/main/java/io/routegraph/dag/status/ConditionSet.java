/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;

/**
 * Conditions of one object, or one parent of one object, accumulated during a build.
 * <p>At most one condition exists per type. A condition that is not in its positive state is never replaced by a
 * positive one, and further problems of the same type append their messages.</p>
 */
class ConditionSet {

    private final Map<String, Condition> conditions = new LinkedHashMap<>();
    private final ConditionFactory factory;
    private final long generation;

    ConditionSet(ConditionFactory factory, long generation) {
        this.factory = factory;
        this.generation = generation;
    }

    /**
     * @param type the condition type
     * @param status the status
     * @param reason the reason
     * @param message the message
     * @param positiveStatus the status of this type that means all is well
     */
    void add(String type, String status, String reason, String message, String positiveStatus) {
        Condition existing = conditions.get(type);
        if (existing == null) {
            conditions.put(type, factory.newCondition(generation, type, status, reason, message));
            return;
        }
        boolean existingPositive = positiveStatus.equals(existing.getStatus());
        boolean newPositive = positiveStatus.equals(status);
        if (!existingPositive && newPositive) {
            return;
        }
        if (existingPositive && !newPositive) {
            conditions.put(type, factory.newCondition(generation, type, status, reason, message));
            return;
        }
        if (!newPositive && !existing.getMessage().contains(message)) {
            conditions.put(type, new ConditionBuilder(existing).withMessage(existing.getMessage() + "; " + message).build());
        }
    }

    void addIfAbsent(String type, String status, String reason, String message) {
        if (!conditions.containsKey(type)) {
            conditions.put(type, factory.newCondition(generation, type, status, reason, message));
        }
    }

    boolean has(String type, String status) {
        Condition condition = conditions.get(type);
        return condition != null && status.equals(condition.getStatus());
    }

    List<Condition> toList() {
        return List.copyOf(conditions.values());
    }
}
