/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;

import io.routegraph.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Combines newly computed conditions with those already stored on an object.
 * <p>The new conditions replace the stored ones entirely, except that a condition whose status has not changed keeps
 * its stored transition time.</p>
 */
public final class ConditionMerger {

    // we are aiming for a deterministic ordering, so we order by status if observed generation and last transition time are equal
    @VisibleForTesting
    static final Comparator<Condition> FRESHEST_CONDITION = Comparator.comparing(Condition::getObservedGeneration, Comparator.nullsFirst(Long::compareTo))
            .thenComparing(Condition::getLastTransitionTime, Comparator.nullsFirst(String::compareTo))
            .thenComparing(Condition::getStatus, Comparator.nullsFirst(String::compareTo));

    private ConditionMerger() {
    }

    /**
     * @param stored the conditions currently on the object, possibly with more than one per type
     * @param computed the conditions from the latest build
     * @return the conditions to store
     */
    public static List<Condition> merge(List<Condition> stored, List<Condition> computed) {
        Map<String, Condition> freshestStored = freshestPerType(stored);
        return computed.stream()
                .map(c -> retainTransitionTime(freshestStored.get(c.getType()), c))
                .toList();
    }

    @VisibleForTesting
    static Map<String, Condition> freshestPerType(List<Condition> conditions) {
        // There _should_ be at most one condition per type, but we assume there may be more than one
        // and keep the one with the largest observedGeneration, then the latest transition time
        return conditions.stream()
                .filter(c -> c.getType() != null)
                .collect(Collectors.toMap(Condition::getType, c -> c, (a, b) -> FRESHEST_CONDITION.compare(a, b) < 0 ? b : a));
    }

    private static Condition retainTransitionTime(@Nullable Condition stored, Condition computed) {
        if (stored == null || stored.getLastTransitionTime() == null || !Objects.equals(stored.getStatus(), computed.getStatus())) {
            return computed;
        }
        return new ConditionBuilder(computed)
                .withLastTransitionTime(stored.getLastTransitionTime())
                .build();
    }

    /**
     * @param storedStatus the stored status, if any
     * @param storedTime the stored transition time, if any
     * @param computedStatus the newly computed status
     * @param computedTime the newly computed transition time
     * @return the transition time to store
     */
    static String transitionTime(@Nullable String storedStatus, @Nullable String storedTime, String computedStatus, String computedTime) {
        return storedTime != null && computedStatus.equals(storedStatus) ? storedTime : computedTime;
    }
}
