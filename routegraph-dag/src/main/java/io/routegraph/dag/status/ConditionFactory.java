/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.time.Clock;
import java.time.temporal.ChronoUnit;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;

/**
 * Creates conditions stamped with the time of the build that computed them.
 */
public class ConditionFactory {

    private final Clock clock;

    public ConditionFactory(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the current time in the RFC 3339 form Kubernetes uses, to second precision
     */
    public String now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();
    }

    ConditionBuilder newConditionBuilder(long observedGeneration) {
        return new ConditionBuilder()
                .withLastTransitionTime(now())
                .withObservedGeneration(observedGeneration);
    }

    public Condition newCondition(long observedGeneration, String type, String status, String reason, String message) {
        return newConditionBuilder(observedGeneration)
                .withType(type)
                .withStatus(status)
                .withReason(reason)
                .withMessage(message)
                .build();
    }

    public Condition newTrueCondition(long observedGeneration, String type, String message) {
        return newCondition(observedGeneration, type, Conditions.STATUS_TRUE, type, message);
    }

    public Condition newFalseCondition(long observedGeneration, String type, String reason, String message) {
        return newCondition(observedGeneration, type, Conditions.STATUS_FALSE, reason, message);
    }
}
