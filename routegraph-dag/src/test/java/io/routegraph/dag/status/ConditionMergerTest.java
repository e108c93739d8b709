/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;

import static io.routegraph.dag.assertj.RouteGraphAssertions.assertThat;
import static org.assertj.core.api.Assertions.assertThat;

class ConditionMergerTest {

    private static final String EARLIER = "2024-01-01T00:00:00Z";
    private static final String LATER = "2024-06-01T00:00:00Z";

    @Test
    void unchangedStatusKeepsStoredTransitionTime() {
        List<Condition> merged = ConditionMerger.merge(
                List.of(condition("Accepted", "True", 1L, EARLIER)),
                List.of(condition("Accepted", "True", 2L, LATER)));

        assertThat(merged).singleElement().satisfies(c -> assertThat(c).hasLastTransitionTime(EARLIER).hasObservedGeneration(2L));
    }

    @Test
    void changedStatusTakesComputedTransitionTime() {
        List<Condition> merged = ConditionMerger.merge(
                List.of(condition("Accepted", "True", 1L, EARLIER)),
                List.of(condition("Accepted", "False", 2L, LATER)));

        assertThat(merged).singleElement().satisfies(c -> assertThat(c).hasLastTransitionTime(LATER).hasStatus("False"));
    }

    @Test
    void newTypeTakesComputedTransitionTime() {
        List<Condition> merged = ConditionMerger.merge(
                List.of(condition("Accepted", "True", 1L, EARLIER)),
                List.of(condition("ResolvedRefs", "True", 1L, LATER)));

        assertThat(merged).singleElement().satisfies(c -> assertThat(c).hasType("ResolvedRefs").hasLastTransitionTime(LATER));
    }

    @Test
    void storedConditionsNotComputedAreDropped() {
        List<Condition> merged = ConditionMerger.merge(
                List.of(condition("Accepted", "True", 1L, EARLIER), condition("Stale", "True", 1L, EARLIER)),
                List.of(condition("Accepted", "True", 1L, LATER)));

        assertThat(merged).extracting(Condition::getType).containsExactly("Accepted");
    }

    @Test
    void freshestStoredConditionWinsPerType() {
        Condition older = condition("Accepted", "True", 1L, EARLIER);
        Condition newer = condition("Accepted", "False", 2L, EARLIER);
        Condition untyped = condition(null, "True", 3L, LATER);

        Map<String, Condition> freshest = ConditionMerger.freshestPerType(List.of(newer, untyped, older));

        assertThat(freshest).containsOnlyKeys("Accepted").containsEntry("Accepted", newer);
    }

    @Test
    void freshnessFallsBackToTransitionTimeThenStatus() {
        Condition earlier = condition("Accepted", "True", 1L, EARLIER);
        Condition later = condition("Accepted", "True", 1L, LATER);
        Condition falseStatus = condition("Accepted", "False", 1L, LATER);

        assertThat(ConditionMerger.FRESHEST_CONDITION.compare(earlier, later)).isNegative();
        assertThat(ConditionMerger.FRESHEST_CONDITION.compare(falseStatus, later)).isNegative();
    }

    @Test
    void transitionTimeForSubConditions() {
        assertThat(ConditionMerger.transitionTime("True", EARLIER, "True", LATER)).isEqualTo(EARLIER);
        assertThat(ConditionMerger.transitionTime("False", EARLIER, "True", LATER)).isEqualTo(LATER);
        assertThat(ConditionMerger.transitionTime(null, null, "True", LATER)).isEqualTo(LATER);
    }

    private static Condition condition(String type, String status, Long generation, String time) {
        return new ConditionBuilder()
                .withType(type)
                .withStatus(status)
                .withObservedGeneration(generation)
                .withLastTransitionTime(time)
                .withReason(type)
                .withMessage("")
                .build();
    }
}
