/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.List;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.routegraph.kubernetes.api.common.DetailedCondition;
import io.routegraph.kubernetes.api.common.SubCondition;
import io.routegraph.kubernetes.api.v1.HTTPProxy;
import io.routegraph.kubernetes.api.v1.HTTPProxyStatus;

/**
 * The status of an HTTPProxy.
 *
 * @param key the proxy
 * @param generation the generation processed
 * @param currentStatus {@code valid}, {@code invalid} or {@code orphaned}
 * @param description one line summary
 * @param condition the {@code Valid} condition carrying every error and warning found
 */
public record ProxyStatusUpdate(
                                ObjectKey key,
                                long generation,
                                String currentStatus,
                                String description,
                                DetailedCondition condition)
        implements StatusUpdate {

    public static final String STATUS_VALID = "valid";
    public static final String STATUS_INVALID = "invalid";
    public static final String STATUS_ORPHANED = "orphaned";

    public List<SubCondition> errors() {
        return condition.errors();
    }

    public List<SubCondition> warnings() {
        return condition.warnings();
    }

    public boolean isValid() {
        return STATUS_VALID.equals(currentStatus);
    }

    @Override
    public Class<? extends HasMetadata> resourceType() {
        return HTTPProxy.class;
    }

    @Override
    public boolean applyTo(HasMetadata live) {
        HTTPProxy proxy = (HTTPProxy) live;
        DetailedCondition merged = condition;
        HTTPProxyStatus stored = proxy.getStatus();
        if (stored != null) {
            merged = stored.conditions().stream()
                    .filter(c -> condition.type().equals(c.type()))
                    .findFirst()
                    .map(c -> withTransitionTime(ConditionMerger.transitionTime(c.status(), c.lastTransitionTime(), condition.status(),
                            condition.lastTransitionTime())))
                    .orElse(condition);
        }
        proxy.setStatus(new HTTPProxyStatus(currentStatus, description, List.of(merged)));
        return true;
    }

    private DetailedCondition withTransitionTime(String lastTransitionTime) {
        return new DetailedCondition(condition.type(), condition.status(), condition.observedGeneration(), lastTransitionTime, condition.reason(),
                condition.message(), condition.errors(), condition.warnings());
    }
}
