/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.ArrayList;
import java.util.List;

import io.routegraph.kubernetes.api.common.DetailedCondition;
import io.routegraph.kubernetes.api.common.SubCondition;

/**
 * Errors and warnings found on one HTTPProxy during a build.
 * <p>Once any error is recorded the proxy stays invalid for the rest of the build.</p>
 */
public class ProxyConditions {

    public static final String REASON_VALID = "Valid";
    public static final String REASON_ERROR_PRESENT = "ErrorPresent";
    public static final String ERROR_ORPHANED = "Orphaned";

    static final String MESSAGE_VALID = "Valid HTTPProxy";
    static final String MESSAGE_ERROR_PRESENT = "At least one error present, see Errors for details";
    static final String MESSAGE_ORPHANED = "this HTTPProxy is not part of a delegation chain from a root HTTPProxy";

    private final ObjectKey key;
    private final long generation;
    private final List<SubCondition> errors = new ArrayList<>();
    private final List<SubCondition> warnings = new ArrayList<>();

    ProxyConditions(ObjectKey key, long generation) {
        this.key = key;
        this.generation = generation;
    }

    /**
     * @param errorType the area of the problem, for example {@code IncludeError}
     * @param reason the specific reason
     * @param message human readable detail
     */
    public void addError(String errorType, String reason, String message) {
        SubCondition error = new SubCondition(errorType, Conditions.STATUS_TRUE, reason, message);
        if (!errors.contains(error)) {
            errors.add(error);
        }
    }

    public void addWarning(String warningType, String reason, String message) {
        SubCondition warning = new SubCondition(warningType, Conditions.STATUS_TRUE, reason, message);
        if (!warnings.contains(warning)) {
            warnings.add(warning);
        }
    }

    public void orphaned() {
        addError(ERROR_ORPHANED, ERROR_ORPHANED, MESSAGE_ORPHANED);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean isOrphaned() {
        return errors.stream().anyMatch(e -> ERROR_ORPHANED.equals(e.type()));
    }

    ProxyStatusUpdate toUpdate(ConditionFactory factory) {
        DetailedCondition condition;
        String currentStatus;
        String description;
        if (errors.isEmpty()) {
            condition = new DetailedCondition(Conditions.TYPE_VALID, Conditions.STATUS_TRUE, generation, factory.now(), REASON_VALID, MESSAGE_VALID,
                    List.of(), warnings);
            currentStatus = ProxyStatusUpdate.STATUS_VALID;
            description = MESSAGE_VALID;
        }
        else {
            condition = new DetailedCondition(Conditions.TYPE_VALID, Conditions.STATUS_FALSE, generation, factory.now(), REASON_ERROR_PRESENT,
                    MESSAGE_ERROR_PRESENT, errors, warnings);
            boolean onlyOrphaned = errors.stream().allMatch(e -> ERROR_ORPHANED.equals(e.type()));
            currentStatus = onlyOrphaned ? ProxyStatusUpdate.STATUS_ORPHANED : ProxyStatusUpdate.STATUS_INVALID;
            description = onlyOrphaned ? MESSAGE_ORPHANED : MESSAGE_ERROR_PRESENT;
        }
        return new ProxyStatusUpdate(key, generation, currentStatus, description, condition);
    }
}
