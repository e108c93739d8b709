/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

/**
 * Condition types and statuses used across the source schemas.
 */
public final class Conditions {

    public static final String STATUS_TRUE = "True";
    public static final String STATUS_FALSE = "False";
    public static final String STATUS_UNKNOWN = "Unknown";

    public static final String TYPE_VALID = "Valid";
    public static final String TYPE_ACCEPTED = "Accepted";
    public static final String TYPE_RESOLVED_REFS = "ResolvedRefs";
    public static final String TYPE_PARTIALLY_INVALID = "PartiallyInvalid";
    public static final String TYPE_PROGRAMMED = "Programmed";
    public static final String TYPE_CONFLICTED = "Conflicted";

    private Conditions() {
    }
}
