/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.builder;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A defect in the builder itself. The build is abandoned and the previous snapshot stays in service.
 */
public class DagBuildException extends RuntimeException {

    private final transient @Nullable Object object;

    /**
     * @param message description of the failure
     * @param object the object being processed when the defect surfaced, if any
     * @param cause the underlying exception
     */
    public DagBuildException(String message, @Nullable Object object, Throwable cause) {
        super(message, cause);
        this.object = object;
    }

    @Nullable
    public Object getObject() {
        return object;
    }
}
