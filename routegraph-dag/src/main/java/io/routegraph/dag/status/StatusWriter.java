/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

/**
 * Persists computed conditions back to the objects they belong to.
 */
public interface StatusWriter {

    /**
     * Writes one update. Implementations may block, and may throw if the write fails.
     * @param update the update
     */
    void write(StatusUpdate update);
}
