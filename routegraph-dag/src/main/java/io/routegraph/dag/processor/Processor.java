/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import io.routegraph.dag.builder.BuildContext;

/**
 * Translates the objects of one source schema into graph fragments and conditions.
 * <p>A processor must not fail the build because of bad input; problems with an object become conditions on it.</p>
 */
public interface Processor {

    /**
     * @param context the build in progress
     */
    void run(BuildContext context);
}
