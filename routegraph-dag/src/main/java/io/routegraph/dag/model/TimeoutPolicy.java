/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.time.Duration;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A {@link Duration#ZERO} timeout disables the timeout. An absent timeout uses the proxy default.
 *
 * @param response the time allowed for the whole response
 * @param idle the time a request may be idle
 */
public record TimeoutPolicy(@Nullable Duration response, @Nullable Duration idle) {
    public static final TimeoutPolicy DEFAULT = new TimeoutPolicy(null, null);
}
