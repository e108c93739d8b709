/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import edu.umd.cs.findbugs.annotations.Nullable;

public record DirectResponse(int statusCode, @Nullable String body) {

    public static final DirectResponse BAD_GATEWAY = new DirectResponse(502, null);
    public static final DirectResponse SERVICE_UNAVAILABLE = new DirectResponse(503, null);
    public static final DirectResponse INTERNAL_SERVER_ERROR = new DirectResponse(500, null);
}
