/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import edu.umd.cs.findbugs.annotations.Nullable;

public record Redirect(@Nullable String scheme,
                       @Nullable String hostname,
                       @Nullable Integer port,
                       int statusCode,
                       @Nullable String path,
                       @Nullable String prefix) {

    public static Redirect toHttps() {
        return new Redirect("https", null, null, 301, null, null);
    }
}
