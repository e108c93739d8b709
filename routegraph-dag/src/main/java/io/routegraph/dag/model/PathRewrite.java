/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Either the matched prefix is replaced, or the whole path is.
 *
 * @param prefix the matched prefix being replaced
 * @param replacement the replacement for the prefix
 * @param fullPath the replacement path
 */
public record PathRewrite(@Nullable String prefix, @Nullable String replacement, @Nullable String fullPath) {

    public static PathRewrite replacePrefix(String prefix, String replacement) {
        return new PathRewrite(prefix, replacement, null);
    }

    public static PathRewrite replaceFullPath(String fullPath) {
        return new PathRewrite(null, null, fullPath);
    }
}
