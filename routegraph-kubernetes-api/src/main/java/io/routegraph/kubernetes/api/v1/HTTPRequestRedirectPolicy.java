/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HTTPRequestRedirectPolicy(
                                        @Nullable String scheme,
                                        @Nullable String hostname,
                                        @Nullable Integer port,
                                        @Nullable Integer statusCode,
                                        @Nullable String path,
                                        @Nullable String prefix) {}
