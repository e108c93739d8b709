/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HTTPRequestRedirectFilter(
                                        @Nullable String scheme,
                                        @Nullable String hostname,
                                        @Nullable HTTPPathModifier path,
                                        @Nullable Integer port,
                                        @Nullable Integer statusCode) {}
