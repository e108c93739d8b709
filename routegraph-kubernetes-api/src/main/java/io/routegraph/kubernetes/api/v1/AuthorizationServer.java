/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param extensionRef the Service implementing the authorization protocol
 * @param authPolicy the default authorization policy for routes on this virtual host
 * @param responseTimeout how long to wait for a check response
 * @param failOpen allow the request when the server cannot be reached
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizationServer(
                                  @Nullable ExtensionServiceReference extensionRef,
                                  @Nullable AuthorizationPolicy authPolicy,
                                  @Nullable String responseTimeout,
                                  boolean failOpen) {}
