/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param secretName the serving certificate, {@code name} or {@code namespace/name}
 * @param passthrough forward the TLS stream to the backend without terminating it
 * @param minimumProtocolVersion {@code 1.2} or {@code 1.3}
 * @param clientValidation client certificate validation
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TLS(
                  @Nullable String secretName,
                  boolean passthrough,
                  @Nullable String minimumProtocolVersion,
                  @Nullable DownstreamValidation clientValidation) {}
