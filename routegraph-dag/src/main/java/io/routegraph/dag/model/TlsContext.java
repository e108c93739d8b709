/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param secret the serving certificate, absent for passthrough
 * @param minimumProtocolVersion {@code 1.2} or {@code 1.3}
 * @param passthrough the stream is forwarded without termination
 * @param clientValidation downstream certificate validation
 */
public record TlsContext(@Nullable TlsSecret secret,
                         String minimumProtocolVersion,
                         boolean passthrough,
                         @Nullable PeerValidation clientValidation) {

    public static TlsContext forPassthrough() {
        return new TlsContext(null, "1.2", true, null);
    }
}
