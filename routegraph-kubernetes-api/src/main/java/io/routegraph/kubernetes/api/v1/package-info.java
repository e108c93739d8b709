/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * The {@code routegraph.io/v1} API: the delegating {@link io.routegraph.kubernetes.api.v1.HTTPProxy} and
 * {@link io.routegraph.kubernetes.api.v1.TLSCertificateDelegation}.
 */
@DefaultAnnotation(NonNull.class)
package io.routegraph.kubernetes.api.v1;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.NonNull;
