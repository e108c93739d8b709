/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * The subset of the {@code gateway.networking.k8s.io} API consumed by the graph builder.
 */
@DefaultAnnotation(NonNull.class)
package io.routegraph.kubernetes.api.gateway;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.NonNull;
