/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

/**
 * The order in which the rate limit and external authorization filters run on a virtual host.
 */
public enum FilterOrder {
    RATE_LIMIT_THEN_AUTHORIZATION,
    AUTHORIZATION_THEN_RATE_LIMIT
}
