/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.time.Duration;

public record HealthCheck(String path,
                          String host,
                          Duration interval,
                          Duration timeout,
                          long unhealthyThreshold,
                          long healthyThreshold) {}
