/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.time.Duration;
import java.util.SortedMap;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * An external authorization server and the virtual host defaults for it.
 *
 * @param service the authorization backend
 * @param failOpen allow requests when the server is unavailable
 * @param responseTimeout how long to wait for the decision
 * @param defaultContext context entries sent with every check
 */
public record ExternalAuthorization(Service service,
                                    boolean failOpen,
                                    @Nullable Duration responseTimeout,
                                    SortedMap<String, String> defaultContext) {}
