/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * A virtual host and its routes, possibly delegating part of its route space to other HTTPProxies.
 */
@Group("routegraph.io")
@Version("v1")
public class HTTPProxy extends CustomResource<HTTPProxySpec, HTTPProxyStatus> implements Namespaced {
}
