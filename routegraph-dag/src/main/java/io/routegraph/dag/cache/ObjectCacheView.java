/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.cache;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;

import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.gateway.GRPCRoute;
import io.routegraph.kubernetes.api.gateway.Gateway;
import io.routegraph.kubernetes.api.gateway.HTTPRoute;
import io.routegraph.kubernetes.api.gateway.ReferenceGrant;
import io.routegraph.kubernetes.api.gateway.TCPRoute;
import io.routegraph.kubernetes.api.gateway.TLSRoute;
import io.routegraph.kubernetes.api.v1.HTTPProxy;
import io.routegraph.kubernetes.api.v1.TLSCertificateDelegation;

/**
 * A point-in-time, read-only view of the cluster objects a build reads.
 * <p>Collections are ordered by namespace and then name, so that processors which iterate them behave the same
 * whatever order the objects arrived in. Lookups of objects that do not exist return empty rather than failing.</p>
 */
public interface ObjectCacheView {

    List<HTTPProxy> httpProxies();

    Optional<HTTPProxy> httpProxy(NamespacedName name);

    List<TLSCertificateDelegation> certificateDelegations(String namespace);

    List<Ingress> ingresses();

    Optional<Secret> secret(NamespacedName name);

    Optional<Service> service(NamespacedName name);

    /**
     * @param namespace the namespace
     * @return the labels of the namespace, or an empty map if it is unknown
     */
    Map<String, String> namespaceLabels(String namespace);

    Optional<Gateway> gateway(NamespacedName name);

    List<HTTPRoute> httpRoutes();

    List<GRPCRoute> grpcRoutes();

    List<TLSRoute> tlsRoutes();

    List<TCPRoute> tcpRoutes();

    List<ReferenceGrant> referenceGrants(String namespace);
}
