/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.status;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.routegraph.dag.ResourcesUtil;
import io.routegraph.dag.model.RouteOrigin;
import io.routegraph.kubernetes.api.gateway.Gateway;
import io.routegraph.kubernetes.api.v1.HTTPProxy;

/**
 * Collects the conditions computed during one build, keyed by source object.
 * <p>Not thread safe; a cache belongs to the single build that created it.</p>
 */
public class StatusCache {

    private final ConditionFactory factory;
    private final String controllerName;
    private final SortedMap<ObjectKey, ProxyConditions> proxies = new TreeMap<>();
    private final SortedMap<ObjectKey, RouteConditions> routes = new TreeMap<>();
    private final SortedMap<ObjectKey, GatewayConditions> gateways = new TreeMap<>();
    private final SortedMap<ObjectKey, IngressConditions> ingresses = new TreeMap<>();

    public StatusCache(ConditionFactory factory, String controllerName) {
        this.factory = factory;
        this.controllerName = controllerName;
    }

    public ProxyConditions proxy(HTTPProxy proxy) {
        return proxies.computeIfAbsent(ObjectKey.of(proxy), k -> new ProxyConditions(k, ResourcesUtil.generation(proxy)));
    }

    public RouteConditions route(HasMetadata route) {
        return routes.computeIfAbsent(ObjectKey.of(route), k -> new RouteConditions(k, ResourcesUtil.generation(route), route.getClass(), factory));
    }

    public GatewayConditions gateway(Gateway gateway) {
        return gateways.computeIfAbsent(ObjectKey.of(gateway), k -> new GatewayConditions(k, ResourcesUtil.generation(gateway), factory));
    }

    public IngressConditions ingress(HasMetadata ingress) {
        return ingresses.computeIfAbsent(ObjectKey.of(ingress), k -> new IngressConditions(k, ResourcesUtil.generation(ingress), factory));
    }

    /**
     * Records a conflict against whichever object lost a route collision.
     * The losing object must already have been seen during this build.
     * @param loser the losing object
     * @param message names the winner
     * @param partial the loser still has other routes in the graph
     */
    public void crossSchemaConflict(RouteOrigin loser, String message, boolean partial) {
        ObjectKey key = new ObjectKey(loser.kind(), loser.name());
        if (proxies.containsKey(key)) {
            proxies.get(key).addError("RouteError", "DuplicateMatchConditions", message);
        }
        else if (routes.containsKey(key)) {
            routes.get(key).conflictOnAllParents(partial, message);
        }
        else if (ingresses.containsKey(key)) {
            ingresses.get(key).conflicted(partial ? IngressConditions.REASON_ROUTE_PARTIALLY_CONFLICT : IngressConditions.REASON_ROUTE_CONFLICT, message);
        }
        else {
            throw new IllegalStateException("no status recorded for " + loser);
        }
    }

    /**
     * @return one update per object touched during the build, in key order
     */
    public List<StatusUpdate> updates() {
        List<StatusUpdate> result = new ArrayList<>();
        proxies.values().forEach(p -> result.add(p.toUpdate(factory)));
        routes.values().forEach(r -> result.add(r.toUpdate(controllerName)));
        gateways.values().forEach(g -> result.add(g.toUpdate()));
        ingresses.values().forEach(i -> result.add(i.toUpdate()));
        result.sort((a, b) -> a.key().compareTo(b.key()));
        return List.copyOf(result);
    }
}
