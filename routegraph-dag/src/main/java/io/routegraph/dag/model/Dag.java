/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import io.routegraph.kubernetes.api.common.NamespacedName;

/**
 * One immutable snapshot of the routing graph.
 *
 * @param version monotonically increasing across the snapshots produced by one builder
 * @param listeners the listeners, ordered by name
 * @param services every backend referenced by a route or TCP proxy, ordered
 * @param secrets every validated secret referenced by a listener or cluster
 */
public record Dag(long version,
                  List<Listener> listeners,
                  List<Service> services,
                  SortedMap<NamespacedName, TlsSecret> secrets) {

    public Dag {
        listeners = List.copyOf(listeners);
        services = List.copyOf(services);
        secrets = Collections.unmodifiableSortedMap(new TreeMap<>(secrets));
    }

    public static Dag empty(long version) {
        return new Dag(version, List.of(), List.of(), new TreeMap<>(NamespacedName.COMPARATOR));
    }

    public Optional<Listener> listener(String name) {
        return listeners.stream().filter(l -> l.name().equals(name)).findFirst();
    }

    public Optional<VirtualHost> virtualHost(String listenerName, String hostname) {
        return listener(listenerName).flatMap(l -> l.virtualHost(hostname));
    }

    /**
     * Compares the content of two snapshots, ignoring their versions.
     * @param other the other snapshot
     * @return true if both describe the same routing
     */
    public boolean sameContentAs(Dag other) {
        return listeners.equals(other.listeners)
                && services.equals(other.services)
                && Objects.equals(List.copyOf(secrets.values()), List.copyOf(other.secrets.values()));
    }
}
