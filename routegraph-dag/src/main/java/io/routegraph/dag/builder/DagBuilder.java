/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.builder;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.routegraph.dag.match.RouteMatch;
import io.routegraph.dag.match.RouteOrdering;
import io.routegraph.dag.model.Cluster;
import io.routegraph.dag.model.Dag;
import io.routegraph.dag.model.ExternalAuthorization;
import io.routegraph.dag.model.FilterOrder;
import io.routegraph.dag.model.Listener;
import io.routegraph.dag.model.PeerValidation;
import io.routegraph.dag.model.RateLimitPolicy;
import io.routegraph.dag.model.Route;
import io.routegraph.dag.model.RouteOrigin;
import io.routegraph.dag.model.Service;
import io.routegraph.dag.model.TcpProxy;
import io.routegraph.dag.model.TlsContext;
import io.routegraph.dag.model.TlsSecret;
import io.routegraph.dag.model.VirtualHost;
import io.routegraph.dag.status.StatusCache;
import io.routegraph.kubernetes.api.common.NamespacedName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The mutable graph that processors contribute to during one build.
 * <p>Routes are keyed by their effective match, so a virtual host can never hold two routes that a request cannot
 * tell apart. When two objects contribute the same match the conflict policy picks the route that stays and the
 * other object is told which object it lost to.</p>
 */
public class DagBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(DagBuilder.class);

    private final Comparator<RouteOrigin> winnerFirst;
    private final StatusCache statusCache;
    private final SortedMap<String, ListenerBuilder> listeners = new TreeMap<>();
    private final Map<RouteOrigin, List<String>> lostRoutes = new LinkedHashMap<>();

    /**
     * @param winnerFirst orders the winner of a route collision first
     * @param statusCache receives the conditions of collision losers
     */
    public DagBuilder(Comparator<RouteOrigin> winnerFirst, StatusCache statusCache) {
        this.winnerFirst = winnerFirst;
        this.statusCache = statusCache;
    }

    /**
     * Returns the named listener, creating it if it does not exist yet.
     */
    public ListenerBuilder listener(String name, String address, int port, int declaredPort, Listener.Protocol protocol) {
        return listeners.computeIfAbsent(name, n -> new ListenerBuilder(n, address, port, declaredPort, protocol));
    }

    public Optional<ListenerBuilder> findListener(String name) {
        return Optional.ofNullable(listeners.get(name));
    }

    /**
     * @param protocol the protocol
     * @return the listeners of that protocol, by name
     */
    public List<ListenerBuilder> listeners(Listener.Protocol protocol) {
        return listeners.values().stream().filter(l -> l.protocol == protocol).toList();
    }

    /**
     * Freezes the graph. Empty virtual hosts and listeners are dropped.
     * @param version the snapshot version
     * @param disableRouteSorting keep declaration order on virtual hosts that do not say otherwise
     * @return the snapshot
     */
    public Dag freeze(long version, boolean disableRouteSorting) {
        reportLostRoutes();
        List<Listener> frozen = new ArrayList<>();
        for (ListenerBuilder listener : listeners.values()) {
            List<VirtualHost> virtualHosts = listener.virtualHosts.values().stream()
                    .map(v -> v.freeze(disableRouteSorting))
                    .filter(v -> !v.routes().isEmpty() || v.tcpProxy() != null)
                    .toList();
            if (virtualHosts.isEmpty() && listener.tcpProxy == null) {
                LOGGER.atDebug()
                        .setMessage("Dropping listener {} which has nothing to serve")
                        .addArgument(listener.name)
                        .log();
                continue;
            }
            frozen.add(new Listener(listener.name, listener.address, listener.port, listener.declaredPort, listener.protocol, virtualHosts,
                    listener.tcpProxy));
        }
        TreeSet<Service> services = new TreeSet<>(Service.COMPARATOR);
        SortedMap<NamespacedName, TlsSecret> secrets = new TreeMap<>(NamespacedName.COMPARATOR);
        for (Listener listener : frozen) {
            if (listener.tcpProxy() != null) {
                collect(listener.tcpProxy().clusters().stream(), services, secrets);
            }
            for (VirtualHost virtualHost : listener.virtualHosts()) {
                collect(virtualHost.tls(), secrets);
                if (virtualHost.tcpProxy() != null) {
                    collect(virtualHost.tcpProxy().clusters().stream(), services, secrets);
                }
                if (virtualHost.externalAuthorization() != null) {
                    services.add(virtualHost.externalAuthorization().service());
                }
                for (Route route : virtualHost.routes()) {
                    collect(Stream.concat(route.clusters().stream(), Stream.ofNullable(route.mirror())), services, secrets);
                }
            }
        }
        return new Dag(version, frozen, List.copyOf(services), secrets);
    }

    /**
     * Tells every object that lost a route collision which routes it lost. An object that still has a route in the
     * graph lost only part of its configuration.
     */
    private void reportLostRoutes() {
        if (lostRoutes.isEmpty()) {
            return;
        }
        Set<RouteOrigin> placed = new HashSet<>();
        for (ListenerBuilder listener : listeners.values()) {
            for (VirtualHostBuilder virtualHost : listener.virtualHosts.values()) {
                virtualHost.routes.values().forEach(route -> placed.add(route.origin()));
            }
        }
        lostRoutes.forEach((origin, messages) -> {
            boolean partial = placed.contains(origin);
            messages.forEach(message -> statusCache.crossSchemaConflict(origin, message, partial));
        });
        lostRoutes.clear();
    }

    private static void collect(Stream<Cluster> clusters, TreeSet<Service> services, SortedMap<NamespacedName, TlsSecret> secrets) {
        clusters.forEach(cluster -> {
            services.add(cluster.service());
            collect(cluster.upstreamValidation(), secrets);
        });
    }

    private static void collect(@Nullable TlsContext tls, SortedMap<NamespacedName, TlsSecret> secrets) {
        if (tls == null) {
            return;
        }
        if (tls.secret() != null) {
            secrets.put(tls.secret().name(), tls.secret());
        }
        collect(tls.clientValidation(), secrets);
    }

    private static void collect(@Nullable PeerValidation validation, SortedMap<NamespacedName, TlsSecret> secrets) {
        if (validation == null) {
            return;
        }
        if (validation.caCertificate() != null) {
            secrets.put(validation.caCertificate().name(), validation.caCertificate());
        }
        if (validation.crl() != null) {
            secrets.put(validation.crl().name(), validation.crl());
        }
    }

    /**
     * A listener under construction.
     */
    public class ListenerBuilder {
        private final String name;
        private final String address;
        private final int port;
        private final int declaredPort;
        private final Listener.Protocol protocol;
        private final SortedMap<String, VirtualHostBuilder> virtualHosts = new TreeMap<>();
        private @Nullable TcpProxy tcpProxy;

        ListenerBuilder(String name, String address, int port, int declaredPort, Listener.Protocol protocol) {
            this.name = name;
            this.address = address;
            this.port = port;
            this.declaredPort = declaredPort;
            this.protocol = protocol;
        }

        public String name() {
            return name;
        }

        public int port() {
            return port;
        }

        public int declaredPort() {
            return declaredPort;
        }

        public Listener.Protocol protocol() {
            return protocol;
        }

        /**
         * Returns the virtual host for the hostname, creating it if it does not exist yet.
         */
        public VirtualHostBuilder virtualHost(String hostname) {
            return virtualHosts.computeIfAbsent(hostname, h -> new VirtualHostBuilder(this, h));
        }

        public Optional<VirtualHostBuilder> findVirtualHost(String hostname) {
            return Optional.ofNullable(virtualHosts.get(hostname));
        }

        public void tcpProxy(TcpProxy tcpProxy) {
            this.tcpProxy = tcpProxy;
        }

        public boolean hasTcpProxy() {
            return tcpProxy != null;
        }
    }

    /**
     * A virtual host under construction.
     */
    public class VirtualHostBuilder {
        private final ListenerBuilder listener;
        private final String hostname;
        private final Map<String, Route> routes = new LinkedHashMap<>();
        private @Nullable TlsContext tls;
        private @Nullable TcpProxy tcpProxy;
        private @Nullable ExternalAuthorization externalAuthorization;
        private @Nullable RateLimitPolicy rateLimitPolicy;
        private FilterOrder filterOrder = FilterOrder.RATE_LIMIT_THEN_AUTHORIZATION;
        private @Nullable Boolean disableRouteSorting;

        VirtualHostBuilder(ListenerBuilder listener, String hostname) {
            this.listener = listener;
            this.hostname = hostname;
        }

        public String hostname() {
            return hostname;
        }

        /**
         * Adds a route. A route with the same effective match from the same object replaces the earlier one;
         * from a different object the conflict policy decides and the loser is reported when the graph is frozen.
         * @param route the route
         * @return true if the route is now in the virtual host
         */
        public boolean addRoute(Route route) {
            String key = route.match().key();
            Route existing = routes.get(key);
            if (existing == null || existing.origin().equals(route.origin())) {
                routes.put(key, route);
                return true;
            }
            boolean added = winnerFirst.compare(route.origin(), existing.origin()) < 0;
            Route winner = added ? route : existing;
            Route loser = added ? existing : route;
            routes.put(key, winner);
            String message = "route \"" + key + "\" on " + listener.name + " " + hostname + " conflicts with " + winner.origin();
            LOGGER.atDebug()
                    .setMessage("{} lost {}")
                    .addArgument(loser.origin())
                    .addArgument(message)
                    .log();
            lostRoutes.computeIfAbsent(loser.origin(), origin -> new ArrayList<>()).add(message);
            return added;
        }

        public Optional<Route> route(RouteMatch match) {
            return Optional.ofNullable(routes.get(match.key()));
        }

        public boolean hasRoutes() {
            return !routes.isEmpty();
        }

        /**
         * Sets TLS unless a different configuration is already in place.
         * @param tls the TLS settings
         * @return false if different TLS settings were already set
         */
        public boolean tls(TlsContext tls) {
            if (this.tls != null && !this.tls.equals(tls)) {
                return false;
            }
            this.tls = tls;
            return true;
        }

        public Optional<TlsContext> tls() {
            return Optional.ofNullable(tls);
        }

        public void tcpProxy(TcpProxy tcpProxy) {
            this.tcpProxy = tcpProxy;
        }

        public boolean hasTcpProxy() {
            return tcpProxy != null;
        }

        public void externalAuthorization(@Nullable ExternalAuthorization externalAuthorization) {
            this.externalAuthorization = externalAuthorization;
        }

        public void rateLimitPolicy(@Nullable RateLimitPolicy rateLimitPolicy) {
            this.rateLimitPolicy = rateLimitPolicy;
        }

        public void filterOrder(FilterOrder filterOrder) {
            this.filterOrder = filterOrder;
        }

        public void disableRouteSorting(boolean disableRouteSorting) {
            this.disableRouteSorting = disableRouteSorting;
        }

        VirtualHost freeze(boolean defaultDisableRouteSorting) {
            boolean sorted = disableRouteSorting == null ? !defaultDisableRouteSorting : !disableRouteSorting;
            List<Route> frozenRoutes = sorted ? RouteOrdering.sort(List.copyOf(routes.values())) : List.copyOf(routes.values());
            return new VirtualHost(hostname, frozenRoutes, tls, tcpProxy, externalAuthorization, rateLimitPolicy, filterOrder, sorted);
        }
    }
}
