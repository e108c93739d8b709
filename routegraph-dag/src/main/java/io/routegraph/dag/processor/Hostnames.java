/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Hostname matching between Gateway listeners and routes. A wildcard {@code *.example.com} matches any hostname
 * with at least one more label in front of {@code example.com}.
 */
final class Hostnames {

    static final String ANY = "*";

    private Hostnames() {
    }

    static boolean isWildcard(String hostname) {
        return hostname.startsWith("*.");
    }

    /**
     * @param pattern an exact hostname or a wildcard
     * @param hostname an exact hostname
     * @return whether the pattern covers the hostname
     */
    static boolean matches(String pattern, String hostname) {
        if (pattern.equals(hostname)) {
            return true;
        }
        if (!isWildcard(pattern) || isWildcard(hostname)) {
            return false;
        }
        String suffix = pattern.substring(1);
        return hostname.endsWith(suffix) && hostname.length() > suffix.length();
    }

    /**
     * The hostnames a route serves through a listener: for each pair the more specific of the two, where they overlap.
     * @param listenerHostname the listener hostname, or null for any
     * @param routeHostnames the route hostnames, empty for any
     * @return the hostnames, {@value #ANY} if neither side restricts them, empty if they do not overlap
     */
    static List<String> intersect(@Nullable String listenerHostname, List<String> routeHostnames) {
        String listener = listenerHostname == null ? null : listenerHostname.toLowerCase(Locale.ROOT);
        if (routeHostnames.isEmpty()) {
            return List.of(listener == null ? ANY : listener);
        }
        Set<String> result = new LinkedHashSet<>();
        for (String declared : routeHostnames) {
            String route = declared.toLowerCase(Locale.ROOT);
            if (listener == null || listener.equals(route)) {
                result.add(route);
            }
            else if (isWildcard(listener) && isWildcard(route)) {
                if (route.endsWith(listener.substring(1))) {
                    result.add(route);
                }
                else if (listener.endsWith(route.substring(1))) {
                    result.add(listener);
                }
            }
            else if (matches(listener, route)) {
                result.add(route);
            }
            else if (matches(route, listener)) {
                result.add(listener);
            }
        }
        return List.copyOf(result);
    }

    /**
     * Exact hostnames are the most specific, then longer wildcards, then no hostname at all.
     */
    static int specificity(@Nullable String hostname) {
        if (hostname == null) {
            return 0;
        }
        return isWildcard(hostname) ? hostname.length() : Integer.MAX_VALUE;
    }
}
