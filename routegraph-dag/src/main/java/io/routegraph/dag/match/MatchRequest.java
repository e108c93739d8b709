/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * The attributes of a request that routes match against.
 *
 * @param method the HTTP method
 * @param path the path, without the query string
 * @param headers header values keyed by lower case name
 * @param queryParameters query parameter values
 */
public record MatchRequest(String method, String path, Map<String, String> headers, Map<String, List<String>> queryParameters) {

    public MatchRequest {
        var lower = new TreeMap<String, String>();
        headers.forEach((k, v) -> lower.put(k.toLowerCase(Locale.ROOT), v));
        headers = Map.copyOf(lower);
        queryParameters = Map.copyOf(queryParameters);
    }

    public static MatchRequest get(String path) {
        return new MatchRequest("GET", path, Map.of(), Map.of());
    }
}
