/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.google.re2j.Pattern;

/**
 * Caches compiled patterns used when evaluating matches.
 */
final class Regexes {

    private static final int MAX_CACHED = 1024;
    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private Regexes() {
    }

    static Pattern compile(String regex) {
        Pattern cached = CACHE.get(regex);
        if (cached != null) {
            return cached;
        }
        Pattern pattern = Pattern.compile(regex);
        if (CACHE.size() < MAX_CACHED) {
            CACHE.put(regex, pattern);
        }
        return pattern;
    }
}
