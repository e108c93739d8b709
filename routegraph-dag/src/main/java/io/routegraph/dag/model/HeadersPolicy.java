/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Header mutations. Header names are held in lower case.
 *
 * @param set headers replaced, or added when absent
 * @param add headers appended to any existing values
 * @param remove headers removed
 * @param hostRewrite replacement for the {@code Host} header, request side only
 */
public record HeadersPolicy(SortedMap<String, String> set,
                           SortedMap<String, String> add,
                           List<String> remove,
                           @Nullable String hostRewrite) {

    public static final HeadersPolicy EMPTY = new HeadersPolicy(new TreeMap<>(), new TreeMap<>(), List.of(), null);

    public HeadersPolicy {
        set = Collections.unmodifiableSortedMap(lowerCaseKeys(set));
        add = Collections.unmodifiableSortedMap(lowerCaseKeys(add));
        remove = remove.stream().map(h -> h.toLowerCase(Locale.ROOT)).distinct().sorted().toList();
    }

    private static TreeMap<String, String> lowerCaseKeys(SortedMap<String, String> map) {
        var result = new TreeMap<String, String>();
        map.forEach((k, v) -> result.put(k.toLowerCase(Locale.ROOT), v));
        return result;
    }

    public boolean isEmpty() {
        return set.isEmpty() && add.isEmpty() && remove.isEmpty() && hostRewrite == null;
    }

    /**
     * Layers a more specific policy over this one. Entries of the more specific policy win per header name.
     * @param moreSpecific the overriding policy
     * @return the merged policy
     */
    public HeadersPolicy overriddenBy(HeadersPolicy moreSpecific) {
        var mergedSet = new TreeMap<>(set);
        mergedSet.putAll(moreSpecific.set);
        var mergedAdd = new TreeMap<>(add);
        mergedAdd.putAll(moreSpecific.add);
        var mergedRemove = new ArrayList<>(remove);
        mergedRemove.addAll(moreSpecific.remove);
        // a header explicitly set at the more specific level is not removed by a less specific one
        mergedRemove.removeIf(h -> moreSpecific.set.containsKey(h) || moreSpecific.add.containsKey(h));
        return new HeadersPolicy(mergedSet, mergedAdd, mergedRemove, moreSpecific.hostRewrite != null ? moreSpecific.hostRewrite : hostRewrite);
    }
}
