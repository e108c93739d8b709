/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import io.routegraph.kubernetes.api.common.NamespacedName;

/**
 * A secret that has passed shape validation for the use it is referenced for.
 *
 * @param name the source secret
 * @param kind what the secret was validated as
 * @param data the PEM entries used, keyed by secret key
 */
public record TlsSecret(NamespacedName name, Kind kind, SortedMap<String, String> data) {

    public enum Kind {
        KEY_PAIR,
        CERTIFICATE_AUTHORITY,
        REVOCATION_LIST
    }

    public TlsSecret {
        data = Collections.unmodifiableSortedMap(new TreeMap<>(data));
    }

    public static TlsSecret of(NamespacedName name, Kind kind, Map<String, String> data) {
        return new TlsSecret(name, kind, new TreeMap<>(data));
    }
}
