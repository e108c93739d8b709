/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.routegraph.dag.model.RouteOrigin;
import io.routegraph.kubernetes.api.common.NamespacedName;

import edu.umd.cs.findbugs.annotations.Nullable;

public class ResourcesUtil {

    private ResourcesUtil() {
    }

    private static boolean inRange(char ch, char start, char end) {
        return start <= ch && ch <= end;
    }

    private static boolean isAlnum(char ch) {
        return inRange(ch, 'a', 'z')
                || inRange(ch, '0', '9');
    }

    /**
     * @param string the candidate
     * @return true if the string is an RFC 1123 DNS label
     */
    public static boolean isDnsLabel(String string) {
        int length = string.length();
        if (length == 0 || length > 63) {
            return false;
        }
        if (!isAlnum(string.charAt(0)) || !isAlnum(string.charAt(length - 1))) {
            return false;
        }
        for (int index = 1; index < length - 1; index++) {
            char ch = string.charAt(index);
            if (!(isAlnum(ch) || ch == '-')) {
                return false;
            }
        }
        return true;
    }

    /**
     * A lower case DNS-1123 subdomain, optionally prefixed by a single {@code *.} wildcard label, that is not an IP address.
     * @param hostname the candidate
     * @return whether the hostname is acceptable
     */
    public static boolean isValidHostname(String hostname) {
        String host = hostname.startsWith("*.") ? hostname.substring(2) : hostname;
        if (host.isEmpty() || host.length() > 253 || !host.equals(host.toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (isIpAddress(host)) {
            return false;
        }
        for (String label : host.split("\\.", -1)) {
            if (!isDnsLabel(label)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isIpAddress(String host) {
        return host.matches("\\d{1,3}(\\.\\d{1,3}){3}") || (host.contains(":") && host.matches("[0-9a-fA-F:.]+"));
    }

    public static String name(HasMetadata resource) {
        return resource.getMetadata().getName();
    }

    public static String namespace(HasMetadata resource) {
        String namespace = resource.getMetadata().getNamespace();
        return namespace == null ? "" : namespace;
    }

    public static NamespacedName namespacedName(HasMetadata resource) {
        return new NamespacedName(namespace(resource), name(resource));
    }

    public static long generation(HasMetadata resource) {
        Long generation = resource.getMetadata().getGeneration();
        return generation == null ? 0L : generation;
    }

    public static String kind(HasMetadata resource) {
        return Optional.ofNullable(resource.getKind()).orElse(resource.getClass().getSimpleName());
    }

    @Nullable
    public static Instant creationTimestamp(HasMetadata resource) {
        String timestamp = resource.getMetadata().getCreationTimestamp();
        if (timestamp == null) {
            return null;
        }
        try {
            return Instant.parse(timestamp);
        }
        catch (DateTimeParseException e) {
            return null;
        }
    }

    public static RouteOrigin origin(HasMetadata resource) {
        return new RouteOrigin(kind(resource), namespacedName(resource), creationTimestamp(resource));
    }
}
