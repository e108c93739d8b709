/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import java.util.Objects;

/**
 * How a route matches the request path.
 *
 * @param type the kind of match
 * @param value the path, prefix or regular expression
 * @param segmentPrefix for {@link Type#PREFIX} only: whether the prefix must end on a path segment boundary
 */
public record PathMatch(Type type, String value, boolean segmentPrefix) {

    /**
     * Kinds of path match, in the order they are evaluated when routes are sorted.
     */
    public enum Type {
        EXACT,
        REGEX,
        PREFIX
    }

    public static final PathMatch ROOT = prefix("/");

    public PathMatch {
        Objects.requireNonNull(type);
        Objects.requireNonNull(value);
        segmentPrefix = segmentPrefix && type == Type.PREFIX;
    }

    public static PathMatch exact(String path) {
        return new PathMatch(Type.EXACT, path, false);
    }

    /**
     * A prefix that matches on segment boundaries: {@code /foo} matches {@code /foo} and {@code /foo/bar} but not {@code /foobar}.
     * @param prefix the prefix
     * @return the match
     */
    public static PathMatch prefix(String prefix) {
        return new PathMatch(Type.PREFIX, prefix, true);
    }

    /**
     * A raw string prefix: {@code /foo} also matches {@code /foobar}.
     * @param prefix the prefix
     * @return the match
     */
    public static PathMatch stringPrefix(String prefix) {
        return new PathMatch(Type.PREFIX, prefix, false);
    }

    public static PathMatch regex(String regex) {
        return new PathMatch(Type.REGEX, regex, false);
    }

    public boolean isRootPrefix() {
        return type == Type.PREFIX && "/".equals(value);
    }

    public boolean matches(String path) {
        switch (type) {
            case EXACT:
                return value.equals(path);
            case REGEX:
                return Regexes.compile(value).matcher(path).matches();
            case PREFIX:
                if (!segmentPrefix || "/".equals(value)) {
                    return path.startsWith(value);
                }
                String trimmed = value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
                return path.equals(trimmed) || path.startsWith(trimmed + "/");
            default:
                throw new IllegalStateException("Unexpected path match type " + type);
        }
    }

    @Override
    public String toString() {
        return switch (type) {
            case EXACT -> "exact: " + value;
            case REGEX -> "regex: " + value;
            case PREFIX -> (segmentPrefix ? "prefix: " : "string-prefix: ") + value;
        };
    }
}
