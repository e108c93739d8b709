/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Parses durations written the way Kubernetes objects commonly write them: {@code 1h30m}, {@code 2.5s}, {@code 250ms}.
 * {@code infinity} and {@code infinite} mean the timeout is disabled, represented by {@link Duration#ZERO}.
 */
final class Durations {

    private static final Pattern WHOLE = Pattern.compile("(?:\\d+(?:\\.\\d+)?(?:ns|us|µs|ms|s|m|h))+");
    private static final Pattern COMPONENT = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");
    private static final Map<String, Long> NANOS_PER_UNIT = Map.of(
            "ns", 1L,
            "us", 1_000L,
            "µs", 1_000L,
            "ms", 1_000_000L,
            "s", 1_000_000_000L,
            "m", 60_000_000_000L,
            "h", 3_600_000_000_000L);

    private Durations() {
    }

    /**
     * @param value the text, may be null or empty
     * @return the duration, or null when no value was given
     * @throws IllegalArgumentException if the text is not a duration
     */
    @Nullable
    static Duration parse(@Nullable String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        if (value.equals("infinity") || value.equals("infinite") || value.equals("0")) {
            return Duration.ZERO;
        }
        if (!WHOLE.matcher(value).matches()) {
            throw new IllegalArgumentException("invalid duration \"" + value + "\"");
        }
        Matcher matcher = COMPONENT.matcher(value);
        BigDecimal nanos = BigDecimal.ZERO;
        while (matcher.find()) {
            nanos = nanos.add(new BigDecimal(matcher.group(1)).multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(matcher.group(2)))));
        }
        return Duration.ofNanos(nanos.longValue());
    }
}
