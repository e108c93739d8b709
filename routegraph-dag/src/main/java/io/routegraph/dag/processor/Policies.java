/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.TreeMap;

import io.routegraph.dag.model.DirectResponse;
import io.routegraph.dag.model.HeadersPolicy;
import io.routegraph.dag.model.HealthCheck;
import io.routegraph.dag.model.RateLimitPolicy;
import io.routegraph.dag.model.Redirect;
import io.routegraph.dag.model.RetryPolicy;
import io.routegraph.dag.model.TimeoutPolicy;
import io.routegraph.kubernetes.api.v1.GlobalRateLimitPolicy;
import io.routegraph.kubernetes.api.v1.HTTPDirectResponsePolicy;
import io.routegraph.kubernetes.api.v1.HTTPRequestRedirectPolicy;
import io.routegraph.kubernetes.api.v1.HealthCheckPolicy;
import io.routegraph.kubernetes.api.v1.HeaderValue;
import io.routegraph.kubernetes.api.v1.LocalRateLimitPolicy;
import io.routegraph.kubernetes.api.v1.RateLimitDescriptor;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Translation of declared policies into their graph form.
 * Methods that parse durations throw {@link IllegalArgumentException} for values that are not durations.
 */
final class Policies {

    static final List<String> DEFAULT_RETRY_ON = List.of("5xx");
    static final int DEFAULT_REDIRECT_STATUS = 302;

    private static final Duration DEFAULT_HEALTH_CHECK_INTERVAL = Duration.ofSeconds(5);
    private static final Duration DEFAULT_HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(2);
    private static final long DEFAULT_UNHEALTHY_THRESHOLD = 3;
    private static final long DEFAULT_HEALTHY_THRESHOLD = 2;

    private Policies() {
    }

    static TimeoutPolicy timeoutPolicy(@Nullable io.routegraph.kubernetes.api.v1.TimeoutPolicy declared) {
        if (declared == null) {
            return TimeoutPolicy.DEFAULT;
        }
        return new TimeoutPolicy(Durations.parse(declared.response()), Durations.parse(declared.idle()));
    }

    @Nullable
    static RetryPolicy retryPolicy(@Nullable io.routegraph.kubernetes.api.v1.RetryPolicy declared) {
        if (declared == null) {
            return null;
        }
        int count = declared.count() == null ? 1 : declared.count();
        if (count < 0) {
            throw new IllegalArgumentException("retry count must not be negative");
        }
        List<String> retryOn = declared.retryOn().isEmpty() ? DEFAULT_RETRY_ON : declared.retryOn();
        return new RetryPolicy(retryOn, count, Durations.parse(declared.perTryTimeout()), declared.retriableStatusCodes());
    }

    @Nullable
    static HealthCheck healthCheck(@Nullable HealthCheckPolicy declared, String defaultHost) {
        if (declared == null || declared.path() == null) {
            return null;
        }
        return new HealthCheck(
                declared.path(),
                declared.host() == null ? defaultHost : declared.host(),
                declared.intervalSeconds() == null ? DEFAULT_HEALTH_CHECK_INTERVAL : Duration.ofSeconds(declared.intervalSeconds()),
                declared.timeoutSeconds() == null ? DEFAULT_HEALTH_CHECK_TIMEOUT : Duration.ofSeconds(declared.timeoutSeconds()),
                declared.unhealthyThresholdCount() == null ? DEFAULT_UNHEALTHY_THRESHOLD : declared.unhealthyThresholdCount(),
                declared.healthyThresholdCount() == null ? DEFAULT_HEALTHY_THRESHOLD : declared.healthyThresholdCount());
    }

    /**
     * On the request side a {@code Host} header is turned into a host rewrite rather than a header mutation.
     */
    static HeadersPolicy headersPolicy(@Nullable io.routegraph.kubernetes.api.v1.HeadersPolicy declared, boolean request) {
        if (declared == null) {
            return HeadersPolicy.EMPTY;
        }
        TreeMap<String, String> set = new TreeMap<>();
        String hostRewrite = null;
        for (HeaderValue header : declared.set()) {
            if (request && header.name().equalsIgnoreCase("host")) {
                hostRewrite = header.value();
            }
            else {
                set.put(header.name().toLowerCase(Locale.ROOT), header.value());
            }
        }
        return new HeadersPolicy(set, new TreeMap<>(), declared.remove(), hostRewrite);
    }

    @Nullable
    static RateLimitPolicy.LocalRateLimit local(@Nullable LocalRateLimitPolicy declared) {
        if (declared == null) {
            return null;
        }
        if (declared.requests() <= 0) {
            throw new IllegalArgumentException("local rate limit requests must be positive");
        }
        String unit = declared.unit() == null ? "second" : declared.unit().toLowerCase(Locale.ROOT);
        if (!List.of("second", "minute", "hour").contains(unit)) {
            throw new IllegalArgumentException("local rate limit unit must be one of second, minute or hour");
        }
        return new RateLimitPolicy.LocalRateLimit(declared.requests(), unit, declared.burst());
    }

    /**
     * Resolves the global rate limit descriptors of one level against the level above it.
     * @param declared this level's global policy, if any
     * @param inherited the descriptors in effect at the level above, or null if global limiting is off there
     * @return the descriptors in effect at this level, or null if global limiting is off
     */
    @Nullable
    static List<String> globalDescriptors(@Nullable GlobalRateLimitPolicy declared, @Nullable List<String> inherited) {
        if (declared == null) {
            return inherited;
        }
        if (declared.disabled()) {
            return null;
        }
        if (declared.descriptors().isEmpty()) {
            return inherited;
        }
        return declared.descriptors().stream()
                .map(Policies::descriptor)
                .toList();
    }

    static Redirect redirect(HTTPRequestRedirectPolicy declared) {
        int status = declared.statusCode() == null ? DEFAULT_REDIRECT_STATUS : declared.statusCode();
        if (status != 301 && status != 302) {
            throw new IllegalArgumentException("redirect status code must be 301 or 302");
        }
        if (declared.path() != null && declared.prefix() != null) {
            throw new IllegalArgumentException("cannot specify both redirect path and redirect prefix");
        }
        return new Redirect(declared.scheme(), declared.hostname(), declared.port(), status, declared.path(), declared.prefix());
    }

    static DirectResponse directResponse(HTTPDirectResponsePolicy declared) {
        if (declared.statusCode() < 200 || declared.statusCode() > 599) {
            throw new IllegalArgumentException("direct response status code must be between 200 and 599");
        }
        return new DirectResponse(declared.statusCode(), declared.body());
    }

    private static String descriptor(RateLimitDescriptor descriptor) {
        return descriptor.key() + "=" + descriptor.value();
    }
}
