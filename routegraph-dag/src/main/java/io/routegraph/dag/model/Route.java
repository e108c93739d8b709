/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import io.routegraph.dag.match.RouteMatch;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A fully qualified match and what to do with the requests it matches.
 * <p>Exactly one of {@code clusters}, {@code redirect} or {@code directResponse} determines the action.</p>
 *
 * @param match the effective match, including conditions inherited through inclusion
 * @param clusters the weighted backends
 * @param mirror a backend receiving a copy of the traffic
 * @param redirect redirect instead of proxying
 * @param directResponse answer directly instead of proxying
 * @param websocket allow websocket upgrades
 * @param timeoutPolicy timeouts
 * @param retryPolicy retries
 * @param requestHeaders request header mutations
 * @param responseHeaders response header mutations
 * @param rateLimitPolicy the effective rate limit, after virtual host and default policies are applied
 * @param authorizationDisabled external authorization is skipped for this route
 * @param authorizationContext context entries sent with authorization checks
 * @param pathRewrite path rewriting before the request is forwarded
 * @param origin the object that declared the route
 */
public record Route(RouteMatch match,
                    List<Cluster> clusters,
                    @Nullable Cluster mirror,
                    @Nullable Redirect redirect,
                    @Nullable DirectResponse directResponse,
                    boolean websocket,
                    TimeoutPolicy timeoutPolicy,
                    @Nullable RetryPolicy retryPolicy,
                    HeadersPolicy requestHeaders,
                    HeadersPolicy responseHeaders,
                    @Nullable RateLimitPolicy rateLimitPolicy,
                    boolean authorizationDisabled,
                    SortedMap<String, String> authorizationContext,
                    @Nullable PathRewrite pathRewrite,
                    RouteOrigin origin) {

    public Route {
        Objects.requireNonNull(match);
        Objects.requireNonNull(origin);
        clusters = List.copyOf(clusters);
        authorizationContext = Collections.unmodifiableSortedMap(new TreeMap<>(authorizationContext));
    }

    public static Builder builder(RouteMatch match, RouteOrigin origin) {
        return new Builder(match, origin);
    }

    public Builder toBuilder() {
        var builder = new Builder(match, origin);
        builder.clusters.addAll(clusters);
        builder.mirror = mirror;
        builder.redirect = redirect;
        builder.directResponse = directResponse;
        builder.websocket = websocket;
        builder.timeoutPolicy = timeoutPolicy;
        builder.retryPolicy = retryPolicy;
        builder.requestHeaders = requestHeaders;
        builder.responseHeaders = responseHeaders;
        builder.rateLimitPolicy = rateLimitPolicy;
        builder.authorizationDisabled = authorizationDisabled;
        builder.authorizationContext.putAll(authorizationContext);
        builder.pathRewrite = pathRewrite;
        return builder;
    }

    public static class Builder {
        private RouteMatch match;
        private final RouteOrigin origin;
        private final List<Cluster> clusters = new ArrayList<>();
        private @Nullable Cluster mirror;
        private @Nullable Redirect redirect;
        private @Nullable DirectResponse directResponse;
        private boolean websocket;
        private TimeoutPolicy timeoutPolicy = TimeoutPolicy.DEFAULT;
        private @Nullable RetryPolicy retryPolicy;
        private HeadersPolicy requestHeaders = HeadersPolicy.EMPTY;
        private HeadersPolicy responseHeaders = HeadersPolicy.EMPTY;
        private @Nullable RateLimitPolicy rateLimitPolicy;
        private boolean authorizationDisabled;
        private final SortedMap<String, String> authorizationContext = new TreeMap<>();
        private @Nullable PathRewrite pathRewrite;

        private Builder(RouteMatch match, RouteOrigin origin) {
            this.match = match;
            this.origin = origin;
        }

        public Builder match(RouteMatch match) {
            this.match = match;
            return this;
        }

        public Builder addCluster(Cluster cluster) {
            clusters.add(cluster);
            return this;
        }

        public Builder clusters(List<Cluster> clusters) {
            this.clusters.clear();
            this.clusters.addAll(clusters);
            return this;
        }

        public Builder mirror(@Nullable Cluster mirror) {
            this.mirror = mirror;
            return this;
        }

        public Builder redirect(@Nullable Redirect redirect) {
            this.redirect = redirect;
            return this;
        }

        public Builder directResponse(@Nullable DirectResponse directResponse) {
            this.directResponse = directResponse;
            return this;
        }

        public Builder websocket(boolean websocket) {
            this.websocket = websocket;
            return this;
        }

        public Builder timeoutPolicy(TimeoutPolicy timeoutPolicy) {
            this.timeoutPolicy = timeoutPolicy;
            return this;
        }

        public Builder retryPolicy(@Nullable RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder requestHeaders(HeadersPolicy requestHeaders) {
            this.requestHeaders = requestHeaders;
            return this;
        }

        public Builder responseHeaders(HeadersPolicy responseHeaders) {
            this.responseHeaders = responseHeaders;
            return this;
        }

        public Builder rateLimitPolicy(@Nullable RateLimitPolicy rateLimitPolicy) {
            this.rateLimitPolicy = rateLimitPolicy;
            return this;
        }

        public Builder authorization(boolean disabled, Map<String, String> context) {
            this.authorizationDisabled = disabled;
            this.authorizationContext.clear();
            this.authorizationContext.putAll(context);
            return this;
        }

        public Builder pathRewrite(@Nullable PathRewrite pathRewrite) {
            this.pathRewrite = pathRewrite;
            return this;
        }

        public Route build() {
            return new Route(match, clusters, mirror, redirect, directResponse, websocket, timeoutPolicy, retryPolicy, requestHeaders,
                    responseHeaders, rateLimitPolicy, authorizationDisabled, authorizationContext, pathRewrite, origin);
        }
    }
}
