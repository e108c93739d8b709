/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.v1;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param conditions the match conditions, ANDed with those inherited through inclusion
 * @param services the weighted backends; mutually exclusive with the redirect and direct response policies
 * @param permitInsecure serve plain HTTP on a TLS virtual host instead of redirecting
 * @param authPolicy overrides the virtual host authorization policy
 * @param enableWebsockets allow websocket upgrades
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Route(
                    List<MatchCondition> conditions,
                    List<BackendService> services,
                    boolean permitInsecure,
                    @Nullable AuthorizationPolicy authPolicy,
                    @Nullable TimeoutPolicy timeoutPolicy,
                    @Nullable RetryPolicy retryPolicy,
                    @Nullable LoadBalancerPolicy loadBalancerPolicy,
                    @Nullable HealthCheckPolicy healthCheckPolicy,
                    @Nullable HeadersPolicy requestHeadersPolicy,
                    @Nullable HeadersPolicy responseHeadersPolicy,
                    @Nullable RateLimitPolicy rateLimitPolicy,
                    @Nullable HTTPRequestRedirectPolicy requestRedirectPolicy,
                    @Nullable HTTPDirectResponsePolicy directResponsePolicy,
                    @Nullable PathRewritePolicy pathRewritePolicy,
                    boolean enableWebsockets) {

    public Route {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        services = services == null ? List.of() : List.copyOf(services);
    }
}
