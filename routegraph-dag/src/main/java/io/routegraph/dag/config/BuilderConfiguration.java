/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.routegraph.dag.model.HeadersPolicy;
import io.routegraph.kubernetes.api.common.NamespacedName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration of the graph builder. Absent sections take their defaults.
 *
 * @param disableRouteSorting emit routes in declaration order unless a root object says otherwise
 * @param regex regular expression limits
 * @param policy defaults for the hierarchical policies
 * @param watchedNamespaces namespaces whose objects are considered, empty for all
 * @param rootNamespaces namespaces in which HTTPProxy roots are permitted, empty for all
 * @param ingressClassName the ingress class processed, or null to process unclassified ingresses
 * @param gateway the Gateway this builder manages, or null when Gateway API processing is off
 * @param controllerName the controller name written to Gateway API route statuses
 * @param listeners the listeners used when no Gateway is managed
 * @param routeConflictPolicy how routes of different kinds that collide are decided
 * @param schemaPriority kinds in decreasing priority for {@link RouteConflictPolicy#SCHEMA_PRIORITY}
 * @param rebuild rebuild debouncing
 * @param statusWriter status write retries
 */
@JsonPropertyOrder({ "disableRouteSorting", "regex", "policy", "watchedNamespaces", "rootNamespaces", "ingressClassName", "gateway", "controllerName",
        "listeners", "routeConflictPolicy", "schemaPriority", "rebuild", "statusWriter" })
public record BuilderConfiguration(
                                   boolean disableRouteSorting,
                                   @Nullable Regex regex,
                                   @Nullable Policy policy,
                                   @Nullable Set<String> watchedNamespaces,
                                   @Nullable Set<String> rootNamespaces,
                                   @Nullable String ingressClassName,
                                   @Nullable NamespacedName gateway,
                                   @Nullable String controllerName,
                                   @Nullable Listeners listeners,
                                   @Nullable RouteConflictPolicy routeConflictPolicy,
                                   @Nullable List<String> schemaPriority,
                                   @Nullable Rebuild rebuild,
                                   @Nullable StatusWriter statusWriter) {

    public static final String DEFAULT_CONTROLLER_NAME = "routegraph.io/gateway-controller";
    public static final List<String> DEFAULT_SCHEMA_PRIORITY = List.of("HTTPProxy", "HTTPRoute", "GRPCRoute", "Ingress");

    public BuilderConfiguration {
        regex = regex == null ? new Regex(null, null) : regex;
        policy = policy == null ? new Policy(false, false, null, null, null, null) : policy;
        watchedNamespaces = watchedNamespaces == null ? Set.of() : Set.copyOf(watchedNamespaces);
        rootNamespaces = rootNamespaces == null ? Set.of() : Set.copyOf(rootNamespaces);
        controllerName = controllerName == null ? DEFAULT_CONTROLLER_NAME : controllerName;
        listeners = listeners == null ? new Listeners(null, null) : listeners;
        routeConflictPolicy = routeConflictPolicy == null ? RouteConflictPolicy.OLDEST_WINS : routeConflictPolicy;
        schemaPriority = schemaPriority == null ? DEFAULT_SCHEMA_PRIORITY : List.copyOf(schemaPriority);
        rebuild = rebuild == null ? new Rebuild(null, null) : rebuild;
        statusWriter = statusWriter == null ? new StatusWriter(null, null, null) : statusWriter;
        if (!watchedNamespaces.isEmpty() && !rootNamespaces.isEmpty() && !watchedNamespaces.containsAll(rootNamespaces)) {
            throw new InvalidConfigurationException("rootNamespaces " + rootNamespaces + " must be a subset of watchedNamespaces " + watchedNamespaces);
        }
    }

    public static BuilderConfiguration defaults() {
        return new BuilderConfiguration(false, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * @param maxProgramSize regexes with a larger program are rejected
     * @param warnProgramSize regexes with a larger program are logged
     */
    public record Regex(@Nullable Integer maxProgramSize, @Nullable Integer warnProgramSize) {
        public static final int DEFAULT_MAX_PROGRAM_SIZE = 100;
        public static final int DEFAULT_WARN_PROGRAM_SIZE = 50;

        public Regex {
            maxProgramSize = maxProgramSize == null ? DEFAULT_MAX_PROGRAM_SIZE : maxProgramSize;
            warnProgramSize = warnProgramSize == null ? Math.min(DEFAULT_WARN_PROGRAM_SIZE, maxProgramSize) : warnProgramSize;
            if (maxProgramSize <= 0) {
                throw new InvalidConfigurationException("regex.maxProgramSize must be positive");
            }
        }
    }

    /**
     * @param externalAuthorizationBeforeRateLimit run the authorization filter before the rate limit filter
     * @param disablePermitInsecure ignore {@code permitInsecure} on routes
     * @param globalExternalAuthorization authorization applied to every TLS virtual host that does not configure its own
     * @param defaultGlobalRateLimit global rate limiting applied to routes that neither set nor disable their own
     * @param requestHeaders request header mutations applied to every cluster, overridable per service
     * @param responseHeaders response header mutations applied to every cluster, overridable per service
     */
    public record Policy(boolean externalAuthorizationBeforeRateLimit,
                         boolean disablePermitInsecure,
                         @Nullable GlobalAuthorization globalExternalAuthorization,
                         @Nullable GlobalRateLimit defaultGlobalRateLimit,
                         @Nullable Headers requestHeaders,
                         @Nullable Headers responseHeaders) {

        public HeadersPolicy requestHeadersPolicy() {
            return requestHeaders == null ? HeadersPolicy.EMPTY : requestHeaders.toPolicy();
        }

        public HeadersPolicy responseHeadersPolicy() {
            return responseHeaders == null ? HeadersPolicy.EMPTY : responseHeaders.toPolicy();
        }
    }

    public record GlobalAuthorization(String namespace,
                                      String name,
                                      int port,
                                      boolean failOpen,
                                      @Nullable Duration responseTimeout,
                                      @Nullable Map<String, String> context) {
        public GlobalAuthorization {
            if (namespace == null || name == null) {
                throw new InvalidConfigurationException("policy.globalExternalAuthorization requires a namespace and name");
            }
            context = context == null ? Map.of() : Map.copyOf(context);
        }
    }

    public record GlobalRateLimit(List<String> descriptors) {
        public GlobalRateLimit {
            descriptors = descriptors == null ? List.of() : List.copyOf(descriptors);
        }
    }

    public record Headers(@Nullable Map<String, String> set, @Nullable List<String> remove) {
        public HeadersPolicy toPolicy() {
            return new HeadersPolicy(new TreeMap<>(set == null ? Map.of() : set), new TreeMap<>(), remove == null ? List.of() : remove, null);
        }
    }

    public record Listeners(@Nullable Listener http, @Nullable Listener https) {
        public Listeners {
            http = http == null ? new Listener("ingress_http", "0.0.0.0", 8080) : http;
            https = https == null ? new Listener("ingress_https", "0.0.0.0", 8443) : https;
        }
    }

    public record Listener(String name, String address, int port) {
        public Listener {
            if (port <= 0 || port > 65535) {
                throw new InvalidConfigurationException("listener port " + port + " is out of range");
            }
        }
    }

    /**
     * @param holdoffDelay quiet period after a change before a rebuild starts
     * @param holdoffMaxDelay the longest a rebuild is held off while changes keep arriving
     */
    public record Rebuild(@Nullable Duration holdoffDelay, @Nullable Duration holdoffMaxDelay) {
        public Rebuild {
            holdoffDelay = holdoffDelay == null ? Duration.ofMillis(100) : holdoffDelay;
            holdoffMaxDelay = holdoffMaxDelay == null ? Duration.ofMillis(500) : holdoffMaxDelay;
            if (holdoffMaxDelay.compareTo(holdoffDelay) < 0) {
                throw new InvalidConfigurationException("rebuild.holdoffMaxDelay must not be shorter than rebuild.holdoffDelay");
            }
        }
    }

    /**
     * @param maxAttempts attempts made to write one status before giving up
     * @param backoff delay between attempts
     * @param threads threads writing statuses
     */
    public record StatusWriter(@Nullable Integer maxAttempts, @Nullable Duration backoff, @Nullable Integer threads) {
        public StatusWriter {
            maxAttempts = maxAttempts == null ? 3 : maxAttempts;
            backoff = backoff == null ? Duration.ofMillis(500) : backoff;
            threads = threads == null ? 2 : threads;
            if (maxAttempts < 1 || threads < 1) {
                throw new InvalidConfigurationException("statusWriter.maxAttempts and statusWriter.threads must be at least 1");
            }
        }
    }
}
