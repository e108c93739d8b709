/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.routegraph.dag.ResourcesUtil;
import io.routegraph.dag.builder.BuildContext;
import io.routegraph.dag.builder.DagBuilder.VirtualHostBuilder;
import io.routegraph.dag.cache.ObjectCacheView;
import io.routegraph.dag.config.BuilderConfiguration;
import io.routegraph.dag.match.HeaderMatch;
import io.routegraph.dag.match.InvalidRegexException;
import io.routegraph.dag.match.PathMatch;
import io.routegraph.dag.match.RouteMatch;
import io.routegraph.dag.match.StringMatchType;
import io.routegraph.dag.model.Cluster;
import io.routegraph.dag.model.DirectResponse;
import io.routegraph.dag.model.ExternalAuthorization;
import io.routegraph.dag.model.FilterOrder;
import io.routegraph.dag.model.HeadersPolicy;
import io.routegraph.dag.model.LoadBalancerStrategy;
import io.routegraph.dag.model.PathRewrite;
import io.routegraph.dag.model.PeerValidation;
import io.routegraph.dag.model.RateLimitPolicy;
import io.routegraph.dag.model.Redirect;
import io.routegraph.dag.model.Route;
import io.routegraph.dag.model.Service;
import io.routegraph.dag.model.TcpProxy;
import io.routegraph.dag.model.TlsContext;
import io.routegraph.dag.secret.SecretResolution;
import io.routegraph.dag.status.ProxyConditions;
import io.routegraph.dag.status.StatusCache;
import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.v1.AuthorizationPolicy;
import io.routegraph.kubernetes.api.v1.AuthorizationServer;
import io.routegraph.kubernetes.api.v1.BackendService;
import io.routegraph.kubernetes.api.v1.DownstreamValidation;
import io.routegraph.kubernetes.api.v1.HTTPProxy;
import io.routegraph.kubernetes.api.v1.HTTPProxySpec;
import io.routegraph.kubernetes.api.v1.Include;
import io.routegraph.kubernetes.api.v1.MatchCondition;
import io.routegraph.kubernetes.api.v1.ReplacePrefix;
import io.routegraph.kubernetes.api.v1.TCPProxy;
import io.routegraph.kubernetes.api.v1.TLS;
import io.routegraph.kubernetes.api.v1.UpstreamValidation;
import io.routegraph.kubernetes.api.v1.VirtualHost;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Builds virtual hosts and routes from HTTPProxy objects.
 * <p>Each root, an HTTPProxy declaring a virtual host, is walked depth first through its includes. The conditions
 * of every include are ANDed onto everything the included object produces. The walk keeps the chain of objects
 * from the root, so an include of an object already on the chain is reported as a cycle rather than followed.
 * Non-root objects that no walk reaches are orphaned.</p>
 */
public class HTTPProxyProcessor implements Processor {

    private static final Logger LOGGER = LoggerFactory.getLogger(HTTPProxyProcessor.class);

    public static final String ERROR_VIRTUAL_HOST = "VirtualHostError";
    public static final String ERROR_ROOT_NAMESPACE = "RootNamespaceError";
    public static final String ERROR_SPEC = "SpecError";
    public static final String ERROR_TLS = "TLSError";
    public static final String ERROR_AUTH = "AuthError";
    public static final String ERROR_INCLUDE = "IncludeError";
    public static final String ERROR_ROUTE = "RouteError";
    public static final String ERROR_SERVICE = "ServiceError";
    public static final String ERROR_TCP_PROXY = "TCPProxyError";

    public static final String REASON_ROOT_NOT_ALLOWED = "RootProxyNotAllowedInNamespace";
    public static final String REASON_FQDN_NOT_SPECIFIED = "FQDNNotSpecified";
    public static final String REASON_WILDCARD_NOT_ALLOWED = "WildCardNotAllowed";
    public static final String REASON_DUPLICATE_VHOST = "DuplicateVhost";
    public static final String REASON_NOTHING_DEFINED = "NothingDefined";
    public static final String REASON_TLS_CONFIG_NOT_VALID = "TLSConfigNotValid";
    public static final String REASON_CLIENT_VALIDATION_INVALID = "ClientValidationInvalid";
    public static final String REASON_AUTH_NOT_PERMITTED = "AuthNotPermitted";
    public static final String REASON_AUTH_BACKEND_NOT_FOUND = "AuthBackendNotFound";
    public static final String REASON_AUTH_RESPONSE_TIMEOUT_INVALID = "AuthResponseTimeoutInvalid";
    public static final String REASON_PATH_CONDITIONS_NOT_VALID = "PathMatchConditionsNotValid";
    public static final String REASON_HEADER_CONDITIONS_NOT_VALID = "HeaderMatchConditionsNotValid";
    public static final String REASON_QUERY_CONDITIONS_NOT_VALID = "QueryParameterMatchConditionsNotValid";
    public static final String REASON_DUPLICATE_MATCH_CONDITIONS = "DuplicateMatchConditions";
    public static final String REASON_INCLUDE_NOT_FOUND = "IncludeNotFound";
    public static final String REASON_ROOT_INCLUDES_ROOT = "RootIncludesRoot";
    public static final String REASON_INCLUDE_CREATES_CYCLE = "IncludeCreatesCycle";
    public static final String REASON_REGEX_NOT_VALID = "RegexNotValid";
    public static final String REASON_ROUTE_ACTION_COUNT_NOT_VALID = "RouteActionCountNotValid";
    public static final String REASON_ONLY_ONE_MIRROR = "OnlyOneMirror";
    public static final String REASON_SERVICE_PORT_INVALID = "ServicePortInvalid";
    public static final String REASON_SERVICE_UNRESOLVED = "ServiceUnresolvedReference";
    public static final String REASON_UNSUPPORTED_PROTOCOL = "UnsupportedProtocol";
    public static final String REASON_UPSTREAM_VALIDATION = "TLSUpstreamValidation";
    public static final String REASON_PREFIX_REPLACE_NOT_VALID = "PrefixReplaceNotValid";
    public static final String REASON_TIMEOUT_POLICY_NOT_VALID = "TimeoutPolicyNotValid";
    public static final String REASON_RETRY_POLICY_NOT_VALID = "RetryPolicyNotValid";
    public static final String REASON_RATE_LIMIT_POLICY_NOT_VALID = "RateLimitPolicyNotValid";
    public static final String REASON_REDIRECT_POLICY_NOT_VALID = "RequestRedirectPolicyNotValid";
    public static final String REASON_DIRECT_RESPONSE_POLICY_NOT_VALID = "DirectResponsePolicyNotValid";
    public static final String REASON_TCP_INCLUDE_NOT_FOUND = "TCPProxyIncludeNotFound";
    public static final String REASON_TCP_INCLUDE_CREATES_CYCLE = "TCPProxyIncludeCreatesCycle";
    public static final String REASON_NO_SERVICES_AND_INCLUDE = "NoServicesAndInclude";
    public static final String REASON_NO_SERVICES_PRESENT = "NoServicesPresent";

    private static final String MINIMUM_TLS_DEFAULT = "1.2";
    private static final List<String> MINIMUM_TLS_VERSIONS = List.of("1.2", "1.3");

    @Override
    public void run(BuildContext context) {
        new ProxyWalk(context).process();
    }

    /**
     * The settings of a virtual host that its routes are built against.
     */
    private record VirtualHostScope(
                                    String hostname,
                                    @Nullable VirtualHostBuilder insecure,
                                    @Nullable VirtualHostBuilder secure,
                                    @Nullable TlsContext tls,
                                    boolean authorizationEnabled,
                                    boolean authorizationDisabledByDefault,
                                    Map<String, String> authorizationContext,
                                    @Nullable RateLimitPolicy.LocalRateLimit localRateLimit,
                                    @Nullable List<String> globalRateLimit,
                                    @Nullable HeaderMatch authorityMatch) {}

    /**
     * The state of one run over all HTTPProxies.
     */
    private static final class ProxyWalk {
        private final BuildContext context;
        private final ObjectCacheView cache;
        private final StatusCache statusCache;
        private final BuilderConfiguration configuration;
        private final ServiceResolver services;
        private final Set<NamespacedName> reached = new HashSet<>();

        ProxyWalk(BuildContext context) {
            this.context = context;
            this.cache = context.cache();
            this.statusCache = context.statusCache();
            this.configuration = context.configuration();
            this.services = new ServiceResolver(cache);
        }

        void process() {
            List<HTTPProxy> proxies = cache.httpProxies();
            for (HTTPProxy proxy : proxies) {
                statusCache.proxy(proxy);
            }
            for (HTTPProxy root : validRoots(proxies)) {
                context.processing(root);
                processRoot(root);
            }
            for (HTTPProxy proxy : proxies) {
                if (!reached.contains(ResourcesUtil.namespacedName(proxy))) {
                    LOGGER.atDebug()
                            .setMessage("HTTPProxy {} is not reachable from any root")
                            .addArgument(ResourcesUtil.namespacedName(proxy))
                            .log();
                    statusCache.proxy(proxy).orphaned();
                }
            }
        }

        private List<HTTPProxy> validRoots(List<HTTPProxy> proxies) {
            Map<String, List<HTTPProxy>> byHost = new LinkedHashMap<>();
            for (HTTPProxy proxy : proxies) {
                HTTPProxySpec spec = spec(proxy);
                ProxyConditions status = statusCache.proxy(proxy);
                if (spec.routes().isEmpty() && spec.includes().isEmpty() && spec.tcpproxy() == null) {
                    status.addError(ERROR_SPEC, REASON_NOTHING_DEFINED, "HTTPProxy.Spec must have at least one Route, Include, or a TCPProxy");
                }
                VirtualHost virtualHost = spec.virtualhost();
                if (virtualHost == null) {
                    continue;
                }
                reached.add(ResourcesUtil.namespacedName(proxy));
                Set<String> rootNamespaces = configuration.rootNamespaces();
                if (!rootNamespaces.isEmpty() && !rootNamespaces.contains(ResourcesUtil.namespace(proxy))) {
                    status.addError(ERROR_ROOT_NAMESPACE, REASON_ROOT_NOT_ALLOWED, "root HTTPProxy cannot be defined in this namespace");
                    continue;
                }
                String fqdn = virtualHost.fqdn();
                if (fqdn == null || fqdn.isBlank()) {
                    status.addError(ERROR_VIRTUAL_HOST, REASON_FQDN_NOT_SPECIFIED, "Spec.VirtualHost.Fqdn must be specified");
                    continue;
                }
                if (fqdn.contains("*") && !(fqdn.startsWith("*.") && !fqdn.substring(2).contains("*"))) {
                    status.addError(ERROR_VIRTUAL_HOST, REASON_WILDCARD_NOT_ALLOWED,
                            "Spec.VirtualHost.Fqdn \"" + fqdn + "\" cannot use wildcards other than a single leading \"*.\"");
                    continue;
                }
                byHost.computeIfAbsent(fqdn.toLowerCase(Locale.ROOT), h -> new ArrayList<>()).add(proxy);
            }
            List<HTTPProxy> roots = new ArrayList<>();
            byHost.forEach((host, claimants) -> {
                if (claimants.size() == 1) {
                    roots.add(claimants.get(0));
                    return;
                }
                String names = claimants.stream().map(p -> ResourcesUtil.namespacedName(p).toString()).collect(Collectors.joining(", "));
                for (HTTPProxy claimant : claimants) {
                    statusCache.proxy(claimant).addError(ERROR_VIRTUAL_HOST, REASON_DUPLICATE_VHOST,
                            "fqdn \"" + host + "\" is used in multiple HTTPProxies: " + names);
                }
            });
            return roots;
        }

        private void processRoot(HTTPProxy root) {
            HTTPProxySpec spec = spec(root);
            VirtualHost virtualHost = spec.virtualhost();
            ProxyConditions status = statusCache.proxy(root);
            String host = virtualHost.fqdn().toLowerCase(Locale.ROOT);

            TlsContext tls = null;
            if (virtualHost.tls() != null) {
                tls = tlsContext(root, virtualHost.tls(), status);
                if (tls == null) {
                    return;
                }
            }

            ExternalAuthorization authorization = null;
            AuthorizationPolicy vhostAuthPolicy = null;
            if (virtualHost.authorization() != null) {
                if (tls == null || tls.passthrough()) {
                    status.addError(ERROR_AUTH, REASON_AUTH_NOT_PERMITTED,
                            "Spec.VirtualHost.Authorization can only be defined for root HTTPProxies that terminate TLS");
                    return;
                }
                authorization = externalAuthorization(root, virtualHost.authorization(), status);
                if (authorization == null) {
                    return;
                }
                vhostAuthPolicy = virtualHost.authorization().authPolicy();
            }
            else if (tls != null && !tls.passthrough() && configuration.policy().globalExternalAuthorization() != null) {
                authorization = globalAuthorization(configuration.policy().globalExternalAuthorization(), status);
                if (authorization == null) {
                    return;
                }
            }

            RateLimitPolicy.LocalRateLimit localRateLimit;
            List<String> globalRateLimit;
            try {
                List<String> defaultGlobal = configuration.policy().defaultGlobalRateLimit() == null
                        || configuration.policy().defaultGlobalRateLimit().descriptors().isEmpty() ? null
                                : configuration.policy().defaultGlobalRateLimit().descriptors();
                var declared = virtualHost.rateLimitPolicy();
                localRateLimit = Policies.local(declared == null ? null : declared.local());
                globalRateLimit = Policies.globalDescriptors(declared == null ? null : declared.global(), defaultGlobal);
            }
            catch (IllegalArgumentException e) {
                status.addError(ERROR_VIRTUAL_HOST, REASON_RATE_LIMIT_POLICY_NOT_VALID, "Spec.VirtualHost.RateLimitPolicy is invalid: " + e.getMessage());
                return;
            }

            if (spec.tcpproxy() != null && tls == null) {
                status.addError(ERROR_TCP_PROXY, REASON_TLS_CONFIG_NOT_VALID, "tcpproxy: missing tls.passthrough or tls.secretName");
                return;
            }

            VirtualHostBuilder secure = null;
            if (tls != null) {
                secure = context.secureListener().flatMap(context.dag()::findListener).map(l -> l.virtualHost(host)).orElse(null);
                if (secure == null) {
                    status.addError(ERROR_TLS, REASON_TLS_CONFIG_NOT_VALID, "no secure listener is available for virtual host \"" + host + "\"");
                    return;
                }
                if (!secure.tls(tls)) {
                    status.addError(ERROR_TLS, REASON_TLS_CONFIG_NOT_VALID, "virtual host \"" + host + "\" already has a different TLS configuration");
                    return;
                }
            }
            VirtualHostBuilder insecure = context.insecureListener().flatMap(context.dag()::findListener).map(l -> l.virtualHost(host)).orElse(null);

            if (spec.tcpproxy() != null) {
                TcpProxy tcpProxy = tcpProxy(root);
                if (tcpProxy == null) {
                    return;
                }
                secure.tcpProxy(tcpProxy);
            }

            RateLimitPolicy vhostRateLimit = new RateLimitPolicy(localRateLimit, globalRateLimit);
            FilterOrder filterOrder = configuration.policy().externalAuthorizationBeforeRateLimit() ? FilterOrder.AUTHORIZATION_THEN_RATE_LIMIT
                    : FilterOrder.RATE_LIMIT_THEN_AUTHORIZATION;
            for (VirtualHostBuilder builder : Stream.of(secure, insecure).filter(b -> b != null).toList()) {
                builder.rateLimitPolicy(vhostRateLimit.isEmpty() ? null : vhostRateLimit);
                builder.filterOrder(filterOrder);
                if (virtualHost.disableRouteSorting()) {
                    builder.disableRouteSorting(true);
                }
            }
            if (secure != null) {
                secure.externalAuthorization(authorization);
            }

            Map<String, String> authContext = new TreeMap<>();
            if (authorization != null) {
                authContext.putAll(authorization.defaultContext());
            }
            VirtualHostScope scope = new VirtualHostScope(host, insecure, secure, tls, authorization != null,
                    vhostAuthPolicy != null && vhostAuthPolicy.disabled(), authContext, localRateLimit, globalRateLimit, authorityMatch(host));
            Deque<NamespacedName> chain = new ArrayDeque<>();
            chain.addLast(ResourcesUtil.namespacedName(root));
            walk(root, List.of(), chain, scope);
        }

        private void walk(HTTPProxy proxy, List<MatchCondition> inherited, Deque<NamespacedName> chain, VirtualHostScope scope) {
            reached.add(ResourcesUtil.namespacedName(proxy));
            context.processing(proxy);
            ProxyConditions status = statusCache.proxy(proxy);
            String namespace = ResourcesUtil.namespace(proxy);
            Set<String> includeKeys = new HashSet<>();
            for (Include include : spec(proxy).includes()) {
                List<MatchCondition> own = include.conditions();
                List<MatchCondition> combined = concat(inherited, own);
                String problem = MatchConditions.includePathProblem(own);
                if (problem != null) {
                    status.addError(ERROR_INCLUDE, REASON_PATH_CONDITIONS_NOT_VALID, problem);
                    continue;
                }
                problem = MatchConditions.headerProblem(combined);
                if (problem != null) {
                    status.addError(ERROR_INCLUDE, REASON_HEADER_CONDITIONS_NOT_VALID, problem);
                    continue;
                }
                problem = MatchConditions.queryProblem(combined);
                if (problem != null) {
                    status.addError(ERROR_INCLUDE, REASON_QUERY_CONDITIONS_NOT_VALID, problem);
                    continue;
                }
                problem = regexProblem(own);
                if (problem != null) {
                    status.addError(ERROR_INCLUDE, REASON_REGEX_NOT_VALID, problem);
                    continue;
                }
                String key = MatchConditions.duplicateKey(own);
                if (key != null && !includeKeys.add(key)) {
                    status.addError(ERROR_INCLUDE, REASON_DUPLICATE_MATCH_CONDITIONS, "duplicate conditions defined on an include");
                    continue;
                }
                NamespacedName childName = new NamespacedName(include.namespace() == null ? namespace : include.namespace(), include.name());
                Optional<HTTPProxy> child = cache.httpProxy(childName);
                if (child.isEmpty()) {
                    status.addError(ERROR_INCLUDE, REASON_INCLUDE_NOT_FOUND, "include " + childName + " not found");
                    emit(directResponse(proxy, combined, DirectResponse.BAD_GATEWAY, scope), false, scope);
                    continue;
                }
                if (spec(child.get()).virtualhost() != null) {
                    status.addError(ERROR_INCLUDE, REASON_ROOT_INCLUDES_ROOT, "root httpproxy cannot include another root httpproxy");
                    emit(directResponse(proxy, combined, DirectResponse.BAD_GATEWAY, scope), false, scope);
                    continue;
                }
                if (chain.contains(childName)) {
                    String path = Stream.concat(chain.stream(), Stream.of(childName)).map(NamespacedName::toString).collect(Collectors.joining(" -> "));
                    statusCache.proxy(child.get()).addError(ERROR_INCLUDE, REASON_INCLUDE_CREATES_CYCLE, "include creates an include cycle: " + path);
                    continue;
                }
                chain.addLast(childName);
                walk(child.get(), combined, chain, scope);
                chain.removeLast();
                context.processing(proxy);
            }
            for (io.routegraph.kubernetes.api.v1.Route route : spec(proxy).routes()) {
                processRoute(proxy, route, inherited, scope);
            }
        }

        private void processRoute(HTTPProxy proxy, io.routegraph.kubernetes.api.v1.Route declared, List<MatchCondition> inherited, VirtualHostScope scope) {
            ProxyConditions status = statusCache.proxy(proxy);
            String namespace = ResourcesUtil.namespace(proxy);
            List<MatchCondition> own = declared.conditions();
            List<MatchCondition> combined = concat(inherited, own);
            String problem = MatchConditions.routePathProblem(own);
            if (problem != null) {
                status.addError(ERROR_ROUTE, REASON_PATH_CONDITIONS_NOT_VALID, problem);
                return;
            }
            problem = MatchConditions.headerProblem(combined);
            if (problem != null) {
                status.addError(ERROR_ROUTE, REASON_HEADER_CONDITIONS_NOT_VALID, problem);
                return;
            }
            problem = MatchConditions.queryProblem(combined);
            if (problem != null) {
                status.addError(ERROR_ROUTE, REASON_QUERY_CONDITIONS_NOT_VALID, problem);
                return;
            }
            RouteMatch match = routeMatch(combined, scope);
            problem = regexProblem(own);
            if (problem == null && match.path().type() == PathMatch.Type.REGEX) {
                problem = regexProblem(match.path().value());
            }
            if (problem != null) {
                status.addError(ERROR_ROUTE, REASON_REGEX_NOT_VALID, problem);
                return;
            }
            int actions = (declared.services().isEmpty() ? 0 : 1)
                    + (declared.requestRedirectPolicy() == null ? 0 : 1)
                    + (declared.directResponsePolicy() == null ? 0 : 1);
            if (actions != 1) {
                status.addError(ERROR_ROUTE, REASON_ROUTE_ACTION_COUNT_NOT_VALID,
                        "must set exactly one of route.services or route.requestRedirectPolicy or route.directResponsePolicy");
                return;
            }
            if (declared.services().stream().filter(BackendService::mirror).count() > 1) {
                status.addError(ERROR_ROUTE, REASON_ONLY_ONE_MIRROR, "only one service per route may be nominated as mirror");
                return;
            }

            Route.Builder route = Route.builder(match, ResourcesUtil.origin(proxy))
                    .websocket(declared.enableWebsockets())
                    .requestHeaders(Policies.headersPolicy(declared.requestHeadersPolicy(), true))
                    .responseHeaders(Policies.headersPolicy(declared.responseHeadersPolicy(), false));
            try {
                route.timeoutPolicy(Policies.timeoutPolicy(declared.timeoutPolicy()));
            }
            catch (IllegalArgumentException e) {
                status.addError(ERROR_ROUTE, REASON_TIMEOUT_POLICY_NOT_VALID, "route.timeoutPolicy failed to parse: " + e.getMessage());
                return;
            }
            try {
                route.retryPolicy(Policies.retryPolicy(declared.retryPolicy()));
            }
            catch (IllegalArgumentException e) {
                status.addError(ERROR_ROUTE, REASON_RETRY_POLICY_NOT_VALID, "route.retryPolicy failed to parse: " + e.getMessage());
                return;
            }
            try {
                var rateLimit = declared.rateLimitPolicy();
                RateLimitPolicy.LocalRateLimit local = rateLimit == null || rateLimit.local() == null ? scope.localRateLimit() : Policies.local(rateLimit.local());
                List<String> global = Policies.globalDescriptors(rateLimit == null ? null : rateLimit.global(), scope.globalRateLimit());
                RateLimitPolicy effective = new RateLimitPolicy(local, global);
                route.rateLimitPolicy(effective.isEmpty() ? null : effective);
            }
            catch (IllegalArgumentException e) {
                status.addError(ERROR_ROUTE, REASON_RATE_LIMIT_POLICY_NOT_VALID, "route.rateLimitPolicy is invalid: " + e.getMessage());
                return;
            }
            if (declared.requestRedirectPolicy() != null) {
                try {
                    route.redirect(Policies.redirect(declared.requestRedirectPolicy()));
                }
                catch (IllegalArgumentException e) {
                    status.addError(ERROR_ROUTE, REASON_REDIRECT_POLICY_NOT_VALID, "route.requestRedirectPolicy is invalid: " + e.getMessage());
                    return;
                }
            }
            if (declared.directResponsePolicy() != null) {
                try {
                    route.directResponse(Policies.directResponse(declared.directResponsePolicy()));
                }
                catch (IllegalArgumentException e) {
                    status.addError(ERROR_ROUTE, REASON_DIRECT_RESPONSE_POLICY_NOT_VALID, "route.directResponsePolicy is invalid: " + e.getMessage());
                    return;
                }
            }
            if (declared.pathRewritePolicy() != null) {
                problem = pathRewrite(declared.pathRewritePolicy().replacePrefix(), match.path(), route);
                if (problem != null) {
                    status.addError(ERROR_ROUTE, REASON_PREFIX_REPLACE_NOT_VALID, problem);
                    return;
                }
            }
            if (scope.authorizationEnabled()) {
                AuthorizationPolicy policy = declared.authPolicy();
                Map<String, String> authContext = new TreeMap<>(scope.authorizationContext());
                if (policy != null) {
                    authContext.putAll(policy.context());
                }
                route.authorization(policy == null ? scope.authorizationDisabledByDefault() : policy.disabled(), authContext);
            }

            if (!declared.services().isEmpty()) {
                LoadBalancerStrategy strategy = LoadBalancerStrategy.fromValue(declared.loadBalancerPolicy() == null ? null : declared.loadBalancerPolicy().strategy());
                boolean primaryResolved = false;
                for (BackendService backend : declared.services()) {
                    if (!ServiceResolver.isValidPort(backend.port())) {
                        status.addError(ERROR_SERVICE, REASON_SERVICE_PORT_INVALID, "service \"" + backend.name() + "\": port must be in the range 1-65535");
                        return;
                    }
                    if (backend.protocol() != null && !ServiceResolver.knownProtocols().contains(backend.protocol().toLowerCase(Locale.ROOT))) {
                        status.addError(ERROR_SERVICE, REASON_UNSUPPORTED_PROTOCOL,
                                "service \"" + backend.name() + "\": unsupported protocol \"" + backend.protocol() + "\"");
                        return;
                    }
                    NamespacedName serviceName = new NamespacedName(namespace, backend.name());
                    Optional<Service> service = services.resolve(serviceName, backend.port());
                    if (service.isEmpty()) {
                        status.addError(ERROR_SERVICE, REASON_SERVICE_UNRESOLVED,
                                "Spec.Routes unresolved service reference: service \"" + serviceName + "\" not found or has no port " + backend.port());
                        continue;
                    }
                    PeerValidation upstreamValidation = null;
                    if (backend.validation() != null) {
                        upstreamValidation = upstreamValidation(backend.validation(), namespace, status);
                        if (upstreamValidation == null) {
                            return;
                        }
                    }
                    Cluster cluster = new Cluster(service.get(),
                            backend.weight() == null ? 0 : backend.weight(),
                            ServiceResolver.protocol(backend.protocol(), service.get()),
                            upstreamValidation,
                            strategy,
                            Policies.healthCheck(declared.healthCheckPolicy(), scope.hostname()),
                            configuration.policy().requestHeadersPolicy().overriddenBy(Policies.headersPolicy(backend.requestHeadersPolicy(), true)),
                            configuration.policy().responseHeadersPolicy().overriddenBy(Policies.headersPolicy(backend.responseHeadersPolicy(), false)));
                    if (backend.mirror()) {
                        route.mirror(cluster);
                    }
                    else {
                        route.addCluster(cluster);
                        primaryResolved = true;
                    }
                }
                if (!primaryResolved) {
                    route.clusters(List.of()).mirror(null).directResponse(DirectResponse.SERVICE_UNAVAILABLE);
                }
            }
            emit(route.build(), declared.permitInsecure(), scope);
        }

        private void emit(Route route, boolean permitInsecure, VirtualHostScope scope) {
            if (scope.secure() != null) {
                if (!scope.tls().passthrough()) {
                    scope.secure().addRoute(route);
                }
                if (scope.insecure() != null) {
                    boolean insecureAllowed = permitInsecure && !configuration.policy().disablePermitInsecure();
                    scope.insecure().addRoute(insecureAllowed ? route
                            : Route.builder(route.match(), route.origin()).redirect(Redirect.toHttps()).build());
                }
            }
            else if (scope.insecure() != null) {
                scope.insecure().addRoute(route);
            }
        }

        private Route directResponse(HTTPProxy proxy, List<MatchCondition> conditions, DirectResponse response, VirtualHostScope scope) {
            return Route.builder(routeMatch(conditions, scope), ResourcesUtil.origin(proxy))
                    .directResponse(response)
                    .build();
        }

        private RouteMatch routeMatch(List<MatchCondition> conditions, VirtualHostScope scope) {
            RouteMatch match = new RouteMatch(MatchConditions.path(conditions), MatchConditions.headers(conditions), MatchConditions.queryParameters(conditions), null);
            return scope.authorityMatch() == null ? match : match.withHeaders(List.of(scope.authorityMatch()));
        }

        @Nullable
        private String regexProblem(List<MatchCondition> conditions) {
            for (String regex : MatchConditions.regexes(conditions)) {
                String problem = regexProblem(regex);
                if (problem != null) {
                    return problem;
                }
            }
            return null;
        }

        @Nullable
        private String regexProblem(String regex) {
            try {
                context.regexValidator().validate(regex);
                return null;
            }
            catch (InvalidRegexException e) {
                return e.getMessage();
            }
        }

        @Nullable
        private TlsContext tlsContext(HTTPProxy root, TLS tls, ProxyConditions status) {
            String namespace = ResourcesUtil.namespace(root);
            boolean hasSecret = tls.secretName() != null && !tls.secretName().isBlank();
            if (hasSecret && tls.passthrough()) {
                status.addError(ERROR_TLS, REASON_TLS_CONFIG_NOT_VALID, "Spec.VirtualHost.TLS: both Passthrough and SecretName were specified");
                return null;
            }
            if (!hasSecret && !tls.passthrough()) {
                status.addError(ERROR_TLS, REASON_TLS_CONFIG_NOT_VALID, "Spec.VirtualHost.TLS: neither Passthrough nor SecretName were specified");
                return null;
            }
            if (tls.passthrough()) {
                if (tls.clientValidation() != null) {
                    status.addError(ERROR_TLS, REASON_TLS_CONFIG_NOT_VALID, "Spec.VirtualHost.TLS: client validation is incompatible with Passthrough");
                    return null;
                }
                if (spec(root).tcpproxy() == null) {
                    status.addError(ERROR_TLS, REASON_TLS_CONFIG_NOT_VALID, "Spec.VirtualHost.TLS.Passthrough requires a TCPProxy");
                    return null;
                }
                return TlsContext.forPassthrough();
            }
            String minimumVersion = tls.minimumProtocolVersion() == null || tls.minimumProtocolVersion().isEmpty() ? MINIMUM_TLS_DEFAULT
                    : tls.minimumProtocolVersion();
            if (!MINIMUM_TLS_VERSIONS.contains(minimumVersion)) {
                status.addError(ERROR_TLS, REASON_TLS_CONFIG_NOT_VALID,
                        "Spec.VirtualHost.TLS.MinimumProtocolVersion \"" + minimumVersion + "\" is invalid, it must be one of " + MINIMUM_TLS_VERSIONS);
                return null;
            }
            SecretResolution certificate = context.secrets().delegatedKeyPair(NamespacedName.parse(namespace, tls.secretName()), namespace);
            if (!certificate.isResolved()) {
                status.addError(ERROR_TLS, certificate.reason(), certificate.message());
                return null;
            }
            PeerValidation clientValidation = null;
            DownstreamValidation declared = tls.clientValidation();
            if (declared != null) {
                if (declared.caSecret() == null && !declared.skipClientCertValidation()) {
                    status.addError(ERROR_TLS, REASON_CLIENT_VALIDATION_INVALID, "Spec.VirtualHost.TLS.ClientValidation: CA Secret must be specified");
                    return null;
                }
                SecretResolution ca = null;
                if (declared.caSecret() != null) {
                    ca = context.secrets().delegatedCertificateAuthority(NamespacedName.parse(namespace, declared.caSecret()), namespace);
                    if (!ca.isResolved()) {
                        status.addError(ERROR_TLS, REASON_CLIENT_VALIDATION_INVALID, "Spec.VirtualHost.TLS.ClientValidation: " + ca.message());
                        return null;
                    }
                }
                SecretResolution crl = null;
                if (declared.crlSecret() != null) {
                    crl = context.secrets().delegatedRevocationList(NamespacedName.parse(namespace, declared.crlSecret()), namespace);
                    if (!crl.isResolved()) {
                        status.addError(ERROR_TLS, REASON_CLIENT_VALIDATION_INVALID, "Spec.VirtualHost.TLS.ClientValidation: " + crl.message());
                        return null;
                    }
                }
                clientValidation = new PeerValidation(ca == null ? null : ca.secret(), null, crl == null ? null : crl.secret(),
                        declared.skipClientCertValidation());
            }
            return new TlsContext(certificate.secret(), minimumVersion, false, clientValidation);
        }

        @Nullable
        private PeerValidation upstreamValidation(UpstreamValidation validation, String namespace, ProxyConditions status) {
            if (validation.caSecret() == null || validation.subjectName() == null) {
                status.addError(ERROR_SERVICE, REASON_UPSTREAM_VALIDATION, "upstream validation requires both caSecret and subjectName");
                return null;
            }
            SecretResolution ca = context.secrets().delegatedCertificateAuthority(NamespacedName.parse(namespace, validation.caSecret()), namespace);
            if (!ca.isResolved()) {
                status.addError(ERROR_SERVICE, REASON_UPSTREAM_VALIDATION, "upstream validation CA is unusable: " + ca.message());
                return null;
            }
            return new PeerValidation(ca.secret(), validation.subjectName(), null, false);
        }

        @Nullable
        private ExternalAuthorization externalAuthorization(HTTPProxy root, AuthorizationServer server, ProxyConditions status) {
            var reference = server.extensionRef();
            if (reference == null || reference.name() == null || reference.name().isEmpty()) {
                status.addError(ERROR_AUTH, REASON_AUTH_BACKEND_NOT_FOUND, "Spec.VirtualHost.Authorization.extensionRef must name a Service");
                return null;
            }
            NamespacedName serviceName = new NamespacedName(reference.namespace() == null ? ResourcesUtil.namespace(root) : reference.namespace(), reference.name());
            Optional<Service> service = reference.port() == null ? services.resolveFirstPort(serviceName) : services.resolve(serviceName, reference.port());
            if (service.isEmpty()) {
                status.addError(ERROR_AUTH, REASON_AUTH_BACKEND_NOT_FOUND, "Spec.VirtualHost.Authorization.extensionRef Service \"" + serviceName + "\" not found");
                return null;
            }
            Duration responseTimeout;
            try {
                responseTimeout = Durations.parse(server.responseTimeout());
            }
            catch (IllegalArgumentException e) {
                status.addError(ERROR_AUTH, REASON_AUTH_RESPONSE_TIMEOUT_INVALID, "Spec.VirtualHost.Authorization.ResponseTimeout is invalid: " + e.getMessage());
                return null;
            }
            Map<String, String> defaultContext = server.authPolicy() == null ? Map.of() : server.authPolicy().context();
            return new ExternalAuthorization(service.get(), server.failOpen(), responseTimeout, new TreeMap<>(defaultContext));
        }

        @Nullable
        private ExternalAuthorization globalAuthorization(BuilderConfiguration.GlobalAuthorization global, ProxyConditions status) {
            NamespacedName serviceName = new NamespacedName(global.namespace(), global.name());
            Optional<Service> service = services.resolve(serviceName, global.port());
            if (service.isEmpty()) {
                status.addError(ERROR_AUTH, REASON_AUTH_BACKEND_NOT_FOUND, "global external authorization Service \"" + serviceName + "\" not found");
                return null;
            }
            return new ExternalAuthorization(service.get(), global.failOpen(), global.responseTimeout(), new TreeMap<>(global.context()));
        }

        @Nullable
        private TcpProxy tcpProxy(HTTPProxy root) {
            HTTPProxy current = root;
            TCPProxy declared = spec(root).tcpproxy();
            Deque<NamespacedName> chain = new ArrayDeque<>();
            chain.addLast(ResourcesUtil.namespacedName(root));
            while (true) {
                ProxyConditions status = statusCache.proxy(current);
                if (!declared.services().isEmpty() && declared.include() != null) {
                    status.addError(ERROR_TCP_PROXY, REASON_NO_SERVICES_AND_INCLUDE, "cannot specify services and include in the same tcpproxy");
                    return null;
                }
                if (declared.include() == null) {
                    break;
                }
                NamespacedName target = new NamespacedName(
                        declared.include().namespace() == null ? ResourcesUtil.namespace(current) : declared.include().namespace(),
                        declared.include().name());
                if (chain.contains(target)) {
                    String path = Stream.concat(chain.stream(), Stream.of(target)).map(NamespacedName::toString).collect(Collectors.joining(" -> "));
                    status.addError(ERROR_TCP_PROXY, REASON_TCP_INCLUDE_CREATES_CYCLE, "tcpproxy include creates a cycle: " + path);
                    return null;
                }
                Optional<HTTPProxy> included = cache.httpProxy(target).filter(p -> spec(p).tcpproxy() != null);
                if (included.isEmpty()) {
                    status.addError(ERROR_TCP_PROXY, REASON_TCP_INCLUDE_NOT_FOUND, "tcpproxy include " + target + " not found or has no tcpproxy");
                    return null;
                }
                chain.addLast(target);
                reached.add(target);
                current = included.get();
                declared = spec(current).tcpproxy();
            }
            ProxyConditions status = statusCache.proxy(current);
            if (declared.services().isEmpty()) {
                status.addError(ERROR_TCP_PROXY, REASON_NO_SERVICES_PRESENT, "tcpproxy: either services or include must be specified");
                return null;
            }
            List<Cluster> clusters = new ArrayList<>();
            for (BackendService backend : declared.services()) {
                if (!ServiceResolver.isValidPort(backend.port())) {
                    status.addError(ERROR_TCP_PROXY, REASON_SERVICE_PORT_INVALID, "service \"" + backend.name() + "\": port must be in the range 1-65535");
                    return null;
                }
                NamespacedName serviceName = new NamespacedName(ResourcesUtil.namespace(current), backend.name());
                Optional<Service> service = services.resolve(serviceName, backend.port());
                if (service.isEmpty()) {
                    status.addError(ERROR_TCP_PROXY, REASON_SERVICE_UNRESOLVED,
                            "Spec.TCPProxy unresolved service reference: service \"" + serviceName + "\" not found or has no port " + backend.port());
                    return null;
                }
                clusters.add(new Cluster(service.get(), backend.weight() == null ? 0 : backend.weight(), ServiceResolver.protocol(backend.protocol(), service.get()),
                        null, LoadBalancerStrategy.ROUND_ROBIN, null, HeadersPolicy.EMPTY, HeadersPolicy.EMPTY));
            }
            return new TcpProxy(clusters);
        }
    }

    @Nullable
    private static String pathRewrite(List<ReplacePrefix> replacements, PathMatch path, Route.Builder route) {
        Map<String, ReplacePrefix> byPrefix = new LinkedHashMap<>();
        for (ReplacePrefix replacement : replacements) {
            String prefix = replacement.prefix() == null ? "" : replacement.prefix();
            if (byPrefix.put(prefix, replacement) != null) {
                return "duplicate replacement prefix \"" + prefix + "\"";
            }
        }
        if (byPrefix.isEmpty() || path.type() != PathMatch.Type.PREFIX) {
            return null;
        }
        ReplacePrefix chosen = byPrefix.getOrDefault(path.value(), byPrefix.get(""));
        if (chosen == null) {
            return null;
        }
        route.pathRewrite(PathRewrite.replacePrefix(path.value(), chosen.replacement()));
        return null;
    }

    /**
     * Restricts the routes of a wildcard virtual host to requests whose authority is a single label under the domain.
     */
    @Nullable
    static HeaderMatch authorityMatch(String host) {
        if (!host.startsWith("*.")) {
            return null;
        }
        String regex = "[a-z0-9]([-a-z0-9]*[a-z0-9])?\\." + MatchConditions.quoteMeta(host.substring(2)) + "(:[0-9]+)?";
        return new HeaderMatch(":authority", StringMatchType.REGEX, regex, false, true, false);
    }

    private static HTTPProxySpec spec(HTTPProxy proxy) {
        HTTPProxySpec spec = proxy.getSpec();
        return spec == null ? new HTTPProxySpec(null, null, null, null) : spec;
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        return Stream.concat(first.stream(), second.stream()).toList();
    }
}
