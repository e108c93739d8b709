/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;

import io.routegraph.dag.ResourcesUtil;
import io.routegraph.dag.builder.BuildContext;
import io.routegraph.dag.builder.DagBuilder.ListenerBuilder;
import io.routegraph.dag.builder.DagBuilder.VirtualHostBuilder;
import io.routegraph.dag.match.ConflictTieBreak;
import io.routegraph.dag.match.HeaderMatch;
import io.routegraph.dag.match.InvalidRegexException;
import io.routegraph.dag.match.PathMatch;
import io.routegraph.dag.match.QueryMatch;
import io.routegraph.dag.match.RouteMatch;
import io.routegraph.dag.match.StringMatchType;
import io.routegraph.dag.model.Cluster;
import io.routegraph.dag.model.DirectResponse;
import io.routegraph.dag.model.HeadersPolicy;
import io.routegraph.dag.model.LoadBalancerStrategy;
import io.routegraph.dag.model.PathRewrite;
import io.routegraph.dag.model.Redirect;
import io.routegraph.dag.model.Route;
import io.routegraph.dag.model.Service;
import io.routegraph.dag.model.TcpProxy;
import io.routegraph.dag.model.TlsContext;
import io.routegraph.dag.processor.GatewayListeners.GatewayListener;
import io.routegraph.dag.status.GatewayConditions;
import io.routegraph.dag.status.RouteConditions;
import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.gateway.BackendRef;
import io.routegraph.kubernetes.api.gateway.BackendRouteRule;
import io.routegraph.kubernetes.api.gateway.GRPCMethodMatch;
import io.routegraph.kubernetes.api.gateway.GRPCRoute;
import io.routegraph.kubernetes.api.gateway.GRPCRouteMatch;
import io.routegraph.kubernetes.api.gateway.GRPCRouteRule;
import io.routegraph.kubernetes.api.gateway.HTTPHeader;
import io.routegraph.kubernetes.api.gateway.HTTPHeaderFilter;
import io.routegraph.kubernetes.api.gateway.HTTPHeaderMatch;
import io.routegraph.kubernetes.api.gateway.HTTPPathMatch;
import io.routegraph.kubernetes.api.gateway.HTTPPathModifier;
import io.routegraph.kubernetes.api.gateway.HTTPQueryParamMatch;
import io.routegraph.kubernetes.api.gateway.HTTPRequestRedirectFilter;
import io.routegraph.kubernetes.api.gateway.HTTPRoute;
import io.routegraph.kubernetes.api.gateway.HTTPRouteFilter;
import io.routegraph.kubernetes.api.gateway.HTTPRouteMatch;
import io.routegraph.kubernetes.api.gateway.HTTPRouteRule;
import io.routegraph.kubernetes.api.gateway.ParentReference;
import io.routegraph.kubernetes.api.gateway.RouteNamespaces;
import io.routegraph.kubernetes.api.gateway.TCPRoute;
import io.routegraph.kubernetes.api.gateway.TLSRoute;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Attaches Gateway API routes to the listeners of the managed Gateway.
 * <p>Routes of each family are processed oldest first. A rule whose match is already claimed on a virtual host by
 * another route of the same kind loses, so the older route keeps it; collisions with other kinds are left to the
 * configured conflict policy.</p>
 */
public class GatewayApiProcessor implements Processor {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayApiProcessor.class);

    public static final String REASON_NOT_ALLOWED_BY_LISTENERS = "NotAllowedByListeners";
    public static final String REASON_NO_MATCHING_PARENT = "NoMatchingParent";
    public static final String REASON_NO_MATCHING_LISTENER_HOSTNAME = "NoMatchingListenerHostname";
    public static final String REASON_UNSUPPORTED_VALUE = "UnsupportedValue";
    public static final String REASON_INVALID_KIND = "InvalidKind";
    public static final String REASON_REF_NOT_PERMITTED = "RefNotPermitted";
    public static final String REASON_BACKEND_NOT_FOUND = "BackendNotFound";
    public static final String REASON_RULE_MATCH_CONFLICT = RouteConditions.REASON_RULE_MATCH_CONFLICT;
    public static final String REASON_RULE_MATCH_PARTIALLY_CONFLICT = RouteConditions.REASON_RULE_MATCH_PARTIALLY_CONFLICT;

    static final String GRPC_PROTOCOL = "h2c";

    private static final String FILTER_REQUEST_HEADER_MODIFIER = "RequestHeaderModifier";
    private static final String FILTER_RESPONSE_HEADER_MODIFIER = "ResponseHeaderModifier";
    private static final String FILTER_REQUEST_REDIRECT = "RequestRedirect";
    private static final String FILTER_URL_REWRITE = "URLRewrite";
    private static final String FILTER_REQUEST_MIRROR = "RequestMirror";
    private static final String MATCH_EXACT = "Exact";
    private static final String MATCH_PATH_PREFIX = "PathPrefix";
    private static final String MATCH_REGULAR_EXPRESSION = "RegularExpression";
    private static final String MODIFIER_REPLACE_FULL_PATH = "ReplaceFullPath";
    private static final String MODIFIER_REPLACE_PREFIX_MATCH = "ReplacePrefixMatch";

    @Override
    public void run(BuildContext context) {
        context.gatewayListeners().ifPresent(listeners -> new RouteAttacher(context, listeners).process());
    }

    /**
     * A route's attachment to one listener, with the hostnames it serves there.
     */
    private record Attachment(ParentReference parentRef, GatewayListener listener, List<String> hostnames) {}

    /**
     * The translated actions of one HTTP or gRPC rule.
     */
    private record RuleActions(
                               HeadersPolicy requestHeaders,
                               HeadersPolicy responseHeaders,
                               @Nullable Redirect redirect,
                               @Nullable HTTPPathModifier rewritePath,
                               @Nullable Cluster mirror) {}

    /**
     * Thrown for a field value this builder does not support, rejecting the whole route.
     */
    private static class UnsupportedValueException extends Exception {
        UnsupportedValueException(String message) {
            super(message);
        }
    }

    private static final class RouteAttacher {
        private final BuildContext context;
        private final GatewayListeners listeners;
        private final NamespacedName gatewayName;
        private final GatewayConditions gatewayStatus;
        private final ServiceResolver services;
        private final Set<String> attachedPairs = new HashSet<>();

        RouteAttacher(BuildContext context, GatewayListeners listeners) {
            this.context = context;
            this.listeners = listeners;
            this.gatewayName = ResourcesUtil.namespacedName(listeners.gateway());
            this.gatewayStatus = context.statusCache().gateway(listeners.gateway());
            this.services = new ServiceResolver(context.cache());
        }

        void process() {
            List<HasMetadata> httpFamily = Stream.concat(context.cache().httpRoutes().stream(), context.cache().grpcRoutes().stream())
                    .map(HasMetadata.class::cast)
                    .sorted(oldestFirst())
                    .toList();
            for (HasMetadata route : httpFamily) {
                context.processing(route);
                if (route instanceof HTTPRoute httpRoute) {
                    httpRoute(httpRoute);
                }
                else if (route instanceof GRPCRoute grpcRoute) {
                    grpcRoute(grpcRoute);
                }
            }
            for (TLSRoute route : context.cache().tlsRoutes().stream().sorted(oldestFirst()).toList()) {
                context.processing(route);
                tlsRoute(route);
            }
            for (TCPRoute route : context.cache().tcpRoutes().stream().sorted(oldestFirst()).toList()) {
                context.processing(route);
                tcpRoute(route);
            }
        }

        private static Comparator<HasMetadata> oldestFirst() {
            return Comparator.comparing(ResourcesUtil::origin, ConflictTieBreak.WINNER_FIRST);
        }

        private void httpRoute(HTTPRoute route) {
            if (route.getSpec() == null) {
                return;
            }
            RouteConditions status = context.statusCache().route(route);
            List<Attachment> attachments = attach(route, ListenerProcessor.KIND_HTTP_ROUTE, route.getSpec().parentRefs(), route.getSpec().hostnames(), status);
            if (attachments.isEmpty()) {
                return;
            }
            List<Route> routes = new ArrayList<>();
            try {
                for (HTTPRouteRule rule : route.getSpec().rules()) {
                    List<RouteMatch> matches = new ArrayList<>();
                    for (HTTPRouteMatch match : rule.matches()) {
                        matches.add(httpMatch(match));
                    }
                    RuleActions actions = actions(route, ListenerProcessor.KIND_HTTP_ROUTE, rule.filters(), false, attachments, status);
                    List<Cluster> clusters = clusters(route, ListenerProcessor.KIND_HTTP_ROUTE, rule.backendRefs(), null, attachments, status);
                    routes.addAll(routes(route, matches, actions, clusters));
                }
            }
            catch (UnsupportedValueException e) {
                reject(attachments, status, REASON_UNSUPPORTED_VALUE, e.getMessage());
                return;
            }
            place(attachments, routes, status);
        }

        private void grpcRoute(GRPCRoute route) {
            if (route.getSpec() == null) {
                return;
            }
            RouteConditions status = context.statusCache().route(route);
            List<Attachment> attachments = attach(route, ListenerProcessor.KIND_GRPC_ROUTE, route.getSpec().parentRefs(), route.getSpec().hostnames(), status);
            if (attachments.isEmpty()) {
                return;
            }
            List<Route> routes = new ArrayList<>();
            try {
                for (GRPCRouteRule rule : route.getSpec().rules()) {
                    List<RouteMatch> matches = new ArrayList<>();
                    for (GRPCRouteMatch match : rule.matches()) {
                        matches.add(grpcMatch(match));
                    }
                    RuleActions actions = actions(route, ListenerProcessor.KIND_GRPC_ROUTE, rule.filters(), true, attachments, status);
                    List<Cluster> clusters = clusters(route, ListenerProcessor.KIND_GRPC_ROUTE, rule.backendRefs(), GRPC_PROTOCOL, attachments, status);
                    routes.addAll(routes(route, matches, actions, clusters));
                }
            }
            catch (UnsupportedValueException e) {
                reject(attachments, status, REASON_UNSUPPORTED_VALUE, e.getMessage());
                return;
            }
            place(attachments, routes, status);
        }

        private void tlsRoute(TLSRoute route) {
            if (route.getSpec() == null) {
                return;
            }
            RouteConditions status = context.statusCache().route(route);
            List<Attachment> attachments = attach(route, ListenerProcessor.KIND_TLS_ROUTE, route.getSpec().parentRefs(), route.getSpec().hostnames(), status);
            if (attachments.isEmpty()) {
                return;
            }
            Optional<TcpProxy> proxy = tcpProxy(route, ListenerProcessor.KIND_TLS_ROUTE, route.getSpec().rules(), attachments, status);
            if (proxy.isEmpty()) {
                return;
            }
            int placed = 0;
            int lost = 0;
            for (Attachment attachment : attachments) {
                Optional<ListenerBuilder> listener = context.dag().findListener(attachment.listener().dagListener());
                if (listener.isEmpty()) {
                    continue;
                }
                TlsContext tls = attachment.listener().passthrough() ? TlsContext.forPassthrough() : attachment.listener().tls();
                for (String hostname : attachment.hostnames()) {
                    placed++;
                    VirtualHostBuilder virtualHost = listener.get().virtualHost(hostname);
                    if (virtualHost.hasTcpProxy() || tls == null || !virtualHost.tls(tls)) {
                        lost++;
                        continue;
                    }
                    virtualHost.tcpProxy(proxy.get());
                }
            }
            conflicts(attachments, status, placed, lost);
        }

        private void tcpRoute(TCPRoute route) {
            if (route.getSpec() == null) {
                return;
            }
            RouteConditions status = context.statusCache().route(route);
            List<Attachment> attachments = attach(route, ListenerProcessor.KIND_TCP_ROUTE, route.getSpec().parentRefs(), List.of(), status);
            if (attachments.isEmpty()) {
                return;
            }
            Optional<TcpProxy> proxy = tcpProxy(route, ListenerProcessor.KIND_TCP_ROUTE, route.getSpec().rules(), attachments, status);
            if (proxy.isEmpty()) {
                return;
            }
            int placed = 0;
            int lost = 0;
            for (Attachment attachment : attachments) {
                Optional<ListenerBuilder> listener = context.dag().findListener(attachment.listener().dagListener());
                if (listener.isEmpty()) {
                    continue;
                }
                placed++;
                if (listener.get().hasTcpProxy()) {
                    lost++;
                    continue;
                }
                listener.get().tcpProxy(proxy.get());
            }
            conflicts(attachments, status, placed, lost);
        }

        private List<Attachment> attach(HasMetadata route, String kind, List<ParentReference> parentRefs, List<String> hostnames, RouteConditions status) {
            String routeNamespace = ResourcesUtil.namespace(route);
            List<Attachment> attachments = new ArrayList<>();
            for (ParentReference parentRef : parentRefs) {
                if (!refersToGateway(parentRef, routeNamespace)) {
                    continue;
                }
                RouteConditions.ParentConditions parent = status.parent(parentRef);
                List<GatewayListener> candidates = listeners.listeners().stream()
                        .filter(l -> parentRef.sectionName() == null || parentRef.sectionName().equals(l.name()))
                        .filter(l -> parentRef.port() == null || parentRef.port() == l.declaredPort())
                        .toList();
                if (candidates.isEmpty()) {
                    parent.notAccepted(REASON_NO_MATCHING_PARENT, "No listeners match this parent ref");
                    continue;
                }
                List<GatewayListener> allowed = candidates.stream()
                        .filter(GatewayListener::valid)
                        .filter(l -> l.supportsKind(kind))
                        .filter(l -> namespaceAllowed(l.allowedNamespaces(), routeNamespace))
                        .toList();
                if (allowed.isEmpty()) {
                    parent.notAccepted(REASON_NOT_ALLOWED_BY_LISTENERS, "No listeners included by this parent ref allowed this attachment.");
                    continue;
                }
                boolean attached = false;
                for (GatewayListener listener : allowed) {
                    List<String> served = Hostnames.intersect(listener.hostname(), hostnames).stream()
                            .filter(h -> !isolated(listener, h))
                            .toList();
                    if (served.isEmpty()) {
                        continue;
                    }
                    attached = true;
                    attachments.add(new Attachment(parentRef, listener, served));
                    if (attachedPairs.add(ResourcesUtil.origin(route) + "@" + listener.name())) {
                        gatewayStatus.listener(listener.name()).attachRoute();
                    }
                }
                if (!attached) {
                    parent.notAccepted(REASON_NO_MATCHING_LISTENER_HOSTNAME, "No intersecting hostnames were found between the listener and the route.");
                }
            }
            return attachments;
        }

        private boolean refersToGateway(ParentReference parentRef, String routeNamespace) {
            boolean gatewayGroup = parentRef.group() == null || parentRef.group().equals(ReferenceGrants.GATEWAY_GROUP);
            boolean gatewayKind = parentRef.kind() == null || parentRef.kind().equals("Gateway");
            String namespace = parentRef.namespace() == null ? routeNamespace : parentRef.namespace();
            return gatewayGroup && gatewayKind && gatewayName.equals(new NamespacedName(namespace, parentRef.name()));
        }

        /**
         * A hostname is served by the most specific listener on the port that matches it.
         */
        private boolean isolated(GatewayListener owner, String hostname) {
            if (hostname.equals(Hostnames.ANY)) {
                return false;
            }
            return listeners.listeners().stream()
                    .filter(l -> l != owner && l.valid() && l.declaredPort() == owner.declaredPort() && l.hostname() != null)
                    .anyMatch(l -> Hostnames.specificity(l.hostname()) > Hostnames.specificity(owner.hostname()) && Hostnames.matches(l.hostname(), hostname));
        }

        private boolean namespaceAllowed(@Nullable RouteNamespaces allowed, String routeNamespace) {
            String from = allowed == null || allowed.from() == null ? "Same" : allowed.from();
            return switch (from) {
                case "All" -> true;
                case "Selector" -> allowed.selector() != null && selects(allowed.selector(), context.cache().namespaceLabels(routeNamespace));
                default -> routeNamespace.equals(gatewayName.namespace());
            };
        }

        private static boolean selects(LabelSelector selector, Map<String, String> labels) {
            if (selector.getMatchLabels() != null && !selector.getMatchLabels().entrySet().stream()
                    .allMatch(e -> e.getValue().equals(labels.get(e.getKey())))) {
                return false;
            }
            if (selector.getMatchExpressions() == null) {
                return true;
            }
            for (LabelSelectorRequirement requirement : selector.getMatchExpressions()) {
                String value = labels.get(requirement.getKey());
                List<String> values = requirement.getValues() == null ? List.of() : requirement.getValues();
                boolean satisfied = switch (requirement.getOperator()) {
                    case "In" -> value != null && values.contains(value);
                    case "NotIn" -> value == null || !values.contains(value);
                    case "Exists" -> value != null;
                    case "DoesNotExist" -> value == null;
                    default -> false;
                };
                if (!satisfied) {
                    return false;
                }
            }
            return true;
        }

        private RouteMatch httpMatch(HTTPRouteMatch match) throws UnsupportedValueException {
            List<HeaderMatch> headers = new ArrayList<>();
            for (HTTPHeaderMatch header : match.headers()) {
                headers.add(headerMatch(header));
            }
            List<QueryMatch> queries = new ArrayList<>();
            for (HTTPQueryParamMatch query : match.queryParams()) {
                String type = query.type() == null ? MATCH_EXACT : query.type();
                if (type.equals(MATCH_EXACT)) {
                    queries.add(QueryMatch.of(query.name(), StringMatchType.EXACT, query.value()));
                }
                else if (type.equals(MATCH_REGULAR_EXPRESSION)) {
                    queries.add(QueryMatch.of(query.name(), StringMatchType.REGEX, validRegex(query.value())));
                }
                else {
                    throw new UnsupportedValueException("HTTPRoute.Spec.Rules.QueryParamMatch: Only Exact and RegularExpression match types are supported");
                }
            }
            return new RouteMatch(pathMatch(match.path()), headers, queries, match.method());
        }

        private PathMatch pathMatch(@Nullable HTTPPathMatch path) throws UnsupportedValueException {
            if (path == null) {
                return PathMatch.ROOT;
            }
            String value = path.value() == null ? "/" : path.value();
            String type = path.type() == null ? MATCH_PATH_PREFIX : path.type();
            return switch (type) {
                case MATCH_PATH_PREFIX -> PathMatch.prefix(value);
                case MATCH_EXACT -> PathMatch.exact(value);
                case MATCH_REGULAR_EXPRESSION -> PathMatch.regex(validRegex(value));
                default -> throw new UnsupportedValueException(
                        "HTTPRoute.Spec.Rules.PathMatch: Only Prefix match type, Exact match type and RegularExpression match type are supported");
            };
        }

        private HeaderMatch headerMatch(HTTPHeaderMatch header) throws UnsupportedValueException {
            String type = header.type() == null ? MATCH_EXACT : header.type();
            if (type.equals(MATCH_EXACT)) {
                return HeaderMatch.of(header.name(), StringMatchType.EXACT, header.value());
            }
            if (type.equals(MATCH_REGULAR_EXPRESSION)) {
                return HeaderMatch.of(header.name(), StringMatchType.REGEX, validRegex(header.value()));
            }
            throw new UnsupportedValueException("HeaderMatch: Only Exact and RegularExpression match types are supported");
        }

        private RouteMatch grpcMatch(GRPCRouteMatch match) throws UnsupportedValueException {
            List<HeaderMatch> headers = new ArrayList<>();
            for (HTTPHeaderMatch header : match.headers()) {
                headers.add(headerMatch(header));
            }
            return new RouteMatch(grpcPath(match.method()), headers, List.of(), null);
        }

        /**
         * gRPC requests are {@code POST /service/method}.
         */
        private PathMatch grpcPath(@Nullable GRPCMethodMatch method) throws UnsupportedValueException {
            if (method == null || method.service() == null && method.method() == null) {
                return PathMatch.ROOT;
            }
            String type = method.type() == null ? MATCH_EXACT : method.type();
            if (type.equals(MATCH_REGULAR_EXPRESSION)) {
                String service = method.service() == null ? "[^/]+" : method.service();
                String name = method.method() == null ? "[^/]+" : method.method();
                return PathMatch.regex(validRegex("/" + service + "/" + name));
            }
            if (!type.equals(MATCH_EXACT)) {
                throw new UnsupportedValueException("GRPCRoute.Spec.Rules.Matches.Method: Only Exact and RegularExpression match types are supported");
            }
            if (method.service() != null && method.method() != null) {
                return PathMatch.exact("/" + method.service() + "/" + method.method());
            }
            if (method.service() != null) {
                return PathMatch.stringPrefix("/" + method.service() + "/");
            }
            return PathMatch.regex(validRegex("/[^/]+/" + MatchConditions.quoteMeta(method.method())));
        }

        private String validRegex(@Nullable String regex) throws UnsupportedValueException {
            if (regex == null) {
                throw new UnsupportedValueException("regular expression must not be empty");
            }
            try {
                context.regexValidator().validate(regex);
                return regex;
            }
            catch (InvalidRegexException e) {
                throw new UnsupportedValueException(e.getMessage());
            }
        }

        private RuleActions actions(HasMetadata route, String kind, List<HTTPRouteFilter> filters, boolean grpc, List<Attachment> attachments,
                                    RouteConditions status)
                throws UnsupportedValueException {
            HeadersPolicy requestHeaders = HeadersPolicy.EMPTY;
            HeadersPolicy responseHeaders = HeadersPolicy.EMPTY;
            Redirect redirect = null;
            HTTPPathModifier rewritePath = null;
            Cluster mirror = null;
            for (HTTPRouteFilter filter : filters) {
                String type = filter.type() == null ? "" : filter.type();
                switch (type) {
                    case FILTER_REQUEST_HEADER_MODIFIER -> requestHeaders = requestHeaders.overriddenBy(headers(filter.requestHeaderModifier(), true));
                    case FILTER_RESPONSE_HEADER_MODIFIER -> responseHeaders = responseHeaders.overriddenBy(headers(filter.responseHeaderModifier(), false));
                    case FILTER_REQUEST_MIRROR -> {
                        if (filter.requestMirror() == null || filter.requestMirror().backendRef() == null) {
                            throw new UnsupportedValueException("RequestMirror filter must set a backendRef");
                        }
                        Optional<Service> service = service(route, kind, filter.requestMirror().backendRef(), attachments, status);
                        if (service.isPresent()) {
                            mirror = cluster(service.get(), 1, grpc ? GRPC_PROTOCOL : null);
                        }
                    }
                    case FILTER_REQUEST_REDIRECT -> {
                        if (grpc || filter.requestRedirect() == null) {
                            throw new UnsupportedValueException(kind + ".Spec.Rules.Filters: invalid RequestRedirect filter");
                        }
                        redirect = redirect(filter.requestRedirect());
                    }
                    case FILTER_URL_REWRITE -> {
                        if (grpc || filter.urlRewrite() == null) {
                            throw new UnsupportedValueException(kind + ".Spec.Rules.Filters: invalid URLRewrite filter");
                        }
                        if (filter.urlRewrite().hostname() != null) {
                            requestHeaders = requestHeaders.overriddenBy(
                                    new HeadersPolicy(new TreeMap<>(), new TreeMap<>(), List.of(), filter.urlRewrite().hostname()));
                        }
                        rewritePath = filter.urlRewrite().path();
                    }
                    default -> throw new UnsupportedValueException(kind + ".Spec.Rules.Filters: invalid type \"" + type + "\"");
                }
            }
            return new RuleActions(requestHeaders, responseHeaders, redirect, rewritePath, mirror);
        }

        private static HeadersPolicy headers(@Nullable HTTPHeaderFilter filter, boolean request) throws UnsupportedValueException {
            if (filter == null) {
                throw new UnsupportedValueException("header modifier filter has no configuration");
            }
            TreeMap<String, String> set = new TreeMap<>();
            String hostRewrite = null;
            for (HTTPHeader header : filter.set()) {
                if (request && header.name().equalsIgnoreCase("host")) {
                    hostRewrite = header.value();
                }
                else {
                    set.put(header.name(), header.value());
                }
            }
            TreeMap<String, String> add = new TreeMap<>();
            for (HTTPHeader header : filter.add()) {
                add.put(header.name(), header.value());
            }
            return new HeadersPolicy(set, add, filter.remove(), hostRewrite);
        }

        private static Redirect redirect(HTTPRequestRedirectFilter filter) throws UnsupportedValueException {
            int statusCode = filter.statusCode() == null ? 302 : filter.statusCode();
            if (statusCode != 301 && statusCode != 302) {
                throw new UnsupportedValueException("RequestRedirect.StatusCode must be 301 or 302");
            }
            String path = null;
            String prefix = null;
            if (filter.path() != null) {
                if (MODIFIER_REPLACE_FULL_PATH.equals(filter.path().type())) {
                    path = filter.path().replaceFullPath();
                }
                else if (MODIFIER_REPLACE_PREFIX_MATCH.equals(filter.path().type())) {
                    prefix = filter.path().replacePrefixMatch();
                }
                else {
                    throw new UnsupportedValueException("RequestRedirect.Path.Type must be ReplaceFullPath or ReplacePrefixMatch");
                }
            }
            return new Redirect(filter.scheme(), filter.hostname(), filter.port(), statusCode, path, prefix);
        }

        /**
         * @return the clusters of the rule, or an empty list if any backend is unusable
         */
        private List<Cluster> clusters(HasMetadata route, String kind, List<BackendRef> backendRefs, @Nullable String protocol, List<Attachment> attachments,
                                       RouteConditions status) {
            List<Cluster> clusters = new ArrayList<>();
            for (BackendRef backendRef : backendRefs) {
                Optional<Service> service = service(route, kind, backendRef, attachments, status);
                if (service.isEmpty()) {
                    return List.of();
                }
                clusters.add(cluster(service.get(), backendRef.weight() == null ? 1 : backendRef.weight(), protocol));
            }
            return clusters;
        }

        private Cluster cluster(Service service, int weight, @Nullable String protocol) {
            var policy = context.configuration().policy();
            return new Cluster(service, weight, ServiceResolver.protocol(protocol, service), null, LoadBalancerStrategy.ROUND_ROBIN, null,
                    policy.requestHeadersPolicy(), policy.responseHeadersPolicy());
        }

        private Optional<Service> service(HasMetadata route, String kind, BackendRef backendRef, List<Attachment> attachments, RouteConditions status) {
            boolean coreGroup = backendRef.group() == null || backendRef.group().isEmpty();
            boolean serviceKind = backendRef.kind() == null || backendRef.kind().equals("Service");
            if (!coreGroup || !serviceKind) {
                unresolved(attachments, status, REASON_INVALID_KIND, "Spec.Rules.BackendRef.Kind must be Service, not \"" + backendRef.kind() + "\"");
                return Optional.empty();
            }
            String routeNamespace = ResourcesUtil.namespace(route);
            NamespacedName serviceName = new NamespacedName(backendRef.namespace() == null ? routeNamespace : backendRef.namespace(), backendRef.name());
            if (!ReferenceGrants.permits(context.cache(), ReferenceGrants.GATEWAY_GROUP, kind, routeNamespace,
                    ReferenceGrants.CORE_GROUP, "Service", serviceName.namespace(), serviceName.name())) {
                unresolved(attachments, status, REASON_REF_NOT_PERMITTED,
                        "Spec.Rules.BackendRef.Namespace must match the route's namespace or be covered by a ReferenceGrant");
                return Optional.empty();
            }
            if (backendRef.port() == null) {
                unresolved(attachments, status, REASON_UNSUPPORTED_VALUE, "Spec.Rules.BackendRef.Port must be specified");
                return Optional.empty();
            }
            Optional<Service> service = services.resolve(serviceName, backendRef.port());
            if (service.isEmpty()) {
                unresolved(attachments, status, REASON_BACKEND_NOT_FOUND, "service \"" + serviceName + "\" not found or has no port " + backendRef.port());
            }
            return service;
        }

        private Optional<TcpProxy> tcpProxy(HasMetadata route, String kind, List<BackendRouteRule> rules, List<Attachment> attachments, RouteConditions status) {
            List<Cluster> clusters = new ArrayList<>();
            for (BackendRouteRule rule : rules) {
                for (BackendRef backendRef : rule.backendRefs()) {
                    Optional<Service> service = service(route, kind, backendRef, attachments, status);
                    if (service.isEmpty()) {
                        return Optional.empty();
                    }
                    clusters.add(cluster(service.get(), backendRef.weight() == null ? 1 : backendRef.weight(), null));
                }
            }
            if (clusters.isEmpty()) {
                unresolved(attachments, status, REASON_BACKEND_NOT_FOUND, kind + " has no backends");
                return Optional.empty();
            }
            return Optional.of(new TcpProxy(clusters));
        }

        private List<Route> routes(HasMetadata owner, List<RouteMatch> matches, RuleActions actions, List<Cluster> clusters) throws UnsupportedValueException {
            List<RouteMatch> effective = matches.isEmpty() ? List.of(RouteMatch.of(PathMatch.ROOT)) : matches;
            List<Route> routes = new ArrayList<>();
            for (RouteMatch match : effective) {
                Route.Builder route = Route.builder(match, ResourcesUtil.origin(owner))
                        .requestHeaders(actions.requestHeaders())
                        .responseHeaders(actions.responseHeaders());
                if (actions.redirect() != null) {
                    route.redirect(actions.redirect());
                }
                else if (clusters.isEmpty()) {
                    route.directResponse(DirectResponse.INTERNAL_SERVER_ERROR);
                }
                else {
                    clusters.forEach(route::addCluster);
                    route.mirror(actions.mirror());
                }
                if (actions.rewritePath() != null) {
                    route.pathRewrite(pathRewrite(actions.rewritePath(), match.path()));
                }
                routes.add(route.build());
            }
            return routes;
        }

        private static PathRewrite pathRewrite(HTTPPathModifier modifier, PathMatch path) throws UnsupportedValueException {
            if (MODIFIER_REPLACE_FULL_PATH.equals(modifier.type()) && modifier.replaceFullPath() != null) {
                return PathRewrite.replaceFullPath(modifier.replaceFullPath());
            }
            if (MODIFIER_REPLACE_PREFIX_MATCH.equals(modifier.type()) && modifier.replacePrefixMatch() != null) {
                if (path.type() != PathMatch.Type.PREFIX) {
                    throw new UnsupportedValueException("URLRewrite.Path.ReplacePrefixMatch requires a PathPrefix match");
                }
                return PathRewrite.replacePrefix(path.value(), modifier.replacePrefixMatch());
            }
            throw new UnsupportedValueException("URLRewrite.Path.Type must be ReplaceFullPath or ReplacePrefixMatch");
        }

        private void place(List<Attachment> attachments, List<Route> routes, RouteConditions status) {
            int placed = 0;
            int lost = 0;
            for (Attachment attachment : attachments) {
                Optional<ListenerBuilder> listener = context.dag().findListener(attachment.listener().dagListener());
                if (listener.isEmpty()) {
                    continue;
                }
                for (String hostname : attachment.hostnames()) {
                    VirtualHostBuilder virtualHost = listener.get().virtualHost(hostname);
                    TlsContext tls = attachment.listener().tls();
                    if (tls != null && !virtualHost.tls(tls)) {
                        LOGGER.atDebug()
                                .setMessage("virtual host {} on {} already has different TLS settings, not attaching")
                                .addArgument(hostname)
                                .addArgument(attachment.listener().dagListener())
                                .log();
                        continue;
                    }
                    HeaderMatch authority = HTTPProxyProcessor.authorityMatch(hostname);
                    for (Route route : routes) {
                        Route placedRoute = authority == null ? route : route.toBuilder().match(route.match().withHeaders(List.of(authority))).build();
                        placed++;
                        Optional<Route> existing = virtualHost.route(placedRoute.match());
                        boolean claimedBySameKind = existing.isPresent()
                                && !existing.get().origin().equals(placedRoute.origin())
                                && existing.get().origin().kind().equals(placedRoute.origin().kind());
                        if (claimedBySameKind || !virtualHost.addRoute(placedRoute)) {
                            lost++;
                        }
                    }
                }
            }
            conflicts(attachments, status, placed, lost);
        }

        private static void conflicts(List<Attachment> attachments, RouteConditions status, int placed, int lost) {
            if (lost == 0) {
                return;
            }
            for (ParentReference parentRef : parentRefs(attachments)) {
                if (lost == placed) {
                    status.parent(parentRef).notAccepted(REASON_RULE_MATCH_CONFLICT, "all rules conflict with rules of other routes");
                }
                else {
                    status.parent(parentRef).partiallyInvalid(REASON_RULE_MATCH_PARTIALLY_CONFLICT, "some rules conflict with rules of other routes");
                }
            }
        }

        private static void reject(List<Attachment> attachments, RouteConditions status, String reason, String message) {
            parentRefs(attachments).forEach(parentRef -> status.parent(parentRef).notAccepted(reason, message));
        }

        private static void unresolved(List<Attachment> attachments, RouteConditions status, String reason, String message) {
            parentRefs(attachments).forEach(parentRef -> status.parent(parentRef).unresolvedRefs(reason, message));
        }

        private static Set<ParentReference> parentRefs(List<Attachment> attachments) {
            Set<ParentReference> parentRefs = new LinkedHashSet<>();
            attachments.forEach(a -> parentRefs.add(a.parentRef()));
            return parentRefs;
        }
    }
}
