/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.networking.v1.HTTPIngressPath;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.networking.v1.IngressBackend;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRule;
import io.fabric8.kubernetes.api.model.networking.v1.IngressRuleBuilder;
import io.fabric8.kubernetes.api.model.networking.v1.IngressServiceBackend;
import io.fabric8.kubernetes.api.model.networking.v1.IngressTLS;

import io.routegraph.dag.ResourcesUtil;
import io.routegraph.dag.builder.BuildContext;
import io.routegraph.dag.builder.DagBuilder.VirtualHostBuilder;
import io.routegraph.dag.config.BuilderConfiguration;
import io.routegraph.dag.match.ConflictTieBreak;
import io.routegraph.dag.match.HeaderMatch;
import io.routegraph.dag.match.InvalidRegexException;
import io.routegraph.dag.match.PathMatch;
import io.routegraph.dag.match.RouteMatch;
import io.routegraph.dag.model.Cluster;
import io.routegraph.dag.model.LoadBalancerStrategy;
import io.routegraph.dag.model.Redirect;
import io.routegraph.dag.model.Route;
import io.routegraph.dag.model.Service;
import io.routegraph.dag.model.TlsContext;
import io.routegraph.dag.secret.SecretResolution;
import io.routegraph.dag.status.IngressConditions;
import io.routegraph.kubernetes.api.common.NamespacedName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Translates networking.k8s.io/v1 Ingress objects of the configured class.
 * Ingresses are processed oldest first, so that when two claim the same host and path the older one is already
 * in place and the newer one is reported as conflicting.
 */
public class IngressProcessor implements Processor {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngressProcessor.class);

    public static final String DEFAULT_INGRESS_CLASS = "routegraph";
    public static final String REASON_BACKEND_NOT_FOUND = "BackendNotFound";
    public static final String REASON_TLS_CONFIG_NOT_VALID = "TLSConfigNotValid";
    public static final String REASON_REGEX_NOT_VALID = "RegexNotValid";

    private static final String WILDCARD_HOST = "*";
    private static final String PATH_TYPE_EXACT = "Exact";
    private static final String PATH_TYPE_IMPLEMENTATION_SPECIFIC = "ImplementationSpecific";
    private static final String REGEX_META_CHARACTERS = "^+*[]%";

    @Override
    public void run(BuildContext context) {
        List<Ingress> ingresses = context.cache().ingresses().stream()
                .filter(ingress -> matchesClass(ingress, context.configuration().ingressClassName()))
                .sorted(Comparator.comparing(ResourcesUtil::origin, ConflictTieBreak.WINNER_FIRST))
                .toList();
        for (Ingress ingress : ingresses) {
            context.processing(ingress);
            process(context, ingress);
        }
    }

    static boolean matchesClass(Ingress ingress, @Nullable String configured) {
        String declared = ingress.getSpec() == null ? null : ingress.getSpec().getIngressClassName();
        if (declared == null) {
            declared = new IngressAnnotations(ingress).ingressClass();
        }
        if (configured == null) {
            return declared == null || declared.equals(DEFAULT_INGRESS_CLASS);
        }
        return configured.equals(declared);
    }

    private void process(BuildContext context, Ingress ingress) {
        IngressConditions status = context.statusCache().ingress(ingress);
        if (ingress.getSpec() == null) {
            return;
        }
        IngressAnnotations annotations = new IngressAnnotations(ingress);
        Map<String, TlsContext> tlsByHost = tls(context, ingress, annotations, status);
        ServiceResolver services = new ServiceResolver(context.cache());

        List<IngressRule> rules = new ArrayList<>();
        if (ingress.getSpec().getRules() != null) {
            rules.addAll(ingress.getSpec().getRules());
        }
        IngressBackend defaultBackend = ingress.getSpec().getDefaultBackend();
        if (defaultBackend != null) {
            rules.add(new IngressRuleBuilder()
                    .withNewHttp()
                    .addNewPath()
                    .withBackend(defaultBackend)
                    .withPath("/")
                    .withPathType("Prefix")
                    .endPath()
                    .endHttp()
                    .build());
        }

        for (IngressRule rule : rules) {
            String host = rule.getHost() == null || rule.getHost().isEmpty() ? WILDCARD_HOST : rule.getHost().toLowerCase(Locale.ROOT);
            if (rule.getHttp() == null || rule.getHttp().getPaths() == null) {
                continue;
            }
            for (HTTPIngressPath path : rule.getHttp().getPaths()) {
                Optional<Route> route = route(context, ingress, host, path, annotations, services, status);
                route.ifPresent(r -> emit(context, host, r, tlsByHost.get(host), annotations));
            }
        }
    }

    private Optional<Route> route(BuildContext context, Ingress ingress, String host, HTTPIngressPath path, IngressAnnotations annotations,
                                  ServiceResolver services, IngressConditions status) {
        PathMatch pathMatch = pathMatch(path);
        if (pathMatch.type() == PathMatch.Type.REGEX) {
            try {
                context.regexValidator().validate(pathMatch.value());
            }
            catch (InvalidRegexException e) {
                LOGGER.atDebug()
                        .setMessage("skipping path {} of Ingress {}: {}")
                        .addArgument(pathMatch.value())
                        .addArgument(ResourcesUtil.namespacedName(ingress))
                        .addArgument(e.getMessage())
                        .log();
                status.invalidPath(REASON_REGEX_NOT_VALID, e.getMessage());
                return Optional.empty();
            }
        }
        IngressServiceBackend backend = path.getBackend() == null ? null : path.getBackend().getService();
        if (backend == null || backend.getName() == null) {
            status.unresolvedRefs(REASON_BACKEND_NOT_FOUND, "path " + pathMatch.value() + " has no Service backend");
            return Optional.empty();
        }
        NamespacedName serviceName = new NamespacedName(ResourcesUtil.namespace(ingress), backend.getName());
        Optional<Service> service = Optional.empty();
        if (backend.getPort() != null && backend.getPort().getNumber() != null) {
            service = services.resolve(serviceName, backend.getPort().getNumber());
        }
        else if (backend.getPort() != null && backend.getPort().getName() != null) {
            service = services.resolve(serviceName, backend.getPort().getName());
        }
        if (service.isEmpty()) {
            status.unresolvedRefs(REASON_BACKEND_NOT_FOUND, "Service " + serviceName + " or its port not found");
            return Optional.empty();
        }

        BuilderConfiguration.Policy policy = context.configuration().policy();
        Cluster cluster = new Cluster(service.get(), 0, ServiceResolver.protocol(null, service.get()), null, LoadBalancerStrategy.ROUND_ROBIN, null,
                policy.requestHeadersPolicy(), policy.responseHeadersPolicy());
        RouteMatch match = RouteMatch.of(pathMatch);
        HeaderMatch authority = HTTPProxyProcessor.authorityMatch(host);
        if (authority != null) {
            match = match.withHeaders(List.of(authority));
        }
        Set<String> websocketPaths = annotations.websocketPaths();
        return Optional.of(Route.builder(match, ResourcesUtil.origin(ingress))
                .addCluster(cluster)
                .timeoutPolicy(annotations.timeoutPolicy())
                .retryPolicy(annotations.retryPolicy())
                .websocket(websocketPaths.contains(pathMatch.value()))
                .build());
    }

    private void emit(BuildContext context, String host, Route route, @Nullable TlsContext tls, IngressAnnotations annotations) {
        Optional<VirtualHostBuilder> secure = tls == null ? Optional.empty()
                : context.secureListener().flatMap(context.dag()::findListener).map(l -> l.virtualHost(host));
        secure.ifPresent(vhost -> vhost.addRoute(route));
        if (!annotations.allowHttp()) {
            return;
        }
        Optional<VirtualHostBuilder> insecure = context.insecureListener().flatMap(context.dag()::findListener).map(l -> l.virtualHost(host));
        boolean redirect = annotations.forceSslRedirect();
        insecure.ifPresent(vhost -> vhost.addRoute(redirect ? Route.builder(route.match(), route.origin()).redirect(Redirect.toHttps()).build() : route));
    }

    private Map<String, TlsContext> tls(BuildContext context, Ingress ingress, IngressAnnotations annotations, IngressConditions status) {
        Map<String, TlsContext> byHost = new HashMap<>();
        if (ingress.getSpec().getTls() == null) {
            return byHost;
        }
        String namespace = ResourcesUtil.namespace(ingress);
        for (IngressTLS tls : ingress.getSpec().getTls()) {
            if (tls.getSecretName() == null || tls.getSecretName().isEmpty()) {
                continue;
            }
            SecretResolution resolution = context.secrets().delegatedKeyPair(NamespacedName.parse(namespace, tls.getSecretName()), namespace);
            if (!resolution.isResolved()) {
                status.tlsError(resolution.reason(), resolution.message());
                continue;
            }
            TlsContext tlsContext = new TlsContext(resolution.secret(), annotations.minimumProtocolVersion(), false, null);
            List<String> hosts = tls.getHosts() == null ? List.of() : tls.getHosts();
            for (String host : hosts) {
                String hostname = host.toLowerCase(Locale.ROOT);
                Optional<VirtualHostBuilder> secure = context.secureListener().flatMap(context.dag()::findListener).map(l -> l.virtualHost(hostname));
                if (secure.isPresent() && !secure.get().tls(tlsContext)) {
                    status.tlsError(REASON_TLS_CONFIG_NOT_VALID, "host \"" + hostname + "\" already has a different TLS configuration");
                    continue;
                }
                byHost.putIfAbsent(hostname, tlsContext);
            }
        }
        return byHost;
    }

    /**
     * Exact paths match exactly. Prefix and implementation specific paths match as plain string prefixes,
     * unless an implementation specific path contains regex syntax.
     */
    static PathMatch pathMatch(HTTPIngressPath path) {
        String value = path.getPath() == null || path.getPath().isEmpty() ? "/" : path.getPath();
        if (PATH_TYPE_EXACT.equals(path.getPathType())) {
            return PathMatch.exact(value);
        }
        boolean implementationSpecific = path.getPathType() == null || PATH_TYPE_IMPLEMENTATION_SPECIFIC.equals(path.getPathType());
        if (implementationSpecific && value.chars().anyMatch(c -> REGEX_META_CHARACTERS.indexOf(c) >= 0)) {
            return PathMatch.regex(value);
        }
        return PathMatch.stringPrefix(value);
    }
}
