/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.routegraph.dag.ResourcesUtil;
import io.routegraph.dag.builder.BuildContext;
import io.routegraph.dag.config.BuilderConfiguration;
import io.routegraph.dag.model.Listener.Protocol;
import io.routegraph.dag.model.TlsContext;
import io.routegraph.dag.model.TlsSecret;
import io.routegraph.dag.secret.SecretResolution;
import io.routegraph.dag.status.GatewayConditions;
import io.routegraph.dag.status.GatewayConditions.ListenerConditions;
import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.gateway.Gateway;
import io.routegraph.kubernetes.api.gateway.GatewayTLSConfig;
import io.routegraph.kubernetes.api.gateway.Listener;
import io.routegraph.kubernetes.api.gateway.RouteGroupKind;
import io.routegraph.kubernetes.api.gateway.SecretObjectReference;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Creates the listeners of the graph. Without a managed Gateway these are the configured HTTP and HTTPS
 * listeners; with one, each valid Gateway listener gets a listener named after its protocol and port.
 */
public class ListenerProcessor implements Processor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ListenerProcessor.class);

    public static final String REASON_UNSUPPORTED_PROTOCOL = "UnsupportedProtocol";
    public static final String REASON_DUPLICATE_NAME = "DuplicateName";
    public static final String REASON_PROTOCOL_CONFLICT = "ProtocolConflict";
    public static final String REASON_HOSTNAME_CONFLICT = "HostnameConflict";
    public static final String REASON_INVALID_HOSTNAME = "UnsupportedValue";
    public static final String REASON_INVALID_TLS_CONFIGURATION = "InvalidTLSConfiguration";
    public static final String REASON_REF_NOT_PERMITTED = "RefNotPermitted";
    public static final String REASON_INVALID_CERTIFICATE_REF = "InvalidCertificateRef";
    public static final String REASON_INVALID_ROUTE_KINDS = "InvalidRouteKinds";
    public static final String REASON_LISTENERS_NOT_VALID = "ListenersNotValid";

    public static final String PROTOCOL_HTTP = "HTTP";
    public static final String PROTOCOL_HTTPS = "HTTPS";
    public static final String PROTOCOL_TLS = "TLS";
    public static final String PROTOCOL_TCP = "TCP";

    static final String KIND_HTTP_ROUTE = "HTTPRoute";
    static final String KIND_GRPC_ROUTE = "GRPCRoute";
    static final String KIND_TLS_ROUTE = "TLSRoute";
    static final String KIND_TCP_ROUTE = "TCPRoute";

    /** Ports below this are shifted into the unprivileged range. */
    static final int PRIVILEGED_PORT_LIMIT = 1024;
    static final int PRIVILEGED_PORT_OFFSET = 64512;

    private static final String ANY_ADDRESS = "0.0.0.0";
    private static final String TLS_MODE_TERMINATE = "Terminate";
    private static final String TLS_MODE_PASSTHROUGH = "Passthrough";

    @Override
    public void run(BuildContext context) {
        BuilderConfiguration configuration = context.configuration();
        if (configuration.gateway() == null) {
            BuilderConfiguration.Listener http = configuration.listeners().http();
            BuilderConfiguration.Listener https = configuration.listeners().https();
            context.dag().listener(http.name(), http.address(), http.port(), http.port(), Protocol.HTTP);
            context.dag().listener(https.name(), https.address(), https.port(), https.port(), Protocol.HTTPS);
            context.hostListeners(http.name(), https.name());
            return;
        }
        Optional<Gateway> gateway = context.cache().gateway(configuration.gateway());
        if (gateway.isEmpty()) {
            LOGGER.atDebug()
                    .setMessage("managed Gateway {} not found, no listeners built")
                    .addArgument(configuration.gateway())
                    .log();
            return;
        }
        context.processing(gateway.get());
        GatewayListeners listeners = validate(context, gateway.get());
        context.gatewayListeners(listeners);

        String insecure = null;
        String secure = null;
        for (GatewayListeners.GatewayListener listener : listeners.listeners()) {
            if (!listener.valid()) {
                continue;
            }
            if (context.dag().findListener(listener.dagListener()).isEmpty()) {
                context.dag().listener(listener.dagListener(), ANY_ADDRESS, effectivePort(listener.declaredPort()), listener.declaredPort(), listener.dagProtocol());
            }
            if (insecure == null && listener.protocol().equals(PROTOCOL_HTTP)) {
                insecure = listener.dagListener();
            }
            if (secure == null && listener.protocol().equals(PROTOCOL_HTTPS)) {
                secure = listener.dagListener();
            }
        }
        context.hostListeners(insecure, secure);
    }

    /**
     * @param port the declared port
     * @return the port the proxy binds for it
     */
    static int effectivePort(int port) {
        return port < PRIVILEGED_PORT_LIMIT ? port + PRIVILEGED_PORT_OFFSET : port;
    }

    static String dagListenerName(String protocol, int port) {
        return switch (protocol) {
            case PROTOCOL_HTTP -> "http-" + port;
            case PROTOCOL_TCP -> "tcp-" + port;
            default -> "https-" + port;
        };
    }

    private GatewayListeners validate(BuildContext context, Gateway gateway) {
        GatewayConditions status = context.statusCache().gateway(gateway);
        List<Listener> declared = gateway.getSpec() == null ? List.of() : gateway.getSpec().listeners();

        Map<String, Integer> nameCounts = new HashMap<>();
        declared.forEach(l -> nameCounts.merge(l.name(), 1, Integer::sum));
        Map<Integer, List<Listener>> byPort = new LinkedHashMap<>();
        declared.forEach(l -> byPort.computeIfAbsent(l.port(), p -> new ArrayList<>()).add(l));

        List<GatewayListeners.GatewayListener> result = new ArrayList<>();
        for (Listener listener : declared) {
            ListenerConditions conditions = status.listener(listener.name());
            String protocol = listener.protocol() == null ? "" : listener.protocol().toUpperCase(Locale.ROOT);
            if (!List.of(PROTOCOL_HTTP, PROTOCOL_HTTPS, PROTOCOL_TLS, PROTOCOL_TCP).contains(protocol)) {
                conditions.notAccepted(REASON_UNSUPPORTED_PROTOCOL, "Listener protocol \"" + listener.protocol() + "\" is unsupported, must be one of HTTP, HTTPS, TLS or TCP");
                result.add(invalid(listener, protocol));
                continue;
            }
            if (nameCounts.get(listener.name()) > 1) {
                conditions.conflicted(REASON_DUPLICATE_NAME, "Listener name \"" + listener.name() + "\" is used more than once");
            }
            portConflict(listener, protocol, byPort.get(listener.port()), conditions);
            if (listener.hostname() != null && !validListenerHostname(listener.hostname())) {
                conditions.notAccepted(REASON_INVALID_HOSTNAME, "invalid hostname \"" + listener.hostname() + "\"");
            }
            List<RouteGroupKind> kinds = supportedKinds(listener, protocol, conditions);
            conditions.supportedKinds(kinds);

            TlsContext tls = null;
            boolean passthrough = false;
            if (protocol.equals(PROTOCOL_HTTPS) || protocol.equals(PROTOCOL_TLS)) {
                GatewayTLSConfig tlsConfig = listener.tls();
                String mode = tlsConfig == null || tlsConfig.mode() == null ? TLS_MODE_TERMINATE : tlsConfig.mode();
                String requiredMode = protocol.equals(PROTOCOL_TLS) ? TLS_MODE_PASSTHROUGH : TLS_MODE_TERMINATE;
                if (tlsConfig == null) {
                    conditions.notAccepted(REASON_INVALID_TLS_CONFIGURATION, "Listener.TLS is required when protocol is \"" + protocol + "\"");
                }
                else if (!mode.equals(requiredMode)) {
                    conditions.notAccepted(REASON_INVALID_TLS_CONFIGURATION,
                            "Listener.TLS.Mode must be \"" + requiredMode + "\" when protocol is \"" + protocol + "\", not \"" + mode + "\"");
                }
                else if (protocol.equals(PROTOCOL_TLS)) {
                    passthrough = true;
                }
                else {
                    tls = certificate(context, gateway, tlsConfig, conditions);
                }
            }

            GatewayListeners.GatewayListener validated = new GatewayListeners.GatewayListener(listener.name(), listener.hostname(), listener.port(), protocol,
                    dagListenerName(protocol, effectivePort(listener.port())),
                    protocol.equals(PROTOCOL_HTTP) ? Protocol.HTTP : protocol.equals(PROTOCOL_TCP) ? Protocol.TCP : Protocol.HTTPS,
                    tls, passthrough, listener.allowedRoutes() == null ? null : listener.allowedRoutes().namespaces(),
                    kinds, conditions.isValid());
            if (!validated.valid()) {
                LOGGER.atDebug()
                        .setMessage("listener {} of Gateway {} is not valid")
                        .addArgument(listener.name())
                        .addArgument(ResourcesUtil.namespacedName(gateway))
                        .log();
            }
            result.add(validated);
        }
        if (result.stream().noneMatch(GatewayListeners.GatewayListener::valid)) {
            status.notAccepted(REASON_LISTENERS_NOT_VALID, "Gateway has no valid listeners");
            status.notProgrammed(REASON_LISTENERS_NOT_VALID, "Gateway has no valid listeners");
        }
        return new GatewayListeners(gateway, result);
    }

    private static GatewayListeners.GatewayListener invalid(Listener listener, String protocol) {
        return new GatewayListeners.GatewayListener(listener.name(), listener.hostname(), listener.port(), protocol, "", Protocol.HTTP, null, false, null, List.of(),
                false);
    }

    /**
     * Listeners sharing a port must be of one protocol family, HTTP, TLS terminated or passed through, or TCP,
     * and must differ in hostname.
     */
    private static void portConflict(Listener listener, String protocol, List<Listener> samePort, ListenerConditions conditions) {
        Set<String> families = samePort.stream()
                .map(l -> family(l.protocol() == null ? "" : l.protocol().toUpperCase(Locale.ROOT)))
                .collect(Collectors.toSet());
        if (families.size() > 1) {
            conditions.conflicted(REASON_PROTOCOL_CONFLICT, "All listeners for port " + listener.port() + " must use a compatible protocol");
            return;
        }
        String hostname = listener.hostname() == null ? "" : listener.hostname();
        long sameHostname = samePort.stream().filter(l -> (l.hostname() == null ? "" : l.hostname()).equals(hostname)).count();
        if (protocol.equals(PROTOCOL_TCP) ? samePort.size() > 1 : sameHostname > 1) {
            conditions.conflicted(REASON_HOSTNAME_CONFLICT, "All listeners for port " + listener.port() + " must have a unique hostname");
        }
    }

    private static String family(String protocol) {
        return switch (protocol) {
            case PROTOCOL_HTTPS, PROTOCOL_TLS -> "tls";
            default -> protocol;
        };
    }

    private static boolean validListenerHostname(String hostname) {
        String host = hostname.startsWith("*.") ? hostname.substring(2) : hostname;
        return !ResourcesUtil.isIpAddress(host) && ResourcesUtil.isValidHostname(host);
    }

    /**
     * The route kinds a listener accepts: the declared ones the protocol supports, or the protocol's defaults.
     * Unsupported kinds are reported. The listener stays programmed while at least one declared kind is supported.
     */
    private static List<RouteGroupKind> supportedKinds(Listener listener, String protocol, ListenerConditions conditions) {
        List<String> forProtocol = switch (protocol) {
            case PROTOCOL_HTTP, PROTOCOL_HTTPS -> List.of(KIND_HTTP_ROUTE, KIND_GRPC_ROUTE);
            case PROTOCOL_TLS -> List.of(KIND_TLS_ROUTE);
            default -> List.of(KIND_TCP_ROUTE);
        };
        List<RouteGroupKind> declared = listener.allowedRoutes() == null ? List.of() : listener.allowedRoutes().kinds();
        if (declared.isEmpty()) {
            return forProtocol.stream().map(kind -> new RouteGroupKind(ReferenceGrants.GATEWAY_GROUP, kind)).toList();
        }
        List<RouteGroupKind> supported = new ArrayList<>();
        List<String> unsupported = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RouteGroupKind kind : declared) {
            boolean gatewayGroup = kind.group() == null || kind.group().equals(ReferenceGrants.GATEWAY_GROUP);
            if (gatewayGroup && forProtocol.contains(kind.kind())) {
                if (seen.add(kind.kind())) {
                    supported.add(new RouteGroupKind(ReferenceGrants.GATEWAY_GROUP, kind.kind()));
                }
            }
            else {
                unsupported.add(kind.kind());
            }
        }
        if (!unsupported.isEmpty()) {
            conditions.invalidRouteKinds(REASON_INVALID_ROUTE_KINDS, "Kinds " + unsupported + " are not supported, kind must be one of " + forProtocol,
                    supported.isEmpty());
        }
        return supported;
    }

    @Nullable
    private static TlsContext certificate(BuildContext context, Gateway gateway, GatewayTLSConfig tlsConfig, ListenerConditions conditions) {
        if (tlsConfig.certificateRefs().isEmpty()) {
            conditions.notAccepted(REASON_INVALID_TLS_CONFIGURATION, "Listener.TLS.CertificateRefs must contain exactly one entry");
            return null;
        }
        SecretObjectReference reference = tlsConfig.certificateRefs().get(0);
        boolean coreGroup = reference.group() == null || reference.group().isEmpty();
        if (!coreGroup || reference.kind() != null && !reference.kind().equals("Secret")) {
            conditions.unresolvedRefs(REASON_INVALID_CERTIFICATE_REF, "Spec.VirtualHost.TLS.CertificateRef \"" + reference.name() + "\" must be a core Secret");
            return null;
        }
        String gatewayNamespace = ResourcesUtil.namespace(gateway);
        NamespacedName secretName = new NamespacedName(reference.namespace() == null ? gatewayNamespace : reference.namespace(), reference.name());
        if (!ReferenceGrants.permits(context.cache(), ReferenceGrants.GATEWAY_GROUP, "Gateway", gatewayNamespace,
                ReferenceGrants.CORE_GROUP, "Secret", secretName.namespace(), secretName.name())) {
            conditions.unresolvedRefs(REASON_REF_NOT_PERMITTED, "Certificate ref to secret " + secretName + " not permitted by any ReferenceGrant");
            return null;
        }
        SecretResolution resolution = context.secrets().resolve(secretName, TlsSecret.Kind.KEY_PAIR);
        if (!resolution.isResolved()) {
            conditions.unresolvedRefs(REASON_INVALID_CERTIFICATE_REF, "Secret " + secretName + ": " + resolution.message());
            return null;
        }
        return new TlsContext(resolution.secret(), "1.2", false, null);
    }
}
