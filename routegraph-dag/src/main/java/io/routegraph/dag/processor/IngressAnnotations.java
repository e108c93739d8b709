/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.processor;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.routegraph.dag.ResourcesUtil;
import io.routegraph.dag.model.RetryPolicy;
import io.routegraph.dag.model.TimeoutPolicy;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Reads the annotations that tune how an Ingress is translated.
 * Malformed values are logged and fall back to the behaviour without the annotation.
 */
final class IngressAnnotations {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngressAnnotations.class);

    static final String INGRESS_CLASS = "kubernetes.io/ingress.class";
    static final String FORCE_SSL_REDIRECT = "ingress.kubernetes.io/force-ssl-redirect";
    static final String ALLOW_HTTP = "kubernetes.io/ingress.allow-http";
    static final String NUM_RETRIES = "routegraph.io/num-retries";
    static final String PER_TRY_TIMEOUT = "routegraph.io/per-try-timeout";
    static final String RETRY_ON = "routegraph.io/retry-on";
    static final String RESPONSE_TIMEOUT = "routegraph.io/response-timeout";
    static final String WEBSOCKET_ROUTES = "routegraph.io/websocket-routes";
    static final String TLS_MINIMUM_PROTOCOL_VERSION = "routegraph.io/tls-minimum-protocol-version";

    private final HasMetadata ingress;
    private final Map<String, String> annotations;

    IngressAnnotations(HasMetadata ingress) {
        this.ingress = ingress;
        Map<String, String> declared = ingress.getMetadata().getAnnotations();
        this.annotations = declared == null ? Map.of() : declared;
    }

    @Nullable
    String ingressClass() {
        return annotations.get(INGRESS_CLASS);
    }

    boolean forceSslRedirect() {
        return Boolean.parseBoolean(annotations.get(FORCE_SSL_REDIRECT));
    }

    boolean allowHttp() {
        return !"false".equals(annotations.get(ALLOW_HTTP));
    }

    Set<String> websocketPaths() {
        String value = annotations.get(WEBSOCKET_ROUTES);
        if (value == null) {
            return Set.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
    }

    String minimumProtocolVersion() {
        String value = annotations.get(TLS_MINIMUM_PROTOCOL_VERSION);
        if (value == null) {
            return "1.2";
        }
        if (!List.of("1.2", "1.3").contains(value)) {
            warn(TLS_MINIMUM_PROTOCOL_VERSION, value);
            return "1.2";
        }
        return value;
    }

    TimeoutPolicy timeoutPolicy() {
        String value = annotations.get(RESPONSE_TIMEOUT);
        try {
            return new TimeoutPolicy(Durations.parse(value), null);
        }
        catch (IllegalArgumentException e) {
            warn(RESPONSE_TIMEOUT, value);
            return TimeoutPolicy.DEFAULT;
        }
    }

    /**
     * @return a retry policy if {@value #RETRY_ON} is set, otherwise null
     */
    @Nullable
    RetryPolicy retryPolicy() {
        String retryOn = annotations.get(RETRY_ON);
        if (retryOn == null || retryOn.isBlank()) {
            return null;
        }
        int retries = 1;
        String count = annotations.get(NUM_RETRIES);
        if (count != null) {
            try {
                retries = Math.max(Integer.parseInt(count.trim()), 0);
            }
            catch (NumberFormatException e) {
                warn(NUM_RETRIES, count);
            }
        }
        Duration perTryTimeout = null;
        String timeout = annotations.get(PER_TRY_TIMEOUT);
        try {
            perTryTimeout = Durations.parse(timeout);
        }
        catch (IllegalArgumentException e) {
            warn(PER_TRY_TIMEOUT, timeout);
        }
        List<String> conditions = Arrays.stream(retryOn.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        return new RetryPolicy(conditions, retries, perTryTimeout, List.of());
    }

    private void warn(String annotation, @Nullable String value) {
        LOGGER.atWarn()
                .setMessage("ignoring invalid value \"{}\" of annotation {} on Ingress {}")
                .addArgument(value)
                .addArgument(annotation)
                .addArgument(ResourcesUtil.namespacedName(ingress))
                .log();
    }
}
