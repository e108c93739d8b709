/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.builder;

import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.routegraph.dag.cache.ObjectCacheView;
import io.routegraph.dag.config.BuilderConfiguration;
import io.routegraph.dag.match.RegexValidator;
import io.routegraph.dag.processor.GatewayListeners;
import io.routegraph.dag.secret.SecretResolver;
import io.routegraph.dag.status.StatusCache;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Everything a processor needs during one build. A context is created for, and used by, a single build.
 */
public class BuildContext {

    private final ObjectCacheView cache;
    private final BuilderConfiguration configuration;
    private final DagBuilder dag;
    private final StatusCache statusCache;
    private final RegexValidator regexValidator;
    private final SecretResolver secrets;
    private @Nullable HasMetadata currentObject;
    private @Nullable String insecureListener;
    private @Nullable String secureListener;
    private @Nullable GatewayListeners gatewayListeners;

    public BuildContext(ObjectCacheView cache,
                        BuilderConfiguration configuration,
                        DagBuilder dag,
                        StatusCache statusCache,
                        RegexValidator regexValidator,
                        SecretResolver secrets) {
        this.cache = cache;
        this.configuration = configuration;
        this.dag = dag;
        this.statusCache = statusCache;
        this.regexValidator = regexValidator;
        this.secrets = secrets;
    }

    public ObjectCacheView cache() {
        return cache;
    }

    public BuilderConfiguration configuration() {
        return configuration;
    }

    public DagBuilder dag() {
        return dag;
    }

    public StatusCache statusCache() {
        return statusCache;
    }

    public RegexValidator regexValidator() {
        return regexValidator;
    }

    public SecretResolver secrets() {
        return secrets;
    }

    /**
     * Records the object being processed, so that a builder defect can be attributed to it.
     */
    public void processing(@Nullable HasMetadata object) {
        this.currentObject = object;
    }

    @Nullable
    public HasMetadata currentObject() {
        return currentObject;
    }

    /**
     * The listeners that Ingress and HTTPProxy virtual hosts are attached to.
     * @param insecure the plaintext HTTP listener
     * @param secure the TLS listener
     */
    public void hostListeners(@Nullable String insecure, @Nullable String secure) {
        this.insecureListener = insecure;
        this.secureListener = secure;
    }

    public Optional<String> insecureListener() {
        return Optional.ofNullable(insecureListener);
    }

    public Optional<String> secureListener() {
        return Optional.ofNullable(secureListener);
    }

    public void gatewayListeners(@Nullable GatewayListeners gatewayListeners) {
        this.gatewayListeners = gatewayListeners;
    }

    public Optional<GatewayListeners> gatewayListeners() {
        return Optional.ofNullable(gatewayListeners);
    }
}
