/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.secret;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.Secret;

import io.routegraph.dag.cache.ObjectCacheView;
import io.routegraph.dag.model.TlsSecret;
import io.routegraph.kubernetes.api.common.NamespacedName;
import io.routegraph.kubernetes.api.v1.CertificateDelegation;
import io.routegraph.kubernetes.api.v1.TLSCertificateDelegation;

/**
 * Looks up and validates secrets at the point they are referenced.
 * <p>Secrets nobody references are never looked at. Each secret is validated at most once per use per build.</p>
 */
public class SecretResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(SecretResolver.class);

    private static final String WILDCARD_NAMESPACE = "*";

    private final ObjectCacheView cache;
    private final SecretValidator validator;
    private final Map<NamespacedName, Map<TlsSecret.Kind, SecretValidation>> validated = new HashMap<>();

    public SecretResolver(ObjectCacheView cache, SecretValidator validator) {
        this.cache = cache;
        this.validator = validator;
    }

    /**
     * Resolves a serving certificate, enforcing certificate delegation for references into another namespace.
     * @param reference the secret
     * @param referencingNamespace the namespace of the referencing object
     * @return the resolution
     */
    public SecretResolution delegatedKeyPair(NamespacedName reference, String referencingNamespace) {
        return delegated(reference, referencingNamespace, TlsSecret.Kind.KEY_PAIR);
    }

    public SecretResolution delegatedCertificateAuthority(NamespacedName reference, String referencingNamespace) {
        return delegated(reference, referencingNamespace, TlsSecret.Kind.CERTIFICATE_AUTHORITY);
    }

    public SecretResolution delegatedRevocationList(NamespacedName reference, String referencingNamespace) {
        return delegated(reference, referencingNamespace, TlsSecret.Kind.REVOCATION_LIST);
    }

    /**
     * Resolves a secret without any permission check. Callers that need one apply it themselves.
     * @param reference the secret
     * @param kind what the secret is used as
     * @return the resolution
     */
    public SecretResolution resolve(NamespacedName reference, TlsSecret.Kind kind) {
        Optional<Secret> secret = cache.secret(reference);
        if (secret.isEmpty()) {
            return new SecretResolution(SecretResolution.Outcome.NOT_FOUND, null, "Secret not found: " + reference);
        }
        SecretValidation validation = validated.computeIfAbsent(reference, r -> new HashMap<>())
                .computeIfAbsent(kind, k -> validatorFor(k).apply(validator, secret.get()));
        if (!validation.isValid()) {
            LOGGER.atDebug()
                    .setMessage("Secret {} rejected: {}")
                    .addArgument(reference)
                    .addArgument(validation.message())
                    .log();
            return new SecretResolution(SecretResolution.Outcome.NOT_VALID, null, "Secret " + reference + " is invalid: " + validation.message());
        }
        return new SecretResolution(SecretResolution.Outcome.RESOLVED, validation.secret(), "");
    }

    /**
     * @param secret the secret
     * @param targetNamespace the namespace that wants to use it
     * @return true if the secret is in that namespace or a TLSCertificateDelegation in its namespace permits the use
     */
    public boolean isDelegated(NamespacedName secret, String targetNamespace) {
        if (secret.namespace().equals(targetNamespace)) {
            return true;
        }
        for (TLSCertificateDelegation delegation : cache.certificateDelegations(secret.namespace())) {
            if (delegation.getSpec() == null) {
                continue;
            }
            for (CertificateDelegation entry : delegation.getSpec().delegations()) {
                if (secret.name().equals(entry.secretName()) && permits(entry.targetNamespaces(), targetNamespace)) {
                    return true;
                }
            }
        }
        return false;
    }

    private SecretResolution delegated(NamespacedName reference, String referencingNamespace, TlsSecret.Kind kind) {
        if (!isDelegated(reference, referencingNamespace)) {
            return new SecretResolution(SecretResolution.Outcome.NOT_DELEGATED, null,
                    "Certificate delegation not permitted for Secret " + reference + " to namespace " + referencingNamespace);
        }
        return resolve(reference, kind);
    }

    private static boolean permits(List<String> targetNamespaces, String namespace) {
        return targetNamespaces.contains(WILDCARD_NAMESPACE) || targetNamespaces.contains(namespace);
    }

    private static BiFunction<SecretValidator, Secret, SecretValidation> validatorFor(TlsSecret.Kind kind) {
        return switch (kind) {
            case KEY_PAIR -> SecretValidator::validateKeyPair;
            case CERTIFICATE_AUTHORITY -> SecretValidator::validateCertificateAuthority;
            case REVOCATION_LIST -> SecretValidator::validateRevocationList;
        };
    }
}
