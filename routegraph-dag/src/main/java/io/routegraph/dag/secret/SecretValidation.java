/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.secret;

import java.util.Map;
import java.util.Optional;

import io.routegraph.dag.model.TlsSecret;
import io.routegraph.kubernetes.api.common.NamespacedName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The result of validating a secret for one use.
 *
 * @param secret the validated secret, present only when valid
 * @param message why the secret was rejected, present only when invalid
 */
public record SecretValidation(@Nullable TlsSecret secret, @Nullable String message) {

    static SecretValidation valid(NamespacedName name, TlsSecret.Kind kind, Map<String, String> data) {
        return new SecretValidation(TlsSecret.of(name, kind, data), null);
    }

    static SecretValidation invalid(String message) {
        return new SecretValidation(null, message);
    }

    public boolean isValid() {
        return secret != null;
    }

    public Optional<TlsSecret> validSecret() {
        return Optional.ofNullable(secret);
    }
}
