/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.secret;

import io.routegraph.dag.model.TlsSecret;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The outcome of resolving a secret reference.
 *
 * @param outcome what happened
 * @param secret the validated secret, present only when resolved
 * @param message human readable detail when not resolved
 */
public record SecretResolution(Outcome outcome, @Nullable TlsSecret secret, String message) {

    public enum Outcome {
        RESOLVED("Resolved"),
        NOT_FOUND("SecretNotFound"),
        NOT_VALID("SecretNotValid"),
        NOT_DELEGATED("DelegationNotPermitted");

        private final String reason;

        Outcome(String reason) {
            this.reason = reason;
        }

        /**
         * @return the condition reason reported for this outcome
         */
        public String reason() {
            return reason;
        }
    }

    public boolean isResolved() {
        return outcome == Outcome.RESOLVED;
    }

    public String reason() {
        return outcome.reason();
    }
}
