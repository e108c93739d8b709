/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.secret;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.Secret;

import io.routegraph.dag.model.TlsSecret;
import io.routegraph.kubernetes.api.common.NamespacedName;

import static io.routegraph.dag.PkiFixtures.CA_CRT;
import static io.routegraph.dag.PkiFixtures.CRL;
import static io.routegraph.dag.PkiFixtures.NO_NAME_CRT;
import static io.routegraph.dag.PkiFixtures.TLS_CRT;
import static io.routegraph.dag.PkiFixtures.TLS_KEY;
import static io.routegraph.dag.PkiFixtures.secret;
import static org.assertj.core.api.Assertions.assertThat;

class SecretValidatorTest {

    private final SecretValidator validator = new SecretValidator();

    @Test
    void shouldAcceptKeyPair() {
        SecretValidation validation = validator.validateKeyPair(secret(SecretValidator.TLS_SECRET_TYPE, Map.of("tls.crt", TLS_CRT, "tls.key", TLS_KEY)));

        assertThat(validation.isValid()).isTrue();
        assertThat(validation.secret()).isNotNull();
        assertThat(validation.secret().name()).isEqualTo(new NamespacedName("default", "certs"));
        assertThat(validation.secret().kind()).isEqualTo(TlsSecret.Kind.KEY_PAIR);
        assertThat(validation.secret().data()).containsOnlyKeys("tls.crt", "tls.key");
    }

    @Test
    void shouldAcceptOpaqueKeyPair() {
        assertThat(validator.validateKeyPair(secret("Opaque", Map.of("tls.crt", TLS_CRT, "tls.key", TLS_KEY))).isValid()).isTrue();
    }

    @Test
    void shouldRejectOtherSecretTypes() {
        SecretValidation validation = validator.validateKeyPair(secret("kubernetes.io/dockerconfigjson", Map.of("tls.crt", TLS_CRT, "tls.key", TLS_KEY)));

        assertThat(validation.message()).isEqualTo("secret type is not kubernetes.io/tls or Opaque");
    }

    @Test
    void shouldRequireCertificate() {
        assertThat(validator.validateKeyPair(secret(SecretValidator.TLS_SECRET_TYPE, Map.of("tls.key", TLS_KEY))).message())
                .isEqualTo("missing TLS certificate");
    }

    @Test
    void shouldRequirePrivateKey() {
        assertThat(validator.validateKeyPair(secret(SecretValidator.TLS_SECRET_TYPE, Map.of("tls.crt", TLS_CRT))).message())
                .isEqualTo("missing TLS private key");
    }

    @Test
    void shouldTreatBlankValueAsMissing() {
        assertThat(validator.validateKeyPair(secret(SecretValidator.TLS_SECRET_TYPE, Map.of("tls.crt", " ", "tls.key", TLS_KEY))).message())
                .isEqualTo("missing TLS certificate");
    }

    @Test
    void shouldRequireCertificateBlock() {
        assertThat(validator.validateKeyPair(secret(SecretValidator.TLS_SECRET_TYPE, Map.of("tls.crt", TLS_KEY, "tls.key", TLS_KEY))).message())
                .isEqualTo("failed to locate certificate");
    }

    @Test
    void shouldRequireNamedCertificate() {
        assertThat(validator.validateKeyPair(secret(SecretValidator.TLS_SECRET_TYPE, Map.of("tls.crt", NO_NAME_CRT, "tls.key", TLS_KEY))).message())
                .isEqualTo("invalid certificate: certificate has no common name or subject alt name");
    }

    @Test
    void shouldRequireKeyBlock() {
        assertThat(validator.validateKeyPair(secret(SecretValidator.TLS_SECRET_TYPE, Map.of("tls.crt", TLS_CRT, "tls.key", TLS_CRT))).message())
                .isEqualTo("failed to locate private key");
    }

    @Test
    void shouldRejectMultipleKeys() {
        assertThat(validator.validateKeyPair(secret(SecretValidator.TLS_SECRET_TYPE, Map.of("tls.crt", TLS_CRT, "tls.key", TLS_KEY + TLS_KEY))).message())
                .isEqualTo("multiple private keys");
    }

    @Test
    void shouldAcceptCertificateAuthority() {
        SecretValidation validation = validator.validateCertificateAuthority(secret("Opaque", Map.of("ca.crt", CA_CRT)));

        assertThat(validation.validSecret()).get().extracting(TlsSecret::kind).isEqualTo(TlsSecret.Kind.CERTIFICATE_AUTHORITY);
    }

    @Test
    void shouldAcceptCertificateAuthorityBundle() {
        assertThat(validator.validateCertificateAuthority(secret("Opaque", Map.of("ca.crt", CA_CRT + TLS_CRT))).isValid()).isTrue();
    }

    @Test
    void shouldRequireCaKey() {
        assertThat(validator.validateCertificateAuthority(secret("Opaque", Map.of("tls.crt", TLS_CRT))).message())
                .isEqualTo("empty \"ca.crt\" key");
    }

    @Test
    void shouldAcceptRevocationList() {
        SecretValidation validation = validator.validateRevocationList(secret("Opaque", Map.of("crl.pem", CRL)));

        assertThat(validation.validSecret()).get().extracting(TlsSecret::kind).isEqualTo(TlsSecret.Kind.REVOCATION_LIST);
    }

    @Test
    void shouldRequireCrlBlock() {
        assertThat(validator.validateRevocationList(secret("Opaque", Map.of("crl.pem", CA_CRT))).message())
                .isEqualTo("failed to locate CRL");
    }
}
