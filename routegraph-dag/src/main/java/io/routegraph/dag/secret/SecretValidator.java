/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.secret;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import io.fabric8.kubernetes.api.model.Secret;

import io.routegraph.dag.model.TlsSecret;
import io.routegraph.kubernetes.api.common.NamespacedName;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Checks that a secret has the shape required for the use it is referenced for.
 * Validation only inspects structure; it does not check expiry or chain trust.
 */
public class SecretValidator {

    public static final String TLS_SECRET_TYPE = "kubernetes.io/tls";
    public static final String OPAQUE_SECRET_TYPE = "Opaque";
    public static final String TLS_CERT_KEY = "tls.crt";
    public static final String TLS_PRIVATE_KEY_KEY = "tls.key";
    public static final String CA_CERT_KEY = "ca.crt";
    public static final String CRL_KEY = "crl.pem";

    private static final String CERTIFICATE = "CERTIFICATE";
    private static final Set<String> PRIVATE_KEY_TYPES = Set.of("PRIVATE KEY", "RSA PRIVATE KEY", "EC PRIVATE KEY");

    /**
     * A serving certificate: {@code tls.crt} holding one or more certificates, the first naming a host,
     * and {@code tls.key} holding exactly one private key.
     * @param secret the secret
     * @return the validation result
     */
    public SecretValidation validateKeyPair(Secret secret) {
        String type = secret.getType();
        if (type != null && !TLS_SECRET_TYPE.equals(type) && !OPAQUE_SECRET_TYPE.equals(type)) {
            return SecretValidation.invalid("secret type is not " + TLS_SECRET_TYPE + " or " + OPAQUE_SECRET_TYPE);
        }
        Optional<String> cert = value(secret, TLS_CERT_KEY);
        if (cert.isEmpty()) {
            return SecretValidation.invalid("missing TLS certificate");
        }
        Optional<String> key = value(secret, TLS_PRIVATE_KEY_KEY);
        if (key.isEmpty()) {
            return SecretValidation.invalid("missing TLS private key");
        }
        String problem = servingCertificateProblem(cert.get());
        if (problem == null) {
            problem = privateKeyProblem(key.get());
        }
        if (problem != null) {
            return SecretValidation.invalid(problem);
        }
        return SecretValidation.valid(nameOf(secret), TlsSecret.Kind.KEY_PAIR, Map.of(TLS_CERT_KEY, cert.get(), TLS_PRIVATE_KEY_KEY, key.get()));
    }

    /**
     * A bundle of trust anchors in {@code ca.crt}.
     * @param secret the secret
     * @return the validation result
     */
    public SecretValidation validateCertificateAuthority(Secret secret) {
        Optional<String> ca = value(secret, CA_CERT_KEY);
        if (ca.isEmpty()) {
            return SecretValidation.invalid("empty \"" + CA_CERT_KEY + "\" key");
        }
        String problem = certificateBundleProblem(ca.get());
        if (problem != null) {
            return SecretValidation.invalid(problem);
        }
        return SecretValidation.valid(nameOf(secret), TlsSecret.Kind.CERTIFICATE_AUTHORITY, Map.of(CA_CERT_KEY, ca.get()));
    }

    /**
     * A certificate revocation list in {@code crl.pem}.
     * @param secret the secret
     * @return the validation result
     */
    public SecretValidation validateRevocationList(Secret secret) {
        Optional<String> crl = value(secret, CRL_KEY);
        if (crl.isEmpty()) {
            return SecretValidation.invalid("empty \"" + CRL_KEY + "\" key");
        }
        try {
            if (PemBlock.parse(crl.get()).stream().noneMatch(b -> b.type().equals("X509 CRL"))) {
                return SecretValidation.invalid("failed to locate CRL");
            }
        }
        catch (IllegalArgumentException e) {
            return SecretValidation.invalid("invalid CRL: " + e.getMessage());
        }
        return SecretValidation.valid(nameOf(secret), TlsSecret.Kind.REVOCATION_LIST, Map.of(CRL_KEY, crl.get()));
    }

    @Nullable
    private static String servingCertificateProblem(String pem) {
        List<X509Certificate> certificates;
        try {
            certificates = certificates(pem);
        }
        catch (IllegalArgumentException | CertificateException e) {
            return "invalid certificate: " + e.getMessage();
        }
        if (certificates.isEmpty()) {
            return "failed to locate certificate";
        }
        X509Certificate leaf = certificates.get(0);
        if (!hasCommonName(leaf) && !hasSubjectAlternativeName(leaf)) {
            return "invalid certificate: certificate has no common name or subject alt name";
        }
        return null;
    }

    @Nullable
    private static String certificateBundleProblem(String pem) {
        try {
            if (certificates(pem).isEmpty()) {
                return "failed to locate certificate";
            }
        }
        catch (IllegalArgumentException | CertificateException e) {
            return "invalid CA certificate bundle: " + e.getMessage();
        }
        return null;
    }

    @Nullable
    private static String privateKeyProblem(String pem) {
        long keys;
        try {
            // EC PARAMETERS blocks may accompany an EC key and are ignored
            keys = PemBlock.parse(pem).stream().filter(b -> PRIVATE_KEY_TYPES.contains(b.type())).count();
        }
        catch (IllegalArgumentException e) {
            return "invalid private key: " + e.getMessage();
        }
        if (keys == 0) {
            return "failed to locate private key";
        }
        if (keys > 1) {
            return "multiple private keys";
        }
        return null;
    }

    private static List<X509Certificate> certificates(String pem) throws CertificateException {
        CertificateFactory factory = CertificateFactory.getInstance("X.509");
        List<PemBlock> blocks = PemBlock.parse(pem).stream().filter(b -> b.type().equals(CERTIFICATE)).toList();
        List<X509Certificate> result = new ArrayList<>();
        for (PemBlock block : blocks) {
            result.add((X509Certificate) factory.generateCertificate(new ByteArrayInputStream(block.content())));
        }
        return result;
    }

    private static boolean hasCommonName(X509Certificate certificate) {
        return certificate.getSubjectX500Principal().getName().matches("(?s)(^|.*,)CN=[^,]+.*");
    }

    private static boolean hasSubjectAlternativeName(X509Certificate certificate) {
        try {
            Collection<List<?>> names = certificate.getSubjectAlternativeNames();
            return names != null && !names.isEmpty();
        }
        catch (CertificateParsingException e) {
            return false;
        }
    }

    private static NamespacedName nameOf(Secret secret) {
        return new NamespacedName(secret.getMetadata().getNamespace(), secret.getMetadata().getName());
    }

    /**
     * Reads a key from {@code stringData} or base64 {@code data}, treating blank values as absent.
     */
    private static Optional<String> value(Secret secret, String key) {
        Map<String, String> stringData = secret.getStringData();
        if (stringData != null && stringData.get(key) != null && !stringData.get(key).isBlank()) {
            return Optional.of(stringData.get(key));
        }
        Map<String, String> data = secret.getData();
        if (data == null || data.get(key) == null) {
            return Optional.empty();
        }
        try {
            String decoded = new String(Base64.getMimeDecoder().decode(data.get(key)), StandardCharsets.UTF_8);
            return decoded.isBlank() ? Optional.empty() : Optional.of(decoded);
        }
        catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
