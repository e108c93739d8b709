/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.model;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Validation of the certificate presented by the other side of a TLS connection.
 *
 * @param caCertificate the trust anchors, absent when verification is skipped
 * @param subjectName the expected subject alternative name, for upstream validation
 * @param crl certificate revocation list
 * @param skipVerification request but do not verify the client certificate
 */
public record PeerValidation(@Nullable TlsSecret caCertificate,
                             @Nullable String subjectName,
                             @Nullable TlsSecret crl,
                             boolean skipVerification) {}
