/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.secret;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One {@code -----BEGIN type-----} ... {@code -----END type-----} block of a PEM bundle.
 *
 * @param type the block type, for example {@code CERTIFICATE}
 * @param content the decoded DER content
 */
record PemBlock(String type, byte[] content) {

    private static final Pattern BLOCK = Pattern.compile("-----BEGIN ([A-Z0-9 ]+)-----(.*?)-----END \\1-----", Pattern.DOTALL);

    /**
     * Parses every well formed block in the input. Text outside blocks is ignored.
     * @param pem the PEM text
     * @return the blocks, in order
     * @throws IllegalArgumentException if a block body is not valid base64
     */
    static List<PemBlock> parse(String pem) {
        List<PemBlock> blocks = new ArrayList<>();
        Matcher matcher = BLOCK.matcher(pem);
        while (matcher.find()) {
            blocks.add(new PemBlock(matcher.group(1), Base64.getMimeDecoder().decode(matcher.group(2).trim())));
        }
        return blocks;
    }
}
