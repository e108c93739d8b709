/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

/**
 * Thrown when a regular expression does not compile, or compiles to a program larger than permitted.
 */
public class InvalidRegexException extends Exception {

    public InvalidRegexException(String message) {
        super(message);
    }

    public InvalidRegexException(String message, Throwable cause) {
        super(message, cause);
    }
}
