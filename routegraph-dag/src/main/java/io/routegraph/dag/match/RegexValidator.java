/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.re2j.Pattern;
import com.google.re2j.PatternSyntaxException;

/**
 * Validates the regular expressions used in path, header and query matches.
 * A regex that does not compile, or whose estimated program size exceeds the configured maximum, is rejected.
 * One that exceeds the warning threshold is accepted and logged.
 */
public class RegexValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegexValidator.class);

    private final int maxProgramSize;
    private final int warnProgramSize;

    public RegexValidator(int maxProgramSize, int warnProgramSize) {
        if (maxProgramSize <= 0) {
            throw new IllegalArgumentException("maxProgramSize must be positive");
        }
        this.maxProgramSize = maxProgramSize;
        this.warnProgramSize = warnProgramSize;
    }

    public void validate(String regex) throws InvalidRegexException {
        try {
            Pattern.compile(regex);
        }
        catch (PatternSyntaxException e) {
            throw new InvalidRegexException("invalid regex \"" + regex + "\": " + e.getMessage(), e);
        }
        long size = programSize(regex);
        if (size > maxProgramSize) {
            throw new InvalidRegexException("regex \"" + regex + "\" has a program size of " + size + " which exceeds the maximum of " + maxProgramSize);
        }
        if (warnProgramSize > 0 && size > warnProgramSize) {
            LOGGER.atWarn()
                    .setMessage("regex \"{}\" has a program size of {}, exceeding the warning threshold of {}")
                    .addArgument(regex)
                    .addArgument(size)
                    .addArgument(warnProgramSize)
                    .log();
        }
    }

    public boolean isValid(String regex) {
        try {
            validate(regex);
            return true;
        }
        catch (InvalidRegexException e) {
            return false;
        }
    }

    public long programSize(String regex) {
        return RegexProgramSize.estimate(regex);
    }
}
