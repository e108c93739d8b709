/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.dag.match;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegexValidatorTest {

    private final RegexValidator validator = new RegexValidator(100, 50);

    @ParameterizedTest
    @CsvSource(delimiter = ' ', value = {
            "abc 5",
            "a|b 5",
            "(a) 5",
            "(?:a) 3",
            "(?i)a 3",
            "a* 4",
            "a+? 4",
            "[a-z]+ 4",
            "\\d 3",
            "a{3} 5",
            "a{2,5} 10",
            "a{2,} 5",
            "(ab)* 7"
    })
    void shouldEstimateProgramSize(String regex, long expected) {
        assertThat(validator.programSize(regex)).isEqualTo(expected);
    }

    @Test
    void literalBraceIsNotARepetition() {
        assertThat(validator.programSize("a{x}")).isEqualTo(6);
    }

    @Test
    void shouldAcceptSmallRegex() {
        assertThatCode(() -> validator.validate("/api/v[0-9]+/.*")).doesNotThrowAnyException();
        assertThat(validator.isValid("/api/v[0-9]+/.*")).isTrue();
    }

    @Test
    void shouldRejectSyntaxError() {
        assertThatThrownBy(() -> validator.validate("/api/(v1"))
                .isInstanceOf(InvalidRegexException.class)
                .hasMessageStartingWith("invalid regex \"/api/(v1\"");
    }

    @Test
    void shouldRejectBackreference() {
        assertThat(validator.isValid("(a)\\1")).isFalse();
    }

    @Test
    void shouldRejectProgramAboveMaximum() {
        assertThatThrownBy(() -> validator.validate("a{101}"))
                .isInstanceOf(InvalidRegexException.class)
                .hasMessage("regex \"a{101}\" has a program size of 103 which exceeds the maximum of 100");
    }

    @Test
    void nestedRepetitionMultiplies() {
        assertThat(validator.isValid("(a{20}){20}")).isFalse();
    }

    @Test
    void shouldRequirePositiveMaximum() {
        assertThatThrownBy(() -> new RegexValidator(0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
