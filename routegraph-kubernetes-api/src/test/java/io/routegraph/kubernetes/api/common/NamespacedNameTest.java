/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.routegraph.kubernetes.api.common;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamespacedNameTest {

    @Test
    void shouldParseBareNameRelativeToDefaultNamespace() {
        assertThat(NamespacedName.parse("default", "tls-cert"))
                .isEqualTo(new NamespacedName("default", "tls-cert"));
    }

    @Test
    void shouldParseQualifiedName() {
        assertThat(NamespacedName.parse("default", "certs/tls-cert"))
                .isEqualTo(new NamespacedName("certs", "tls-cert"));
    }

    @Test
    void shouldRenderAsNamespaceSlashName() {
        assertThat(new NamespacedName("certs", "tls-cert")).hasToString("certs/tls-cert");
    }

    @Test
    void shouldRejectNullParts() {
        assertThatThrownBy(() -> new NamespacedName(null, "a")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new NamespacedName("a", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void shouldDetectBlankParts() {
        assertThat(new NamespacedName("", "a").isBlank()).isTrue();
        assertThat(new NamespacedName("a", "b").isBlank()).isFalse();
    }

    @Test
    void comparatorOrdersByNamespaceThenName() {
        List<NamespacedName> names = new ArrayList<>(List.of(
                new NamespacedName("b", "a"),
                new NamespacedName("a", "z"),
                new NamespacedName("a", "b")));
        names.sort(NamespacedName.COMPARATOR);
        assertThat(names).containsExactly(
                new NamespacedName("a", "b"),
                new NamespacedName("a", "z"),
                new NamespacedName("b", "a"));
    }
}
