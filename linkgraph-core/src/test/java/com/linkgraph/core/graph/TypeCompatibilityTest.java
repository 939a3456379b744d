package com.linkgraph.core.graph;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TypeCompatibility}.
 */
class TypeCompatibilityTest {

    @ParameterizedTest
    @CsvSource({
        "string, string",
        "number, string",
        "string, object",
        "array, object",
        "object, array",
        "boolean, number",
        "boolean, string",
        "any, number",
        "link, any",
        "Number, STRING"
    })
    void isCompatible_allowedPairs_returnsTrue(String out, String in) {
        assertThat(TypeCompatibility.isCompatible(out, in)).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
        "string, number",
        "object, string",
        "number, boolean",
        "link, transition",
        "array, string"
    })
    void isCompatible_unlistedPairs_returnsFalse(String out, String in) {
        assertThat(TypeCompatibility.isCompatible(out, in)).isFalse();
    }

    @Test
    void isCompatible_isNotSymmetric() {
        assertThat(TypeCompatibility.isCompatible("number", "string")).isTrue();
        assertThat(TypeCompatibility.isCompatible("string", "number")).isFalse();
    }

    @Test
    void conversions_isImmutable() {
        assertThatThrownBy(() -> TypeCompatibility.conversions().put("x", Set.of("y")))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
