package com.overseer.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AttrValue}.
 */
class AttrValueTest {

    @Test
    @DisplayName("Should classify scalar values")
    void shouldClassifyScalars() {
        assertThat(AttrValue.of((Object) null).getKind()).isEqualTo(AttrValue.Kind.NULL);
        assertThat(AttrValue.of((Object) true).getKind()).isEqualTo(AttrValue.Kind.BOOLEAN);
        assertThat(AttrValue.of((Object) 7).getKind()).isEqualTo(AttrValue.Kind.INTEGER);
        assertThat(AttrValue.of((Object) 7).asLong()).isEqualTo(7L);
        assertThat(AttrValue.of((Object) 1.5).getKind()).isEqualTo(AttrValue.Kind.DECIMAL);
        assertThat(AttrValue.of((Object) "x").asString()).isEqualTo("x");
    }

    @Test
    @DisplayName("Should convert nested lists and maps")
    void shouldConvertNestedStructures() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("hosts", List.of("a", "b"));
        raw.put("limits", Map.of("cpu", 2));
        raw.put("missing", null);

        AttrValue value = AttrValue.of(raw);

        assertThat(value.getKind()).isEqualTo(AttrValue.Kind.OBJECT);
        assertThat(value.asMap().get("hosts").asList()).containsExactly(AttrValue.of("a"), AttrValue.of("b"));
        assertThat(value.asMap().get("limits").asMap().get("cpu").asLong()).isEqualTo(2L);
        assertThat(value.asMap().get("missing").isNull()).isTrue();
    }

    @Test
    @DisplayName("Should render temporals and oversized integers as strings")
    void shouldStringifyOtherValues() {
        Instant instant = Instant.parse("2024-01-01T00:00:00Z");
        BigInteger huge = BigInteger.ONE.shiftLeft(70);

        assertThat(AttrValue.of(instant).asString()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(AttrValue.of(huge).getKind()).isEqualTo(AttrValue.Kind.STRING);
        assertThat(AttrValue.of(huge).asString()).isEqualTo(huge.toString());
    }

    @Test
    @DisplayName("Should convert back to plain Java values")
    void shouldConvertToPlain() {
        AttrValue value = AttrValue.of(Map.of("list", Arrays.asList(1, "two", null)));

        assertThat(value.toPlain()).isEqualTo(Map.of("list", Arrays.asList(1L, "two", null)));
    }
}
