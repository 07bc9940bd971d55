package com.aqlcomposer.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for AqlLiteralSerializer
 */
@DisplayName("AqlLiteralSerializer Tests")
class AqlLiteralSerializerTest {

    private AqlLiteralSerializer serializer;

    @BeforeEach
    void setUp() {
        serializer = new AqlLiteralSerializer();
    }

    @Test
    @DisplayName("Should serialize scalars in canonical form")
    void shouldSerializeScalars() {
        assertThat(serializer.serialize(null)).isEqualTo("null");
        assertThat(serializer.serialize(true)).isEqualTo("true");
        assertThat(serializer.serialize(42)).isEqualTo("42");
        assertThat(serializer.serialize(-7L)).isEqualTo("-7");
        assertThat(serializer.serialize(new BigInteger("123456789012345678901234567890")))
                .isEqualTo("123456789012345678901234567890");
        assertThat(serializer.serialize(10.5)).isEqualTo("10.5");
        assertThat(serializer.serialize(1.5f)).isEqualTo("1.5");
        assertThat(serializer.serialize(new BigDecimal("1E+3"))).isEqualTo("1000");
    }

    @Test
    @DisplayName("Should quote and escape text")
    void shouldEscapeText() {
        assertThat(serializer.serialize("felix")).isEqualTo("\"felix\"");
        assertThat(serializer.serialize("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(serializer.serialize("back\\slash")).isEqualTo("\"back\\\\slash\"");
        assertThat(serializer.serialize("line\nbreak")).isEqualTo("\"line\\nbreak\"");
        assertThat(serializer.serialize('c')).isEqualTo("\"c\"");
        assertThat(serializer.serialize(new StringBuilder("sb"))).isEqualTo("\"sb\"");
        assertThat(serializer.serialize("😀")).isEqualTo("\"😀\"");
    }

    @Test
    @DisplayName("Should quote enums, UUIDs and dates")
    void shouldQuoteIdentifiersAndDates() {
        UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");

        assertThat(serializer.serialize(SortDirection.DESC)).isEqualTo("\"DESC\"");
        assertThat(serializer.serialize(id)).isEqualTo("\"123e4567-e89b-12d3-a456-426614174000\"");
        assertThat(serializer.serialize(LocalDate.of(2021, 3, 4))).isEqualTo("\"2021-03-04\"");
        assertThat(serializer.serialize(Instant.parse("2021-03-04T05:06:07Z"))).isEqualTo("\"2021-03-04T05:06:07Z\"");
        assertThat(serializer.serialize(new Date(0))).startsWith("\"1970-01-01T00:00:00").endsWith("\"");
    }

    @Test
    @DisplayName("Should serialize lists, arrays and maps")
    void shouldSerializeStructures() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "felix");
        map.put("tags", Arrays.asList("a", "b"));

        assertThat(serializer.serialize(Arrays.asList(1, "a", true))).isEqualTo("[1, \"a\", true]");
        assertThat(serializer.serialize(Collections.emptyList())).isEqualTo("[]");
        assertThat(serializer.serialize(new Object[]{1, "x"})).isEqualTo("[1, \"x\"]");
        assertThat(serializer.serialize(map)).isEqualTo("{\"name\": \"felix\", \"tags\": [\"a\", \"b\"]}");
        assertThat(serializer.serialize(Collections.emptyMap())).isEqualTo("{}");
    }

    @Test
    @DisplayName("Should reject values without a safe literal form")
    void shouldRejectUnsupported() {
        Map<Object, Object> intKeys = new LinkedHashMap<>();
        intKeys.put(1, "one");

        assertUnsupported(Double.NaN);
        assertUnsupported(Double.POSITIVE_INFINITY);
        assertUnsupported(Float.NEGATIVE_INFINITY);
        assertUnsupported("\uD800");
        assertUnsupported("x\uDC00y");
        assertUnsupported(intKeys);
        assertUnsupported(new Object());
        assertUnsupported(new int[]{1});
        assertUnsupported(Arrays.asList(1, new Object()));
    }

    private void assertUnsupported(Object value) {
        assertThatThrownBy(() -> serializer.serialize(value))
                .isInstanceOf(AqlCompilationException.class)
                .satisfies(e -> assertThat(((AqlCompilationException) e).getErrorType())
                        .isEqualTo(CompilationErrorType.UNSUPPORTED_OPERAND));
    }
}
