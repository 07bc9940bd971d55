package com.aqlcomposer.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.Iterator;
import java.util.Map;
import java.util.UUID;

/**
 * Renders operand values as AQL literals.
 *
 * Every value that ends up in compiled AQL text goes through {@link #serialize(Object)}.
 * Strings are emitted as JSON string literals (AQL accepts JSON escapes), so quotes,
 * backslashes and control characters can never terminate the literal early.
 *
 * Supported kinds:
 * - null, booleans, integral numbers, finite floating point numbers, BigDecimal
 * - strings, characters, enums (by name), UUIDs, java.time values and Dates (ISO-8601)
 * - collections and arrays as {@code [a, b]}, maps with string keys as {@code {"k": v}}
 */
@Component
public class AqlLiteralSerializer {

    private final ObjectMapper objectMapper;

    public AqlLiteralSerializer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @throws AqlCompilationException UNSUPPORTED_OPERAND if the value has no safe literal form
     */
    public String serialize(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return quote(value.toString());
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw unsupported("Non-finite number " + value + " has no AQL literal");
            }
            return write(value);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Enum) {
            return quote(((Enum<?>) value).name());
        }
        if (value instanceof UUID) {
            return quote(value.toString());
        }
        if (value instanceof TemporalAccessor || value instanceof Date) {
            String json = write(value);
            return json.startsWith("\"") ? json : quote(json);
        }
        if (value instanceof Collection) {
            return serializeList(((Collection<?>) value).iterator());
        }
        if (value instanceof Object[]) {
            return serializeList(Arrays.asList((Object[]) value).iterator());
        }
        if (value instanceof Map) {
            return serializeMap((Map<?, ?>) value);
        }
        throw unsupported("Unsupported operand type " + value.getClass().getName());
    }

    private String serializeList(Iterator<?> elements) {
        StringBuilder sb = new StringBuilder("[");
        while (elements.hasNext()) {
            sb.append(serialize(elements.next()));
            if (elements.hasNext()) {
                sb.append(", ");
            }
        }
        return sb.append(']').toString();
    }

    private String serializeMap(Map<?, ?> map) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw unsupported("Map keys must be strings, got "
                        + (entry.getKey() == null ? "null" : entry.getKey().getClass().getName()));
            }
            if (!first) {
                sb.append(", ");
            }
            sb.append(quote((String) entry.getKey())).append(": ").append(serialize(entry.getValue()));
            first = false;
        }
        return sb.append('}').toString();
    }

    private String quote(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                    i++;
                    continue;
                }
                throw unsupported("String contains an unpaired surrogate at index " + i);
            }
            if (Character.isLowSurrogate(c)) {
                throw unsupported("String contains an unpaired surrogate at index " + i);
            }
        }
        return write(text);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AqlCompilationException("Failed to serialize operand of type "
                    + value.getClass().getName(), CompilationErrorType.UNSUPPORTED_OPERAND, e);
        }
    }

    private static AqlCompilationException unsupported(String message) {
        return new AqlCompilationException(message, CompilationErrorType.UNSUPPORTED_OPERAND);
    }
}
