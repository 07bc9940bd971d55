package com.aqlcomposer.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Right-hand side of a comparison: either a literal value or a reference to another field.
 *
 * Literal values are snapshotted on construction: collections, object arrays and maps are
 * copied into unmodifiable structures, so later changes to caller state never reach the query.
 * Whether the value can be rendered is decided by {@link AqlLiteralSerializer} at compile time.
 */
public class Operand {

    private final Object value;
    private final FieldReference fieldReference;

    private Operand(Object value, FieldReference fieldReference) {
        this.value = value;
        this.fieldReference = fieldReference;
    }

    public static Operand literal(Object value) {
        if (value instanceof FieldReference) {
            return field((FieldReference) value);
        }
        return new Operand(snapshot(value), null);
    }

    public static Operand field(FieldReference reference) {
        return new Operand(null, Objects.requireNonNull(reference, "Field reference cannot be null"));
    }

    public boolean isFieldReference() {
        return fieldReference != null;
    }

    public Object getValue() {
        return value;
    }

    public FieldReference getFieldReference() {
        return fieldReference;
    }

    private static Object snapshot(Object value) {
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                copy.add(snapshot(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(entry.getKey(), snapshot(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Object[]) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (Object[]) value) {
                copy.add(snapshot(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        return value;
    }

    @Override
    public String toString() {
        return isFieldReference() ? fieldReference.toString() : String.valueOf(value);
    }
}
