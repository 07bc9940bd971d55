package com.aqlcomposer.query;

import java.util.Objects;

/**
 * Reference to another field of the same scope, used as the right-hand side of a
 * field-to-field comparison. Rendered as a bare qualified identifier, never quoted.
 */
public class FieldReference {

    private final String field;

    private FieldReference(String field) {
        this.field = Objects.requireNonNull(field, "Field cannot be null");
        if (field.isBlank()) {
            throw new IllegalArgumentException("Field cannot be blank");
        }
    }

    public static FieldReference of(String field) {
        return new FieldReference(field);
    }

    public String getField() {
        return field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldReference)) return false;
        return field.equals(((FieldReference) o).field);
    }

    @Override
    public int hashCode() {
        return field.hashCode();
    }

    @Override
    public String toString() {
        return "field(" + field + ")";
    }
}
