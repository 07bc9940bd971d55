package com.aqlcomposer.query;

import java.util.Objects;

/**
 * Represents a sort field with direction
 */
public class SortField {
    private final String field;
    private final SortDirection direction;

    public SortField(String field, SortDirection direction) {
        this.field = Objects.requireNonNull(field, "Sort field cannot be null");
        this.direction = direction == null ? SortDirection.ASC : direction;
    }

    public String getField() {
        return field;
    }

    public SortDirection getDirection() {
        return direction;
    }

    @Override
    public String toString() {
        return field + " " + direction;
    }
}
