package com.aqlcomposer.query;

/**
 * Sort order of a SORT key
 */
public enum SortDirection {
    ASC,
    DESC;

    /**
     * Parse a direction, case-insensitive
     */
    public static SortDirection fromValue(String value) {
        for (SortDirection direction : values()) {
            if (direction.name().equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown SortDirection value: " + value);
    }
}
