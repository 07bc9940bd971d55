package com.aqlcomposer.query;

import java.util.Objects;

/**
 * Left-hand side of a comparison: a document field, an array field with a quantifier,
 * or a raw statement that is emitted without scope qualification.
 */
public class ComparisonSubject {

    private final String name;
    private final boolean field;
    private final ArrayQuantifier quantifier;

    private ComparisonSubject(String name, boolean field, ArrayQuantifier quantifier) {
        this.name = Objects.requireNonNull(name, "Subject name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Subject name cannot be blank");
        }
        this.field = field;
        this.quantifier = quantifier;
    }

    public static ComparisonSubject field(String name) {
        return new ComparisonSubject(name, true, null);
    }

    public static ComparisonSubject array(String name, ArrayQuantifier quantifier) {
        return new ComparisonSubject(name, true, Objects.requireNonNull(quantifier, "Quantifier cannot be null"));
    }

    public static ComparisonSubject statement(String statement) {
        return new ComparisonSubject(statement, false, null);
    }

    public String getName() {
        return name;
    }

    /**
     * Whether the subject is a document field, qualified with the scope variable when rendered
     */
    public boolean isField() {
        return field;
    }

    /**
     * Array quantifier, or null for plain fields and statements
     */
    public ArrayQuantifier getQuantifier() {
        return quantifier;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComparisonSubject)) return false;
        ComparisonSubject that = (ComparisonSubject) o;
        return field == that.field && name.equals(that.name) && quantifier == that.quantifier;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, field, quantifier);
    }

    @Override
    public String toString() {
        return quantifier == null ? name : name + " " + quantifier;
    }
}
