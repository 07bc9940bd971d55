package com.aqlcomposer.query;

import java.util.Objects;

/**
 * A single predicate: subject, operator and (for binary operators) an operand.
 *
 * Comparisons are created through a {@link ComparisonBuilder}:
 * <pre>
 * Comparison.field("age").greaterThan(15)          // a.age > 15
 * Comparison.any("emails").like("%gmail.com")      // a.emails ANY LIKE "%gmail.com"
 * Comparison.statement("1").equalTo(1)             // 1 == 1
 * </pre>
 * Instances are immutable and can be shared between filters and queries.
 */
public class Comparison implements FilterTerm {

    private final ComparisonSubject subject;
    private final ComparisonOperator operator;
    private final Operand operand;

    Comparison(ComparisonSubject subject, ComparisonOperator operator, Operand operand) {
        this.subject = Objects.requireNonNull(subject, "Subject cannot be null");
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
        if (operator.isUnary() && operand != null) {
            throw new IllegalArgumentException(operator + " does not take an operand");
        }
        if (!operator.isUnary() && operand == null) {
            throw new IllegalArgumentException(operator + " requires an operand");
        }
        this.operand = operand;
    }

    /**
     * Start a comparison on a document field
     */
    public static ComparisonBuilder field(String fieldName) {
        return new ComparisonBuilder(ComparisonSubject.field(fieldName));
    }

    /**
     * Start a comparison that must hold for all elements of an array field
     */
    public static ComparisonBuilder all(String arrayFieldName) {
        return new ComparisonBuilder(ComparisonSubject.array(arrayFieldName, ArrayQuantifier.ALL));
    }

    /**
     * Start a comparison that must hold for at least one element of an array field
     */
    public static ComparisonBuilder any(String arrayFieldName) {
        return new ComparisonBuilder(ComparisonSubject.array(arrayFieldName, ArrayQuantifier.ANY));
    }

    /**
     * Start a comparison that must hold for no element of an array field
     */
    public static ComparisonBuilder none(String arrayFieldName) {
        return new ComparisonBuilder(ComparisonSubject.array(arrayFieldName, ArrayQuantifier.NONE));
    }

    /**
     * Start a comparison on a raw statement, rendered without the scope variable
     */
    public static ComparisonBuilder statement(String statement) {
        return new ComparisonBuilder(ComparisonSubject.statement(statement));
    }

    /**
     * Start a filter with this comparison followed by {@code term} joined with AND
     */
    public Filter and(FilterTerm term) {
        return Filter.of(this).and(term);
    }

    /**
     * Start a filter with this comparison followed by {@code term} joined with OR
     */
    public Filter or(FilterTerm term) {
        return Filter.of(this).or(term);
    }

    @Override
    public Filter toFilter() {
        return Filter.of(this);
    }

    public ComparisonSubject getSubject() {
        return subject;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    /**
     * Operand of a binary comparison, null for unary operators
     */
    public Operand getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        String right = operator.isUnary() ? operator.getFixedOperand() : String.valueOf(operand);
        return subject + " " + operator.getAql() + " " + right;
    }
}
