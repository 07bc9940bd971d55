package com.aqlcomposer.query;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Binds a comparison subject until one terminal comparator call produces the
 * {@link Comparison}. A builder without a terminal call never renders anything.
 *
 * Ordering comparators accept any {@link Comparable} value; the ordering itself is
 * evaluated by the database, the builder only records operator and operand.
 */
public class ComparisonBuilder {

    private final ComparisonSubject subject;

    ComparisonBuilder(ComparisonSubject subject) {
        this.subject = subject;
    }

    public ComparisonSubject getSubject() {
        return subject;
    }

    public Comparison equalTo(Object value) {
        return binary(ComparisonOperator.EQUALS, value);
    }

    public Comparison differentThan(Object value) {
        return binary(ComparisonOperator.NOT_EQUALS, value);
    }

    public <T extends Comparable<? super T>> Comparison greaterThan(T value) {
        return binary(ComparisonOperator.GREATER_THAN, requireValue(value));
    }

    public Comparison greaterThan(FieldReference field) {
        return binary(ComparisonOperator.GREATER_THAN, requireValue(field));
    }

    public <T extends Comparable<? super T>> Comparison greaterOrEqual(T value) {
        return binary(ComparisonOperator.GREATER_OR_EQUAL, requireValue(value));
    }

    public Comparison greaterOrEqual(FieldReference field) {
        return binary(ComparisonOperator.GREATER_OR_EQUAL, requireValue(field));
    }

    public <T extends Comparable<? super T>> Comparison lesserThan(T value) {
        return binary(ComparisonOperator.LESSER_THAN, requireValue(value));
    }

    public Comparison lesserThan(FieldReference field) {
        return binary(ComparisonOperator.LESSER_THAN, requireValue(field));
    }

    public <T extends Comparable<? super T>> Comparison lesserOrEqual(T value) {
        return binary(ComparisonOperator.LESSER_OR_EQUAL, requireValue(value));
    }

    public Comparison lesserOrEqual(FieldReference field) {
        return binary(ComparisonOperator.LESSER_OR_EQUAL, requireValue(field));
    }

    /**
     * AQL LIKE pattern: {@code %} matches any sequence, {@code _} a single character
     */
    public Comparison like(String pattern) {
        return binary(ComparisonOperator.LIKE, requireValue(pattern));
    }

    public Comparison notLike(String pattern) {
        return binary(ComparisonOperator.NOT_LIKE, requireValue(pattern));
    }

    /**
     * Regular expression match ({@code =~})
     */
    public Comparison matches(String regularExpression) {
        return binary(ComparisonOperator.MATCHES, requireValue(regularExpression));
    }

    public Comparison doesNotMatch(String regularExpression) {
        return binary(ComparisonOperator.DOES_NOT_MATCH, requireValue(regularExpression));
    }

    public Comparison inArray(Collection<?> values) {
        return binary(ComparisonOperator.IN, requireValue(values));
    }

    public Comparison inArray(Object... values) {
        return binary(ComparisonOperator.IN, requireValue(values));
    }

    public Comparison inArray(int[] values) {
        return binary(ComparisonOperator.IN, boxed(requireValue(values)));
    }

    public Comparison inArray(long[] values) {
        return binary(ComparisonOperator.IN, boxed(requireValue(values)));
    }

    public Comparison inArray(double[] values) {
        return binary(ComparisonOperator.IN, boxed(requireValue(values)));
    }

    public Comparison notInArray(Collection<?> values) {
        return binary(ComparisonOperator.NOT_IN, requireValue(values));
    }

    public Comparison notInArray(Object... values) {
        return binary(ComparisonOperator.NOT_IN, requireValue(values));
    }

    public Comparison notInArray(int[] values) {
        return binary(ComparisonOperator.NOT_IN, boxed(requireValue(values)));
    }

    public Comparison notInArray(long[] values) {
        return binary(ComparisonOperator.NOT_IN, boxed(requireValue(values)));
    }

    public Comparison notInArray(double[] values) {
        return binary(ComparisonOperator.NOT_IN, boxed(requireValue(values)));
    }

    public Comparison isNull() {
        return unary(ComparisonOperator.IS_NULL);
    }

    public Comparison notNull() {
        return unary(ComparisonOperator.IS_NOT_NULL);
    }

    public Comparison isTrue() {
        return unary(ComparisonOperator.IS_TRUE);
    }

    public Comparison isFalse() {
        return unary(ComparisonOperator.IS_FALSE);
    }

    private Comparison binary(ComparisonOperator operator, Object value) {
        return new Comparison(subject, operator, Operand.literal(value));
    }

    private Comparison unary(ComparisonOperator operator) {
        return new Comparison(subject, operator, null);
    }

    private static List<Integer> boxed(int[] values) {
        return Arrays.stream(values).boxed().collect(Collectors.toList());
    }

    private static List<Long> boxed(long[] values) {
        return Arrays.stream(values).boxed().collect(Collectors.toList());
    }

    private static List<Double> boxed(double[] values) {
        return Arrays.stream(values).boxed().collect(Collectors.toList());
    }

    private static <T> T requireValue(T value) {
        return Objects.requireNonNull(value, "Comparison value cannot be null, use isNull() instead");
    }
}
