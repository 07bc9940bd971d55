package com.aqlcomposer.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered boolean combination of comparisons and nested filters.
 *
 * Terms are rendered strictly in insertion order with no precedence rewriting:
 * {@code Filter.of(a).and(b).or(c)} renders as {@code a && b || c}. A nested filter is
 * always rendered as a parenthesized unit, so
 * {@code Filter.of(a).and(Filter.of(b).or(c))} renders as {@code a && (b || c)}.
 *
 * Filters are immutable; {@link #and} and {@link #or} return a new instance,
 * so one filter can be reused across several queries.
 */
public class Filter implements FilterTerm {

    private final List<Entry> entries;

    private Filter(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    /**
     * Single-term filter
     */
    public static Filter of(FilterTerm term) {
        List<Entry> entries = new ArrayList<>();
        entries.add(new Entry(null, requireTerm(term)));
        return new Filter(entries);
    }

    /**
     * Flat chain of {@code terms} joined with AND. An empty collection yields an empty
     * filter, which is rejected with MALFORMED_FILTER when attached, nested or compiled.
     */
    public static Filter allOf(Collection<? extends FilterTerm> terms) {
        return chain(terms, LogicalOperator.AND);
    }

    /**
     * Flat chain of {@code terms} joined with OR
     */
    public static Filter anyOf(Collection<? extends FilterTerm> terms) {
        return chain(terms, LogicalOperator.OR);
    }

    public Filter and(FilterTerm term) {
        return append(LogicalOperator.AND, term);
    }

    public Filter or(FilterTerm term) {
        return append(LogicalOperator.OR, term);
    }

    @Override
    public Filter toFilter() {
        return this;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private Filter append(LogicalOperator operator, FilterTerm term) {
        List<Entry> copy = new ArrayList<>(entries.size() + 1);
        copy.addAll(entries);
        copy.add(new Entry(entries.isEmpty() ? null : operator, requireTerm(term)));
        return new Filter(copy);
    }

    private static Filter chain(Collection<? extends FilterTerm> terms, LogicalOperator operator) {
        Objects.requireNonNull(terms, "Terms cannot be null");
        Filter filter = new Filter(new ArrayList<>());
        for (FilterTerm term : terms) {
            filter = filter.append(operator, term);
        }
        return filter;
    }

    private static FilterTerm requireTerm(FilterTerm term) {
        Objects.requireNonNull(term, "Filter term cannot be null");
        if (term instanceof Filter && ((Filter) term).isEmpty()) {
            throw new AqlCompilationException("Cannot nest an empty filter",
                    CompilationErrorType.MALFORMED_FILTER);
        }
        return term;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Entry entry : entries) {
            if (entry.getOperator() != null) {
                sb.append(' ').append(entry.getOperator().getAql()).append(' ');
            }
            if (entry.getTerm() instanceof Filter) {
                sb.append('(').append(entry.getTerm()).append(')');
            } else {
                sb.append(entry.getTerm());
            }
        }
        return sb.toString();
    }

    /**
     * One term of a filter with the combinator joining it to the previous term.
     * The first entry has no combinator.
     */
    public static class Entry {
        private final LogicalOperator operator;
        private final FilterTerm term;

        Entry(LogicalOperator operator, FilterTerm term) {
            this.operator = operator;
            this.term = term;
        }

        /**
         * Combinator with the previous entry, null for the first entry
         */
        public LogicalOperator getOperator() {
            return operator;
        }

        public FilterTerm getTerm() {
            return term;
        }
    }
}
