package com.aqlcomposer.query;

/**
 * A term that can take part in a {@link Filter}: a single {@link Comparison} or a nested Filter.
 */
public interface FilterTerm {

    /**
     * View this term as a filter. A comparison becomes a single-term filter,
     * a filter returns itself.
     */
    Filter toFilter();
}
