package com.aqlcomposer.query;

/**
 * Categories of caller-input errors detected while building or compiling a query.
 * None of them is transient: the only recovery is fixing the descriptor.
 */
public enum CompilationErrorType {

    /**
     * A filter with no terms was attached or compiled
     */
    MALFORMED_FILTER,

    /**
     * A prune filter was attached to a scope that is not a traversal
     */
    INVALID_PRUNE,

    /**
     * Traversal depth bounds are inverted or out of the accepted range
     */
    INVALID_TRAVERSAL_DEPTH,

    /**
     * An operand value has no safe AQL literal form
     */
    UNSUPPORTED_OPERAND
}
