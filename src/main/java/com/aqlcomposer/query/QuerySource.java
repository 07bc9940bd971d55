package com.aqlcomposer.query;

/**
 * Where a query scope reads its documents from.
 * - {@link CollectionSource}: every document of a named collection
 * - {@link TraversalSource}: vertices reached from a start vertex through an edge collection or named graph
 */
public interface QuerySource {

    /**
     * Collection name, or edge collection / graph name for traversals
     */
    String getName();

    /**
     * Whether the scope walks a graph, which makes PRUNE applicable
     */
    boolean isTraversal();
}
