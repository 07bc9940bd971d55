package com.aqlcomposer.query;

import java.util.Objects;

/**
 * A graph hop from the enclosing scope to a nested query. The nested query's collection
 * name is the edge collection (or graph, when {@code namedGraph} is set) walked from the
 * parent scope's variable.
 */
public class Join {

    private final TraversalDirection direction;
    private final DepthRange depth;
    private final boolean namedGraph;
    private final Query query;

    public Join(TraversalDirection direction, DepthRange depth, boolean namedGraph, Query query) {
        this.direction = Objects.requireNonNull(direction, "Direction cannot be null");
        this.depth = Objects.requireNonNull(depth, "Depth cannot be null");
        this.query = Objects.requireNonNull(query, "Joined query cannot be null");
        if (query.getSource().isTraversal()) {
            throw new IllegalArgumentException(
                    "Joined query must be built on an edge collection or graph name, not " + query.getSource());
        }
        this.namedGraph = namedGraph;
    }

    public TraversalDirection getDirection() {
        return direction;
    }

    public DepthRange getDepth() {
        return depth;
    }

    public boolean isNamedGraph() {
        return namedGraph;
    }

    public Query getQuery() {
        return query;
    }
}
