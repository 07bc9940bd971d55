package com.aqlcomposer.query;

import java.util.Objects;

/**
 * Graph traversal from a fixed start vertex:
 * {@code FOR a IN 1..2 OUTBOUND "User/123" edgeCollection} or, for named graphs,
 * {@code FOR a IN 1..2 OUTBOUND "User/123" GRAPH SomeGraph}
 */
public class TraversalSource implements QuerySource {

    private final TraversalDirection direction;
    private final DepthRange depth;
    private final String edgeCollectionOrGraph;
    private final boolean namedGraph;
    private final String startVertex;

    public TraversalSource(TraversalDirection direction, DepthRange depth, String edgeCollectionOrGraph,
                           boolean namedGraph, String startVertex) {
        this.direction = Objects.requireNonNull(direction, "Direction cannot be null");
        this.depth = Objects.requireNonNull(depth, "Depth cannot be null");
        this.edgeCollectionOrGraph = Objects.requireNonNull(edgeCollectionOrGraph, "Edge collection or graph cannot be null");
        this.namedGraph = namedGraph;
        this.startVertex = Objects.requireNonNull(startVertex, "Start vertex cannot be null");
        if (edgeCollectionOrGraph.isBlank()) {
            throw new IllegalArgumentException("Edge collection or graph cannot be blank");
        }
        if (startVertex.isBlank()) {
            throw new IllegalArgumentException("Start vertex cannot be blank");
        }
    }

    @Override
    public String getName() {
        return edgeCollectionOrGraph;
    }

    @Override
    public boolean isTraversal() {
        return true;
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

    /**
     * Document id of the start vertex (e.g. {@code User/123}), rendered as a string literal
     */
    public String getStartVertex() {
        return startVertex;
    }

    @Override
    public String toString() {
        return "Traversal(" + depth + " " + direction + " " + startVertex + " "
                + (namedGraph ? "GRAPH " : "") + edgeCollectionOrGraph + ")";
    }
}
