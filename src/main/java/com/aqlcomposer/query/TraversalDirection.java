package com.aqlcomposer.query;

/**
 * Edge direction followed by a graph traversal.
 */
public enum TraversalDirection {

    /**
     * Follow edges from {@code _from} to {@code _to}
     */
    OUTBOUND,

    /**
     * Follow edges from {@code _to} to {@code _from}
     */
    INBOUND,

    /**
     * Follow edges in both directions
     */
    ANY
}
