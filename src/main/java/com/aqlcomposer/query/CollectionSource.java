package com.aqlcomposer.query;

import java.util.Objects;

/**
 * Scan of a named collection: {@code FOR a IN User}
 */
public class CollectionSource implements QuerySource {

    private final String collection;

    public CollectionSource(String collection) {
        this.collection = Objects.requireNonNull(collection, "Collection cannot be null");
        if (collection.isBlank()) {
            throw new IllegalArgumentException("Collection cannot be blank");
        }
    }

    @Override
    public String getName() {
        return collection;
    }

    @Override
    public boolean isTraversal() {
        return false;
    }

    @Override
    public String toString() {
        return "Collection(" + collection + ")";
    }
}
