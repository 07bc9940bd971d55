package com.aqlcomposer.query;

/**
 * LIMIT clause: at most {@code count} documents after skipping {@code skip}.
 * Rendered as {@code LIMIT count} or {@code LIMIT skip, count}.
 */
public class Limit {
    private final int count;
    private final Integer skip;

    public Limit(int count, Integer skip) {
        if (count < 0) {
            throw new IllegalArgumentException("Limit cannot be negative");
        }
        if (skip != null && skip < 0) {
            throw new IllegalArgumentException("Skip cannot be negative");
        }
        this.count = count;
        this.skip = skip;
    }

    public int getCount() {
        return count;
    }

    /**
     * Number of documents to skip, null when not set
     */
    public Integer getSkip() {
        return skip;
    }

    @Override
    public String toString() {
        return skip == null ? "LIMIT " + count : "LIMIT " + skip + ", " + count;
    }
}
