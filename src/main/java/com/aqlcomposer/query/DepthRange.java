package com.aqlcomposer.query;

/**
 * Inclusive min..max depth of a graph traversal, rendered as {@code min..max}
 */
public class DepthRange {

    /**
     * Largest depth a traversal may declare
     */
    public static final int MAX_DEPTH = 65535;

    private final int min;
    private final int max;

    private DepthRange(int min, int max) {
        this.min = min;
        this.max = max;
    }

    /**
     * @throws AqlCompilationException INVALID_TRAVERSAL_DEPTH if a bound is negative,
     *         above {@link #MAX_DEPTH}, or {@code min > max}
     */
    public static DepthRange of(int min, int max) {
        if (min < 0 || max < 0) {
            throw new AqlCompilationException(
                    "Traversal depth cannot be negative: " + min + ".." + max,
                    CompilationErrorType.INVALID_TRAVERSAL_DEPTH);
        }
        if (max > MAX_DEPTH) {
            throw new AqlCompilationException(
                    "Traversal depth " + max + " exceeds maximum of " + MAX_DEPTH,
                    CompilationErrorType.INVALID_TRAVERSAL_DEPTH);
        }
        if (min > max) {
            throw new AqlCompilationException(
                    "Minimum traversal depth " + min + " exceeds maximum " + max,
                    CompilationErrorType.INVALID_TRAVERSAL_DEPTH);
        }
        return new DepthRange(min, max);
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DepthRange)) return false;
        DepthRange that = (DepthRange) o;
        return min == that.min && max == that.max;
    }

    @Override
    public int hashCode() {
        return 31 * min + max;
    }

    @Override
    public String toString() {
        return min + ".." + max;
    }
}
