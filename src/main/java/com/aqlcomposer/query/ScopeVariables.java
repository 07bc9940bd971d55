package com.aqlcomposer.query;

/**
 * Loop variable names by nesting depth.
 *
 * Names are the bijective base-11 numerals over {@code a..k}: depth 0 is {@code a},
 * depth 10 is {@code k}, depth 11 is {@code aa}, depth 21 is {@code ak} and so on without
 * bound. No AQL keyword can be spelled from these letters.
 */
public final class ScopeVariables {

    private static final char[] ALPHABET = "abcdefghijk".toCharArray();

    private ScopeVariables() {
    }

    public static String forDepth(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Depth cannot be negative: " + depth);
        }
        StringBuilder name = new StringBuilder();
        long n = (long) depth + 1;
        while (n > 0) {
            n--;
            name.append(ALPHABET[(int) (n % ALPHABET.length)]);
            n /= ALPHABET.length;
        }
        return name.reverse().toString();
    }
}
