package com.syntaxforge.ast;

/**
 * Absolute character offsets of a node in its source text, end exclusive.
 */
public record Range(int start, int end) {

    public Range {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid range [" + start + ", " + end + "]");
        }
    }

    public int length() {
        return end - start;
    }
}
