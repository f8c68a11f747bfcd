package com.encsyntax.syntax;

/**
 * Half-open range {@code [start, start + length)} of absolute text offsets.
 */
public record TextSpan(int start, int length) {

    public TextSpan {
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid span [" + start + ", +" + length + ")");
        }
    }

    public int end() {
        return start + length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public boolean contains(int position) {
        return position >= start && position < end();
    }

    public boolean contains(TextSpan other) {
        return other.start >= start && other.end() <= end();
    }

    @Override
    public String toString() {
        return "[" + start + ".." + end() + ")";
    }
}
