package com.dimensio.domain.extraction.model;

/**
 * Half-open range of character offsets into a document.
 *
 * @param start first offset covered (inclusive)
 * @param end   offset after the last character covered (exclusive)
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }

    public boolean contains(Span other) {
        return start <= other.start && other.end <= end;
    }

    /**
     * True if {@code other} lies inside this span and is shorter.
     */
    public boolean strictlyContains(Span other) {
        return contains(other) && length() > other.length();
    }

    public Span cover(Span other) {
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }
}
