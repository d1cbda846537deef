package com.document.resource.address;

/**
 * Half-open character range {@code [start, end)} over cached text.
 *
 * @param start first character offset, inclusive
 * @param end   last character offset, exclusive
 */
public record ChunkRange(int start, int end) {

    public ChunkRange {
        if (start < 0) {
            throw new IllegalArgumentException("start must be >= 0");
        }
        if (end <= start) {
            throw new IllegalArgumentException("end must be > start");
        }
    }

    /**
     * Returns the part of {@code text} covered by this range. The range is clamped to the text:
     * an end past the text stops at its last character, a start past the text yields "".
     */
    public String sliceOf(String text) {
        int len = text.length();
        int from = Math.min(start, len);
        int to = Math.min(end, len);
        return text.substring(from, to);
    }

    /**
     * Returns the address segment form, {@code start-end}.
     */
    public String toSegment() {
        return start + "-" + end;
    }
}
