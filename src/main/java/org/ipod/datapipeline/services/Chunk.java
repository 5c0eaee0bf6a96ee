package org.ipod.datapipeline.services;

/**
 * A half-open range {@code [start, end)} of positions in the orbit identifier sequence.
 *
 * @param start First position (inclusive).
 * @param end   Last position (exclusive).
 */
public record Chunk(int start, int end) {

    public Chunk {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid chunk [" + start + ", " + end + ")");
        }
    }

    public int size() {
        return end - start;
    }
}
