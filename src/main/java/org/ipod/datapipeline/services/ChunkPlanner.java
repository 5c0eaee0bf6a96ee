package org.ipod.datapipeline.services;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Splits {@code n} items into contiguous chunks.
 * <p>
 * The distributed path sizes chunks so that every worker gets work even for small inputs:
 * {@code min(ceil(n / workers), chunkSize)}. The sequential path uses the nominal chunk size.
 */
public final class ChunkPlanner {

    private ChunkPlanner() {
    }

    /**
     * @param n         Number of items, at least 0.
     * @param workers   Number of workers, at least 1.
     * @param chunkSize Nominal chunk size, at least 1.
     * @return {@code min(ceil(n / workers), chunkSize)}, never below 1.
     */
    public static int effectiveChunkSize(int n, int workers, int chunkSize) {
        validate(n, workers, chunkSize);
        int perWorker = (int) Math.ceil((double) n / workers);
        return Math.max(1, Math.min(perWorker, chunkSize));
    }

    /**
     * Plans the distributed chunks.
     *
     * @param n         Number of items.
     * @param workers   Number of workers.
     * @param chunkSize Nominal chunk size.
     * @return Disjoint chunks covering {@code [0, n)} ordered by start.
     */
    public static Iterable<Chunk> plan(int n, int workers, int chunkSize) {
        return ranges(n, effectiveChunkSize(n, workers, chunkSize));
    }

    /**
     * Plans chunks of exactly {@code chunkSize} items, except for a shorter last chunk.
     *
     * @param n         Number of items, at least 0.
     * @param chunkSize Chunk size, at least 1.
     * @return Disjoint chunks covering {@code [0, n)} ordered by start.
     */
    public static Iterable<Chunk> ranges(int n, int chunkSize) {
        validate(n, 1, chunkSize);
        return () -> new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < n;
            }

            @Override
            public Chunk next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                int end = Math.min(next + chunkSize, n);
                Chunk chunk = new Chunk(next, end);
                next = end;
                return chunk;
            }
        };
    }

    private static void validate(int n, int workers, int chunkSize) {
        if (n < 0) {
            throw new IllegalArgumentException("n cannot be negative, got " + n);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1, got " + chunkSize);
        }
    }
}
