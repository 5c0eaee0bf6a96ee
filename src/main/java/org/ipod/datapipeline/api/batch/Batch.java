package org.ipod.datapipeline.api.batch;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An append-only collection of rows stored as a list of immutable segments.
 * <p>
 * Concatenating another batch only appends references to its segments, so repeated
 * incremental appends are cheap but leave the rows spread over many segments. Callers
 * check {@link #isFragmented()} after appending and call {@link #compact()} to copy the
 * rows back into one contiguous segment.
 * <p>
 * A batch counts as fragmented once the rows held outside its head segment are at least as
 * many as the rows inside it. Compacting on that condition doubles the head segment each
 * time, so the total copy work over a run stays linear in the number of rows.
 * <p>
 * <strong>Thread Safety:</strong> This class is <strong>NOT thread-safe</strong>. A batch is
 * filled by exactly one thread and handed over to another only through a happens-before
 * edge such as {@link java.util.concurrent.Future#get()}.
 *
 * @param <T> Row type.
 */
public final class Batch<T> implements Iterable<T> {

    private final List<List<T>> segments = new ArrayList<>();
    private int size;

    private Batch() {
    }

    public static <T> Batch<T> empty() {
        return new Batch<>();
    }

    /**
     * Creates a batch holding a copy of the given rows as a single segment.
     *
     * @param rows Rows to copy, must not contain {@code null}.
     * @param <T>  Row type.
     * @return A new, unfragmented batch.
     */
    public static <T> Batch<T> of(Collection<? extends T> rows) {
        Batch<T> batch = new Batch<>();
        batch.appendAll(rows);
        return batch;
    }

    /**
     * Appends a copy of the given rows as a new segment. Empty collections are ignored.
     *
     * @param rows Rows to append, must not contain {@code null}.
     */
    public void appendAll(Collection<? extends T> rows) {
        if (rows.isEmpty()) {
            return;
        }
        List<T> segment = List.copyOf(rows);
        segments.add(segment);
        size += segment.size();
    }

    /**
     * Appends all segments of another batch without copying their rows.
     *
     * @param other The batch to append. It is left unchanged.
     */
    public void concat(Batch<? extends T> other) {
        if (other == this) {
            throw new IllegalArgumentException("Cannot concatenate a batch with itself");
        }
        for (List<? extends T> segment : other.segments) {
            segments.add(Collections.unmodifiableList(segment));
            size += segment.size();
        }
    }

    /**
     * @return {@code true} if the rows outside the head segment are at least as many as the
     *         rows inside it.
     */
    public boolean isFragmented() {
        if (segments.size() <= 1) {
            return false;
        }
        int headRows = segments.get(0).size();
        return size - headRows >= headRows;
    }

    /**
     * Copies all rows into a single contiguous segment. Does nothing if there is at most one
     * segment already.
     */
    public void compact() {
        if (segments.size() <= 1) {
            return;
        }
        List<T> merged = new ArrayList<>(size);
        for (List<T> segment : segments) {
            merged.addAll(segment);
        }
        segments.clear();
        segments.add(Collections.unmodifiableList(merged));
    }

    public int segmentCount() {
        return segments.size();
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return An unmodifiable copy of all rows in append order.
     */
    public List<T> toList() {
        List<T> rows = new ArrayList<>(size);
        for (List<T> segment : segments) {
            rows.addAll(segment);
        }
        return Collections.unmodifiableList(rows);
    }

    @Override
    public Iterator<T> iterator() {
        return segments.stream().flatMap(List::stream).iterator();
    }

    @Override
    public String toString() {
        return "Batch[size=" + size + ", segments=" + segments.size() + "]";
    }
}
