package org.ipod.datapipeline.api.runtime;

import java.util.List;

/**
 * Shared, addressable store for large read-mostly values.
 * <p>
 * Values are placed once and read by any number of tasks. Placed values stay alive until
 * they are explicitly freed; the store never evicts on its own.
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be thread-safe. {@link #get(ObjectRef)}
 * is called concurrently from worker threads.
 */
public interface IObjectStore {

    /**
     * Places a value in the store.
     *
     * @param value The value, must not be {@code null}.
     * @param <T>   Value type.
     * @return A new reference to the placed value.
     */
    <T> ObjectRef<T> put(T value);

    /**
     * Reads a placed value.
     *
     * @param ref Reference returned by {@link #put(Object)}.
     * @param <T> Value type.
     * @return The placed value.
     * @throws IllegalStateException if the reference is unknown or has been freed.
     */
    <T> T get(ObjectRef<T> ref);

    /**
     * Removes the referenced values from the store. Unknown references are ignored.
     *
     * @param refs References to free.
     */
    void free(List<? extends ObjectRef<?>> refs);

    /**
     * @return Number of values currently held.
     */
    int size();
}
