package org.ipod.datapipeline.services;

import java.util.ArrayList;
import java.util.List;

import org.ipod.datapipeline.api.runtime.IObjectStore;
import org.ipod.datapipeline.api.runtime.ObjectRef;
import org.ipod.datapipeline.api.runtime.SharedInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Places run inputs into an object store once so that every chunk task reads the same copy.
 * <p>
 * Only references placed by this broadcaster are freed on {@link #release()}. References the
 * caller handed in stay alive, since the caller may still be using them.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; used by the orchestrating thread only.
 */
public class SharedInputBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SharedInputBroadcaster.class);

    private final IObjectStore store;
    private final List<ObjectRef<?>> placed = new ArrayList<>();

    /**
     * @param store The store to place inputs in. May be {@code null} when the broadcaster only
     *              materializes local values.
     */
    public SharedInputBroadcaster(IObjectStore store) {
        this.store = store;
    }

    /**
     * Returns a store reference for the input, placing it first if it is a local value.
     *
     * @param name  Name used in log messages.
     * @param input The input.
     * @param <T>   Value type.
     * @return A reference readable by every worker.
     */
    public <T> ObjectRef<T> broadcast(String name, SharedInput<T> input) {
        if (input instanceof SharedInput.Reference<T> reference) {
            return reference.ref();
        }
        T value = input.materialize(store);
        ObjectRef<T> ref = store.put(value);
        placed.add(ref);
        log.info("Placed {} in the object store.", name);
        return ref;
    }

    /**
     * Returns the local value of the input, reading it back from the store if needed.
     *
     * @param name  Name used in log messages.
     * @param input The input.
     * @param <T>   Value type.
     * @return The value.
     */
    public <T> T materialize(String name, SharedInput<T> input) {
        if (input instanceof SharedInput.Reference<T>) {
            log.info("Retrieving {} from the object store.", name);
        }
        return input.materialize(store);
    }

    /**
     * @return Number of references placed and not yet released.
     */
    public int placedCount() {
        return placed.size();
    }

    /**
     * Frees every reference this broadcaster placed. Calling it again does nothing.
     */
    public void release() {
        if (placed.isEmpty()) {
            return;
        }
        int count = placed.size();
        store.free(List.copyOf(placed));
        placed.clear();
        log.info("Removed {} references from the object store.", count);
    }
}
