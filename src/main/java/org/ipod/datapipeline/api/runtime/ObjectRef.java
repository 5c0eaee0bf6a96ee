package org.ipod.datapipeline.api.runtime;

/**
 * Lightweight handle for a value placed in an {@link IObjectStore}.
 * <p>
 * References are cheap to copy into task arguments; dereferencing is idempotent and yields
 * the same logical value on every worker.
 *
 * @param id  Store-unique identifier.
 * @param <T> Type of the referenced value.
 */
public record ObjectRef<T>(String id) {

    public ObjectRef {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }
}
