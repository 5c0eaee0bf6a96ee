package org.ipod.datapipeline.api.runtime;

/**
 * A run input that is either a plain local value or a reference to a value already placed
 * in an {@link IObjectStore}.
 * <p>
 * Callers may hand over inputs they placed themselves, for example when several runs share
 * the same observation table. The distinction is resolved once, at the broadcaster boundary,
 * through {@link #materialize(IObjectStore)}.
 *
 * @param <T> Type of the input value.
 */
public sealed interface SharedInput<T> permits SharedInput.Value, SharedInput.Reference {

    static <T> SharedInput<T> ofValue(T value) {
        return new Value<>(value);
    }

    static <T> SharedInput<T> ofReference(ObjectRef<T> ref) {
        return new Reference<>(ref);
    }

    /**
     * Returns the local value of this input.
     *
     * @param store Store used to dereference a {@link Reference}. May be {@code null} for
     *              a {@link Value}.
     * @return The input value.
     * @throws IllegalStateException if this is a reference and no store is given.
     */
    T materialize(IObjectStore store);

    /**
     * A plain local value.
     */
    record Value<T>(T value) implements SharedInput<T> {

        public Value {
            if (value == null) {
                throw new IllegalArgumentException("value must not be null");
            }
        }

        @Override
        public T materialize(IObjectStore store) {
            return value;
        }
    }

    /**
     * A reference to a value already placed in an object store.
     */
    record Reference<T>(ObjectRef<T> ref) implements SharedInput<T> {

        public Reference {
            if (ref == null) {
                throw new IllegalArgumentException("ref must not be null");
            }
        }

        @Override
        public T materialize(IObjectStore store) {
            if (store == null) {
                throw new IllegalStateException("Input " + ref.id() + " is an object store reference, but no store is available");
            }
            return store.get(ref);
        }
    }
}
