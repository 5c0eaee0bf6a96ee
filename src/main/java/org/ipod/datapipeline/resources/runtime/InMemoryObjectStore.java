package org.ipod.datapipeline.resources.runtime;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.ipod.datapipeline.api.runtime.IObjectStore;
import org.ipod.datapipeline.api.runtime.ObjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local object store backed by a {@link ConcurrentHashMap}.
 * <p>
 * Values are shared by reference, never copied, so placed values must be immutable.
 */
public class InMemoryObjectStore implements IObjectStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryObjectStore.class);

    private final Map<String, Object> objects = new ConcurrentHashMap<>();

    @Override
    public <T> ObjectRef<T> put(T value) {
        if (value == null) {
            throw new NullPointerException("value cannot be null");
        }
        ObjectRef<T> ref = new ObjectRef<>(UUID.randomUUID().toString());
        objects.put(ref.id(), value);
        log.debug("Placed {} under {}", value.getClass().getSimpleName(), ref.id());
        return ref;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(ObjectRef<T> ref) {
        Object value = objects.get(ref.id());
        if (value == null) {
            throw new IllegalStateException("Object " + ref.id() + " is not in the store (never placed or already freed)");
        }
        return (T) value;
    }

    @Override
    public void free(List<? extends ObjectRef<?>> refs) {
        int removed = 0;
        for (ObjectRef<?> ref : refs) {
            if (objects.remove(ref.id()) != null) {
                removed++;
            }
        }
        log.debug("Freed {} of {} requested objects", removed, refs.size());
    }

    @Override
    public int size() {
        return objects.size();
    }
}
