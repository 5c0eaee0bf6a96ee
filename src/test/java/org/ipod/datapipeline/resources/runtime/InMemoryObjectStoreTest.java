package org.ipod.datapipeline.resources.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.ipod.datapipeline.api.runtime.ObjectRef;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class InMemoryObjectStoreTest {

    @Test
    void putReturnsDistinctReferencesForEqualValues() {
        InMemoryObjectStore store = new InMemoryObjectStore();

        ObjectRef<String> first = store.put("value");
        ObjectRef<String> second = store.put("value");

        assertThat(first).isNotEqualTo(second);
        assertThat(store.get(first)).isEqualTo("value");
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void getAfterFreeFails() {
        InMemoryObjectStore store = new InMemoryObjectStore();
        ObjectRef<List<Integer>> ref = store.put(List.of(1, 2, 3));

        store.free(List.of(ref));

        assertThatThrownBy(() -> store.get(ref))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining(ref.id());
        assertThat(store.size()).isZero();
    }

    @Test
    void freeIgnoresUnknownReferences() {
        InMemoryObjectStore store = new InMemoryObjectStore();
        ObjectRef<String> kept = store.put("kept");

        store.free(List.of(new ObjectRef<String>("unknown")));

        assertThat(store.get(kept)).isEqualTo("kept");
    }

    @Test
    void nullValuesAreRejected() {
        InMemoryObjectStore store = new InMemoryObjectStore();

        assertThatThrownBy(() -> store.put(null)).isInstanceOf(NullPointerException.class);
    }
}
