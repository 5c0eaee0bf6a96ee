package org.ipod.datapipeline.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;

import org.ipod.datapipeline.api.runtime.IObjectStore;
import org.ipod.datapipeline.api.runtime.ObjectRef;
import org.ipod.datapipeline.api.runtime.SharedInput;
import org.ipod.datapipeline.resources.runtime.InMemoryObjectStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class SharedInputBroadcasterTest {

    @Test
    void valueIsPlacedExactlyOnceAndFreedOnRelease() {
        // Given
        IObjectStore store = mock(IObjectStore.class);
        ObjectRef<String> ref = new ObjectRef<>("ref-1");
        when(store.<String>put("payload")).thenReturn(ref);
        SharedInputBroadcaster broadcaster = new SharedInputBroadcaster(store);

        // When
        ObjectRef<String> placed = broadcaster.broadcast("payload", SharedInput.ofValue("payload"));
        broadcaster.release();

        // Then
        assertThat(placed).isEqualTo(ref);
        verify(store, times(1)).put("payload");
        verify(store).free(List.of(ref));
    }

    @Test
    void callerReferenceIsPassedThroughAndNeverFreed() {
        IObjectStore store = mock(IObjectStore.class);
        ObjectRef<String> callerRef = new ObjectRef<>("caller");
        SharedInputBroadcaster broadcaster = new SharedInputBroadcaster(store);

        ObjectRef<String> result = broadcaster.broadcast("observations", SharedInput.ofReference(callerRef));
        broadcaster.release();

        assertThat(result).isSameAs(callerRef);
        verify(store, never()).put(any());
        verify(store, never()).free(anyList());
        assertThat(broadcaster.placedCount()).isZero();
    }

    @Test
    void releaseIsIdempotent() {
        InMemoryObjectStore store = new InMemoryObjectStore();
        SharedInputBroadcaster broadcaster = new SharedInputBroadcaster(store);
        broadcaster.broadcast("a", SharedInput.ofValue("a"));
        broadcaster.broadcast("b", SharedInput.ofValue("b"));
        assertThat(store.size()).isEqualTo(2);

        broadcaster.release();
        broadcaster.release();

        assertThat(store.size()).isZero();
        assertThat(broadcaster.placedCount()).isZero();
    }

    @Test
    void materializeReadsReferencesBackThroughTheStore() {
        InMemoryObjectStore store = new InMemoryObjectStore();
        ObjectRef<String> ref = store.put("stored");
        SharedInputBroadcaster broadcaster = new SharedInputBroadcaster(store);

        assertThat(broadcaster.materialize("x", SharedInput.ofReference(ref))).isEqualTo("stored");
        assertThat(broadcaster.materialize("y", SharedInput.ofValue("local"))).isEqualTo("local");
    }
}
