package org.ipod.datapipeline.services;

import java.util.List;
import java.util.concurrent.Callable;

import org.ipod.datapipeline.api.runtime.IObjectStore;
import org.ipod.datapipeline.api.runtime.ObjectRef;
import org.ipod.datapipeline.api.tables.FittedOrbitTable;
import org.ipod.datapipeline.api.tables.ObservationTable;
import org.ipod.datapipeline.api.tables.OrbitMemberTable;

/**
 * A chunk submitted to a distributed runtime.
 * <p>
 * The task carries only references. It resolves them through the runtime's object store on
 * the worker thread and hands the values to {@link ChunkWorker}.
 */
public final class ChunkTask implements Callable<ChunkOutcome> {

    private final ChunkWorker worker;
    private final IObjectStore store;
    private final ObjectRef<List<String>> orbitIds;
    private final Chunk chunk;
    private final ObjectRef<FittedOrbitTable> orbits;
    private final ObjectRef<OrbitMemberTable> members;
    private final ObjectRef<ObservationTable> observations;

    /**
     * Creates a task.
     *
     * @param worker       Worker logic to run.
     * @param store        Store holding the referenced inputs.
     * @param orbitIds     Reference to the full identifier sequence.
     * @param chunk        Range of identifiers to process.
     * @param orbits       Reference to the orbit table.
     * @param members      Reference to the member table, or {@code null}.
     * @param observations Reference to the observation table, or {@code null}.
     */
    public ChunkTask(ChunkWorker worker, IObjectStore store, ObjectRef<List<String>> orbitIds, Chunk chunk,
                     ObjectRef<FittedOrbitTable> orbits, ObjectRef<OrbitMemberTable> members,
                     ObjectRef<ObservationTable> observations) {
        this.worker = worker;
        this.store = store;
        this.orbitIds = orbitIds;
        this.chunk = chunk;
        this.orbits = orbits;
        this.members = members;
        this.observations = observations;
    }

    public Chunk getChunk() {
        return chunk;
    }

    @Override
    public ChunkOutcome call() {
        return worker.process(
                store.get(orbitIds),
                chunk,
                store.get(orbits),
                members != null ? store.get(members) : null,
                observations != null ? store.get(observations) : null);
    }
}
