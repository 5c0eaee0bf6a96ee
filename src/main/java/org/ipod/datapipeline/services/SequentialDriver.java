package org.ipod.datapipeline.services;

import java.util.List;

import org.ipod.datapipeline.api.tables.FittedOrbitTable;
import org.ipod.datapipeline.api.tables.ObservationTable;
import org.ipod.datapipeline.api.tables.OrbitMemberTable;

/**
 * Runs chunks one after another on the calling thread. Used when no distributed runtime is
 * available. Results and failure behaviour match the {@link BoundedDispatcher}.
 */
public class SequentialDriver {

    private final ChunkWorker worker;
    private final RunStateTracker state;

    private long chunksRun;

    public SequentialDriver(ChunkWorker worker, RunStateTracker state) {
        this.worker = worker;
        this.state = state;
    }

    /**
     * Processes every chunk in order and merges its results.
     *
     * @throws org.ipod.datapipeline.api.refinement.RefinementException at the first failing orbit;
     *         later chunks are not run.
     */
    public void run(List<String> orbitIds, Iterable<Chunk> chunks, FittedOrbitTable orbits,
                    OrbitMemberTable members, ObservationTable observations, StreamingAccumulator accumulator) {
        for (Chunk chunk : chunks) {
            state.transitionTo(RunState.DISPATCHING);
            ChunkOutcome outcome = worker.process(orbitIds, chunk, orbits, members, observations);
            chunksRun++;
            state.transitionTo(RunState.MERGING);
            accumulator.merge(outcome.getOrThrow());
        }
    }

    public long getChunksRun() {
        return chunksRun;
    }
}
