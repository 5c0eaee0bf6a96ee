package org.ipod.datapipeline.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.function.Function;

import org.ipod.datapipeline.api.runtime.IDistributedRuntime;
import org.ipod.datapipeline.api.runtime.WaitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits chunk tasks to a runtime while keeping at most {@code ceil(1.5 * workers)} of them
 * outstanding, and merges results in completion order.
 * <p>
 * The slack over the worker count keeps workers busy while the dispatching thread merges.
 * The first failed chunk ends dispatching. Outstanding tasks that have not started yet are
 * cancelled so they never read inputs the caller frees after the abort; tasks already running
 * are not interrupted and their results are discarded.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe; one dispatcher serves one run.
 */
public class BoundedDispatcher {

    private static final Logger log = LoggerFactory.getLogger(BoundedDispatcher.class);

    private final IDistributedRuntime runtime;
    private final int maxInFlight;
    private final RunStateTracker state;

    private long submitted;
    private long merged;
    private int highWaterMark;

    /**
     * Creates a dispatcher.
     *
     * @param runtime Runtime executing the tasks.
     * @param workers Number of workers the run is spread over, at least 1.
     * @param state   State tracker of the run.
     */
    public BoundedDispatcher(IDistributedRuntime runtime, int workers, RunStateTracker state) {
        this.runtime = runtime;
        this.maxInFlight = maxInFlight(workers);
        this.state = state;
    }

    /**
     * @param workers Number of workers, at least 1.
     * @return {@code ceil(1.5 * workers)}.
     */
    public static int maxInFlight(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, got " + workers);
        }
        return (int) Math.ceil(1.5 * workers);
    }

    /**
     * Submits one task per chunk in chunk order and merges every result.
     *
     * @param chunks      Planned chunks.
     * @param taskFactory Creates the task for a chunk.
     * @param accumulator Receives the results.
     * @throws org.ipod.datapipeline.api.refinement.RefinementException if a chunk fails.
     * @throws InterruptedException if interrupted while waiting for results.
     */
    public void dispatch(Iterable<Chunk> chunks, Function<Chunk, ? extends Callable<ChunkOutcome>> taskFactory,
                         StreamingAccumulator accumulator) throws InterruptedException {
        List<Future<ChunkOutcome>> outstanding = new ArrayList<>();
        try {
            for (Chunk chunk : chunks) {
                if (outstanding.size() >= maxInFlight) {
                    outstanding = mergeNext(outstanding, accumulator);
                }
                state.transitionTo(RunState.DISPATCHING);
                outstanding.add(runtime.submit(taskFactory.apply(chunk)));
                submitted++;
                highWaterMark = Math.max(highWaterMark, outstanding.size());
            }
            while (!outstanding.isEmpty()) {
                outstanding = mergeNext(outstanding, accumulator);
            }
        } catch (InterruptedException e) {
            log.debug("Interrupted while waiting for chunk results, {} tasks left outstanding", outstanding.size());
            cancelPending(outstanding);
            throw e;
        } catch (RuntimeException e) {
            cancelPending(outstanding);
            throw e;
        }
    }

    /**
     * Cancels tasks that have not started. Running tasks are left to finish.
     */
    private void cancelPending(List<Future<ChunkOutcome>> outstanding) {
        int cancelled = 0;
        for (Future<ChunkOutcome> future : outstanding) {
            if (future.cancel(false)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.debug("Cancelled {} outstanding chunk tasks after dispatching stopped", cancelled);
        }
    }

    private List<Future<ChunkOutcome>> mergeNext(List<Future<ChunkOutcome>> outstanding,
                                                 StreamingAccumulator accumulator) throws InterruptedException {
        WaitResult<ChunkOutcome> wait = runtime.waitFor(outstanding, 1);
        for (Future<ChunkOutcome> ready : wait.ready()) {
            ChunkOutcome outcome = runtime.get(ready);
            state.transitionTo(RunState.MERGING);
            accumulator.merge(outcome.getOrThrow());
            merged++;
        }
        return new ArrayList<>(wait.remaining());
    }

    public int getMaxInFlight() {
        return maxInFlight;
    }

    public int getHighWaterMark() {
        return highWaterMark;
    }

    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("chunks_submitted", submitted);
        metrics.put("chunks_merged", merged);
        metrics.put("max_in_flight", maxInFlight);
        metrics.put("in_flight_high_water_mark", highWaterMark);
        return metrics;
    }
}
