package org.ipod.datapipeline.services;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.ipod.datapipeline.api.batch.ResultBatches;
import org.ipod.datapipeline.api.runtime.IDistributedRuntime;
import org.ipod.datapipeline.api.runtime.IObjectStore;
import org.ipod.datapipeline.api.runtime.ObjectRef;
import org.ipod.datapipeline.api.runtime.SharedInput;
import org.ipod.datapipeline.api.tables.FittedOrbitTable;
import org.ipod.datapipeline.api.tables.ObservationTable;
import org.ipod.datapipeline.api.tables.OrbitMemberTable;
import org.ipod.datapipeline.resources.runtime.RuntimeSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueType;

/**
 * Entry point of a refinement run: refines every candidate orbit and returns the four
 * result batches.
 * <p>
 * With a distributed runtime the inputs are placed in its object store once, the orbit
 * identifiers are split into chunks and the chunks are dispatched with bounded concurrency.
 * Without one the same chunks run sequentially on the calling thread. Both paths produce
 * the same rows.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code chunkSize} - nominal number of orbits per chunk (default 10)</li>
 *   <li>{@code maxWorkers} - number of workers, or {@code "all"} / {@code null} for every
 *       available processor (default 1)</li>
 *   <li>{@code runtime} - options for {@link RuntimeSelector} when no runtime is supplied</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> One run at a time per instance.
 */
public class RefinementOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RefinementOrchestrator.class);

    private final ChunkWorker worker;
    private final IDistributedRuntime suppliedRuntime;
    private final int chunkSize;
    private final Integer maxWorkers;
    private final Config runtimeOptions;
    private final RunStateTracker state = new RunStateTracker();

    private final AtomicLong runsCompleted = new AtomicLong();
    private final AtomicLong runsAborted = new AtomicLong();
    private final AtomicLong chunksMerged = new AtomicLong();
    private final AtomicLong compactions = new AtomicLong();
    private volatile int lastHighWaterMark;
    private volatile double lastRunSeconds;

    /**
     * Creates an orchestrator that starts its own runtime when the options ask for one.
     */
    public RefinementOrchestrator(ChunkWorker worker, Config options) {
        this(worker, options, null);
    }

    /**
     * Creates an orchestrator.
     *
     * @param worker  Per-chunk worker logic.
     * @param options Orchestration options.
     * @param runtime A runtime owned by the caller, or {@code null} to let {@link RuntimeSelector}
     *                decide per run.
     * @throws IllegalArgumentException if the options are invalid.
     */
    public RefinementOrchestrator(ChunkWorker worker, Config options, IDistributedRuntime runtime) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "chunkSize", 10,
                "maxWorkers", 1,
                "runtime", Map.of("mode", "auto")
        ));
        Config finalConfig = options.withFallback(defaults);

        try {
            this.chunkSize = finalConfig.getInt("chunkSize");
            this.maxWorkers = readMaxWorkers(finalConfig);
            this.runtimeOptions = finalConfig.getConfig("runtime");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid orchestration configuration", e);
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1, got " + chunkSize);
        }
        RuntimeSelector.resolveWorkers(maxWorkers);
        this.worker = worker;
        this.suppliedRuntime = runtime;
    }

    /**
     * Refines every candidate orbit of the inputs.
     *
     * @param inputs Orbits and optional members and observations.
     * @return The refined orbits, members, precovery candidates and search summaries.
     * @throws org.ipod.datapipeline.api.refinement.RefinementException if any orbit fails; the
     *         whole run is aborted.
     * @throws InterruptedException if interrupted while waiting for chunk results.
     */
    public ResultBatches run(RefinementInputs inputs) throws InterruptedException {
        state.beginRun();
        long startNanos = System.nanoTime();
        SharedInputBroadcaster callerInputs = new SharedInputBroadcaster(
                suppliedRuntime != null ? suppliedRuntime.objectStore() : null);

        FittedOrbitTable orbits = callerInputs.materialize("orbits", inputs.orbits());
        if (orbits.isEmpty()) {
            log.info("Received no orbits or orbit members.");
            state.transitionTo(RunState.DONE);
            return ResultBatches.empty();
        }

        int workers = RuntimeSelector.resolveWorkers(maxWorkers);
        IDistributedRuntime runtime = suppliedRuntime;
        boolean ownsRuntime = false;
        if (runtime == null) {
            runtime = RuntimeSelector.initialize(runtimeOptions, workers).orElse(null);
            ownsRuntime = runtime != null;
        }

        StreamingAccumulator accumulator = new StreamingAccumulator();
        try {
            state.transitionTo(RunState.PLANNING);
            if (runtime != null) {
                runDistributed(runtime, workers, orbits, inputs, accumulator);
            } else {
                runSequential(orbits, inputs, callerInputs, accumulator);
            }
            state.transitionTo(RunState.DONE);
        } catch (Throwable e) {
            state.abort();
            runsAborted.incrementAndGet();
            log.warn("Refinement run aborted after {} merged chunks: {}", accumulator.getMergedChunks(), e.getMessage());
            throw e;
        } finally {
            chunksMerged.addAndGet(accumulator.getMergedChunks());
            compactions.addAndGet(accumulator.getCompactions());
            if (ownsRuntime) {
                runtime.close();
            }
        }

        ResultBatches result = accumulator.result();
        lastRunSeconds = (System.nanoTime() - startNanos) / 1e9;
        runsCompleted.incrementAndGet();
        log.info("Refined {} orbits in {} seconds.", result.orbits().size(),
                String.format(Locale.ROOT, "%.3f", lastRunSeconds));
        return result;
    }

    private void runDistributed(IDistributedRuntime runtime, int workers, FittedOrbitTable orbits,
                                RefinementInputs inputs, StreamingAccumulator accumulator) throws InterruptedException {
        IObjectStore store = runtime.objectStore();
        SharedInputBroadcaster broadcaster = new SharedInputBroadcaster(store);
        try {
            ObjectRef<List<String>> orbitIdsRef = broadcaster.broadcast("orbit IDs", SharedInput.ofValue(orbits.orbitIds()));
            ObjectRef<FittedOrbitTable> orbitsRef = broadcaster.broadcast("orbits", inputs.orbits());
            ObjectRef<OrbitMemberTable> membersRef = inputs.members() != null
                    ? broadcaster.broadcast("orbit members", inputs.members())
                    : null;
            ObjectRef<ObservationTable> observationsRef = inputs.observations() != null
                    ? broadcaster.broadcast("observations", inputs.observations())
                    : null;

            int n = orbits.size();
            int effectiveChunkSize = ChunkPlanner.effectiveChunkSize(n, workers, chunkSize);
            log.info("Distributing orbits in chunks of {} to {} workers.", effectiveChunkSize, workers);

            BoundedDispatcher dispatcher = new BoundedDispatcher(runtime, workers, state);
            try {
                dispatcher.dispatch(
                        ChunkPlanner.ranges(n, effectiveChunkSize),
                        chunk -> new ChunkTask(worker, store, orbitIdsRef, chunk, orbitsRef, membersRef, observationsRef),
                        accumulator);
            } finally {
                lastHighWaterMark = dispatcher.getHighWaterMark();
            }
        } finally {
            broadcaster.release();
        }
    }

    private void runSequential(FittedOrbitTable orbits, RefinementInputs inputs,
                               SharedInputBroadcaster callerInputs, StreamingAccumulator accumulator) {
        OrbitMemberTable members = inputs.members() != null
                ? callerInputs.materialize("orbit members", inputs.members())
                : null;
        ObservationTable observations = inputs.observations() != null
                ? callerInputs.materialize("observations", inputs.observations())
                : null;

        SequentialDriver driver = new SequentialDriver(worker, state);
        driver.run(orbits.orbitIds(), ChunkPlanner.ranges(orbits.size(), chunkSize), orbits, members, observations,
                accumulator);
    }

    private static Integer readMaxWorkers(Config config) {
        if (config.getIsNull("maxWorkers")) {
            return null;
        }
        if (config.getValue("maxWorkers").valueType() == ConfigValueType.STRING) {
            String value = config.getString("maxWorkers");
            if ("all".equalsIgnoreCase(value.trim())) {
                return null;
            }
        }
        return config.getInt("maxWorkers");
    }

    public RunState getState() {
        return state.getState();
    }

    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("runs_completed", runsCompleted.get());
        metrics.put("runs_aborted", runsAborted.get());
        metrics.put("chunks_merged", chunksMerged.get());
        metrics.put("compactions", compactions.get());
        metrics.put("in_flight_high_water_mark", lastHighWaterMark);
        metrics.put("last_run_seconds", lastRunSeconds);
        return metrics;
    }
}
