package org.ipod.datapipeline.services;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.ipod.datapipeline.api.index.IPrecoveryIndex;
import org.ipod.datapipeline.api.index.IPrecoveryIndexFactory;
import org.ipod.datapipeline.api.index.IndexOpenOptions;
import org.ipod.datapipeline.api.model.FittedOrbit;
import org.ipod.datapipeline.api.model.Observation;
import org.ipod.datapipeline.api.model.OrbitDeterminationObservations;
import org.ipod.datapipeline.api.refinement.IRefinementRoutine;
import org.ipod.datapipeline.api.refinement.RefinementOutcome;
import org.ipod.datapipeline.api.refinement.RefinementParameters;
import org.ipod.datapipeline.api.refinement.RefinementRequest;
import org.ipod.datapipeline.api.tables.FittedOrbitTable;
import org.ipod.datapipeline.api.tables.ObservationTable;
import org.ipod.datapipeline.api.tables.OrbitMemberTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refines the orbits of one chunk, one after another, on the calling thread.
 * <p>
 * The worker opens one read-only handle on the precovery index per chunk and closes it on
 * every exit path. The first orbit that fails ends the chunk: no partial results are
 * returned, only a {@link ChunkOutcome.Failure} naming the orbit.
 * <p>
 * <strong>Thread Safety:</strong> Instances hold only immutable configuration and can be
 * shared by all worker threads, provided the refinement routine is thread-safe.
 */
public class ChunkWorker {

    private static final Logger log = LoggerFactory.getLogger(ChunkWorker.class);

    private final IRefinementRoutine routine;
    private final IPrecoveryIndexFactory indexFactory;
    private final Path indexDirectory;
    private final IndexOpenOptions indexOptions;
    private final RefinementParameters parameters;

    /**
     * Creates a worker.
     *
     * @param routine        The refinement routine applied to each orbit.
     * @param indexFactory   Opens precovery index handles.
     * @param indexDirectory Location of the precovery index.
     * @param indexOptions   Open options for the per-chunk handle.
     * @param parameters     Run-wide refinement parameters.
     */
    public ChunkWorker(IRefinementRoutine routine, IPrecoveryIndexFactory indexFactory, Path indexDirectory,
                       IndexOpenOptions indexOptions, RefinementParameters parameters) {
        if (indexOptions.create()) {
            throw new IllegalArgumentException("Chunk workers must not create the precovery index");
        }
        this.routine = routine;
        this.indexFactory = indexFactory;
        this.indexDirectory = indexDirectory;
        this.indexOptions = indexOptions;
        this.parameters = parameters;
    }

    /**
     * Refines every orbit of the chunk in identifier order.
     *
     * @param orbitIds     The full identifier sequence of the run.
     * @param chunk        Range of {@code orbitIds} to process.
     * @param orbits       Candidate orbits.
     * @param members      Orbit memberships, {@code null} if the run has none.
     * @param observations Observations, {@code null} if the run has none.
     * @return The chunk's results, or the first failure. Errors thrown by the routine count as
     *         failures; only {@link VirtualMachineError}s propagate.
     * @throws org.ipod.datapipeline.api.index.IndexOpenException if the index cannot be opened.
     */
    public ChunkOutcome process(List<String> orbitIds, Chunk chunk, FittedOrbitTable orbits,
                                OrbitMemberTable members, ObservationTable observations) {
        if (chunk.end() > orbitIds.size()) {
            throw new IllegalArgumentException(String.format(
                    "Chunk [%d, %d) exceeds %d orbit identifiers", chunk.start(), chunk.end(), orbitIds.size()));
        }
        StreamingAccumulator results = new StreamingAccumulator();

        try (IPrecoveryIndex index = indexFactory.open(indexDirectory, indexOptions)) {
            for (String orbitId : orbitIds.subList(chunk.start(), chunk.end())) {
                try {
                    FittedOrbit candidate = orbits.select(orbitId);
                    OrbitDeterminationObservations odObservations = null;
                    if (members != null && observations != null) {
                        odObservations = observationsFor(orbitId, members, observations);
                    }
                    RefinementOutcome outcome = routine.refine(
                            new RefinementRequest(candidate, odObservations, index, parameters));
                    results.add(outcome);
                } catch (VirtualMachineError e) {
                    throw e;
                } catch (RuntimeException | Error e) {
                    log.error("Error processing orbit {}: {}", orbitId, e.getMessage());
                    log.debug("Refinement failure details for orbit {}", orbitId, e);
                    return new ChunkOutcome.Failure(orbitId, e);
                }
            }
        }

        log.debug("Refined {} orbits in chunk [{}, {})", chunk.size(), chunk.start(), chunk.end());
        return new ChunkOutcome.Success(results.result());
    }

    private OrbitDeterminationObservations observationsFor(String orbitId, OrbitMemberTable members,
                                                           ObservationTable observations) {
        Set<String> excluded = parameters.outliersFor(orbitId);
        List<String> obsIds = members.obsIdsFor(orbitId).stream()
                .filter(obsId -> !excluded.contains(obsId))
                .toList();
        List<Observation> selected = observations.select(obsIds);
        return OrbitDeterminationObservations.fromObservations(selected);
    }
}
