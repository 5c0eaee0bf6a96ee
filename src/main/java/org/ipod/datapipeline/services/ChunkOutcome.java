package org.ipod.datapipeline.services;

import org.ipod.datapipeline.api.batch.ResultBatches;
import org.ipod.datapipeline.api.refinement.RefinementException;

/**
 * Result of one chunk: either the four result batches or the first failure.
 */
public sealed interface ChunkOutcome permits ChunkOutcome.Success, ChunkOutcome.Failure {

    /**
     * @return The results of a successful chunk.
     * @throws RefinementException carrying the failing orbit id if the chunk failed.
     */
    ResultBatches getOrThrow();

    record Success(ResultBatches results) implements ChunkOutcome {

        public Success {
            if (results == null) {
                throw new IllegalArgumentException("results must not be null");
            }
        }

        @Override
        public ResultBatches getOrThrow() {
            return results;
        }
    }

    record Failure(String orbitId, Throwable cause) implements ChunkOutcome {

        @Override
        public ResultBatches getOrThrow() {
            if (cause instanceof RefinementException refinementException
                    && orbitId.equals(refinementException.getOrbitId())) {
                throw refinementException;
            }
            throw new RefinementException(orbitId, "Error processing orbit " + orbitId + ": " + cause.getMessage(), cause);
        }
    }
}
