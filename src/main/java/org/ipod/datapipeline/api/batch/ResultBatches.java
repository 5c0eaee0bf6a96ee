package org.ipod.datapipeline.api.batch;

import org.ipod.datapipeline.api.model.FittedOrbit;
import org.ipod.datapipeline.api.model.FittedOrbitMember;
import org.ipod.datapipeline.api.model.PrecoveryCandidate;
import org.ipod.datapipeline.api.model.SearchSummary;

/**
 * The four independently accumulated result collections of a chunk or of a whole run.
 * <p>
 * Rows across the four batches are correlated by orbit identifier, but each batch is its
 * own stream and row order carries no meaning.
 *
 * @param orbits     Refined orbits.
 * @param members    Observations associated with the refined orbits.
 * @param candidates Precovery candidates found for the refined orbits.
 * @param summaries  One search summary per refined orbit.
 */
public record ResultBatches(
        Batch<FittedOrbit> orbits,
        Batch<FittedOrbitMember> members,
        Batch<PrecoveryCandidate> candidates,
        Batch<SearchSummary> summaries) {

    /**
     * @return Four new, empty batches.
     */
    public static ResultBatches empty() {
        return new ResultBatches(Batch.empty(), Batch.empty(), Batch.empty(), Batch.empty());
    }
}
