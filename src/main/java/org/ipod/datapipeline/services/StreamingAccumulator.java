package org.ipod.datapipeline.services;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.ipod.datapipeline.api.batch.Batch;
import org.ipod.datapipeline.api.batch.ResultBatches;
import org.ipod.datapipeline.api.model.FittedOrbit;
import org.ipod.datapipeline.api.model.FittedOrbitMember;
import org.ipod.datapipeline.api.model.PrecoveryCandidate;
import org.ipod.datapipeline.api.model.SearchSummary;
import org.ipod.datapipeline.api.refinement.RefinementOutcome;

/**
 * Running totals of the four result collections.
 * <p>
 * Results are appended without copying and each running batch is compacted as soon as it
 * reports fragmentation, so the total copy work stays linear in the number of rows.
 * <p>
 * <strong>Thread Safety:</strong> This class is <strong>NOT thread-safe</strong>. Each
 * instance is owned by the thread that merges into it: a chunk worker thread for a chunk's
 * own results, or the dispatching thread for the run totals.
 */
public class StreamingAccumulator {

    private final Batch<FittedOrbit> orbits = Batch.empty();
    private final Batch<FittedOrbitMember> members = Batch.empty();
    private final Batch<PrecoveryCandidate> candidates = Batch.empty();
    private final Batch<SearchSummary> summaries = Batch.empty();

    private long mergedChunks;
    private long appendedOutcomes;
    private long compactions;

    /**
     * Appends the results of one refined orbit.
     *
     * @param outcome Outcome returned by the refinement routine.
     */
    public void add(RefinementOutcome outcome) {
        append(orbits, List.of(outcome.orbit()));
        append(members, outcome.members());
        append(candidates, outcome.candidates());
        append(summaries, List.of(outcome.summary()));
        appendedOutcomes++;
    }

    /**
     * Concatenates the results of one chunk, one collection at a time.
     *
     * @param chunk Results of a completed chunk.
     */
    public void merge(ResultBatches chunk) {
        concat(orbits, chunk.orbits());
        concat(members, chunk.members());
        concat(candidates, chunk.candidates());
        concat(summaries, chunk.summaries());
        mergedChunks++;
    }

    /**
     * @return The current running totals. The returned batches are live views owned by this
     *         accumulator.
     */
    public ResultBatches result() {
        return new ResultBatches(orbits, members, candidates, summaries);
    }

    public long getMergedChunks() {
        return mergedChunks;
    }

    public long getCompactions() {
        return compactions;
    }

    public Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("merged_chunks", mergedChunks);
        metrics.put("appended_outcomes", appendedOutcomes);
        metrics.put("compactions", compactions);
        metrics.put("orbits", orbits.size());
        metrics.put("members", members.size());
        metrics.put("candidates", candidates.size());
        metrics.put("summaries", summaries.size());
        return metrics;
    }

    private <T> void append(Batch<T> running, Collection<? extends T> rows) {
        running.appendAll(rows);
        compactIfFragmented(running);
    }

    private <T> void concat(Batch<T> running, Batch<? extends T> incoming) {
        running.concat(incoming);
        compactIfFragmented(running);
    }

    private void compactIfFragmented(Batch<?> running) {
        if (running.isFragmented()) {
            running.compact();
            compactions++;
        }
    }
}
