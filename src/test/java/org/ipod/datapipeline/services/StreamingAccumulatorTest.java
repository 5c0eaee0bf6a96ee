package org.ipod.datapipeline.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.ipod.test.TestFixtures.candidate;
import static org.ipod.test.TestFixtures.member;
import static org.ipod.test.TestFixtures.orbit;
import static org.ipod.test.TestFixtures.results;
import static org.ipod.test.TestFixtures.summary;

import java.util.ArrayList;
import java.util.List;

import org.ipod.datapipeline.api.batch.ResultBatches;
import org.ipod.datapipeline.api.model.FittedOrbit;
import org.ipod.datapipeline.api.refinement.RefinementOutcome;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class StreamingAccumulatorTest {

    @Test
    void mergeOrderDoesNotChangeTheRowMultiset() {
        // Given: the same three chunks merged in two different orders
        StreamingAccumulator forward = new StreamingAccumulator();
        StreamingAccumulator reverse = new StreamingAccumulator();

        // When
        forward.merge(results("a", "b"));
        forward.merge(results("c"));
        forward.merge(results("d", "e", "f"));

        reverse.merge(results("d", "e", "f"));
        reverse.merge(results("c"));
        reverse.merge(results("a", "b"));

        // Then
        assertThat(forward.result().orbits().toList())
            .containsExactlyInAnyOrderElementsOf(reverse.result().orbits().toList());
        assertThat(forward.result().members().toList())
            .containsExactlyInAnyOrderElementsOf(reverse.result().members().toList());
        assertThat(forward.result().summaries().toList())
            .containsExactlyInAnyOrderElementsOf(reverse.result().summaries().toList());
        assertThat(forward.getMergedChunks()).isEqualTo(3);
    }

    @Test
    void runningTotalsStayCompactUnderManySmallMerges() {
        StreamingAccumulator accumulator = new StreamingAccumulator();

        for (int i = 0; i < 200; i++) {
            accumulator.merge(results("orbit-" + i));
        }

        ResultBatches result = accumulator.result();
        assertThat(result.orbits().size()).isEqualTo(200);
        assertThat(result.orbits().isFragmented()).isFalse();
        assertThat(result.orbits().toList()).first().extracting(FittedOrbit::orbitId).isEqualTo("orbit-0");
        // Head segment doubles on each compaction: 2, 4, ..., 128 for each of three non-empty batches
        assertThat(accumulator.getCompactions()).isEqualTo(21);
    }

    @Test
    void addAppendsAllFourPartsOfAnOutcome() {
        StreamingAccumulator accumulator = new StreamingAccumulator();

        accumulator.add(new RefinementOutcome(orbit("a"),
                List.of(member("a", "obs-1"), member("a", "obs-2")),
                List.of(candidate("a", "obs-2")),
                summary("a")));

        ResultBatches result = accumulator.result();
        assertThat(result.orbits().size()).isEqualTo(1);
        assertThat(result.members().size()).isEqualTo(2);
        assertThat(result.candidates().size()).isEqualTo(1);
        assertThat(result.summaries().size()).isEqualTo(1);
        assertThat(accumulator.getMetrics()).containsEntry("appended_outcomes", 1L);
    }

    @Test
    void mergingEmptyResultsKeepsTotalsEmpty() {
        StreamingAccumulator accumulator = new StreamingAccumulator();

        accumulator.merge(ResultBatches.empty());

        List<FittedOrbit> orbits = new ArrayList<>(accumulator.result().orbits().toList());
        assertThat(orbits).isEmpty();
        assertThat(accumulator.result().candidates().isEmpty()).isTrue();
    }
}
