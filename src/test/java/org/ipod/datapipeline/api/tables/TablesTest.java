package org.ipod.datapipeline.api.tables;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ipod.test.TestFixtures.member;
import static org.ipod.test.TestFixtures.observation;
import static org.ipod.test.TestFixtures.orbit;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.ipod.datapipeline.api.model.Observation;
import org.ipod.datapipeline.api.refinement.OrbitLookupException;
import org.ipod.datapipeline.api.refinement.RefinementException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TablesTest {

    @Test
    void selectReturnsTheSingleMatchingOrbit() {
        FittedOrbitTable table = new FittedOrbitTable(List.of(orbit("a"), orbit("b")));

        assertEquals(orbit("b"), table.select("b"));
        assertThat(table.orbitIds()).containsExactly("a", "b");
    }

    @Test
    void selectFailsForMissingOrDuplicateOrbit() {
        FittedOrbitTable table = new FittedOrbitTable(List.of(orbit("a"), orbit("b"), orbit("b")));

        assertThatThrownBy(() -> table.select("c"))
            .isInstanceOf(OrbitLookupException.class)
            .isInstanceOf(RefinementException.class)
            .hasMessageContaining("found 0");
        assertThatThrownBy(() -> table.select("b"))
            .isInstanceOf(OrbitLookupException.class)
            .hasMessageContaining("found 2");
    }

    @Test
    void memberTableGroupsObservationIdsByOrbit() {
        OrbitMemberTable members = new OrbitMemberTable(List.of(
                member("a", "o1"), member("b", "o2"), member("a", "o3")));

        assertThat(members.obsIdsFor("a")).containsExactly("o1", "o3");
        assertThat(members.obsIdsFor("z")).isEmpty();
    }

    @Test
    void observationSelectKeepsRequestOrderAndSkipsUnknownIds() {
        ObservationTable observations = new ObservationTable(List.of(
                observation("o1", 60000.0, "X05", 1.0, 1.0),
                observation("o2", 60001.0, "X05", 1.1, 1.1)));

        List<Observation> selected = observations.select(List.of("o2", "missing", "o1", "o2"));

        assertThat(selected).extracting(Observation::id).containsExactly("o2", "o1");
    }

    @Test
    void duplicateObservationIdsAreRejected() {
        assertThatThrownBy(() -> new ObservationTable(List.of(
                observation("o1", 60000.0, "X05", 1.0, 1.0),
                observation("o1", 60001.0, "X05", 1.1, 1.1))))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
