package org.ipod.datapipeline.refinement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.ipod.datapipeline.api.refinement.IRefinementRoutine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class RefinementRoutineFactoryTest {

    @Test
    void defaultsToLinearMotionRefinement() {
        IRefinementRoutine routine = RefinementRoutineFactory.create(ConfigFactory.empty());

        assertThat(routine).isInstanceOf(LinearMotionRefinement.class);
    }

    @Test
    void passesOptionsToTheConstructor() {
        assertThatThrownBy(() -> RefinementRoutineFactory.create(ConfigFactory.parseMap(Map.of(
                "className", LinearMotionRefinement.class.getName(),
                "options", Map.of("minObservations", 1)))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("minObservations must be at least 2");
    }

    @Test
    void unknownClassIsRejected() {
        assertThatThrownBy(() -> RefinementRoutineFactory.create(ConfigFactory.parseMap(Map.of(
                "className", "org.ipod.DoesNotExist"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void classThatIsNotARoutineIsRejected() {
        assertThatThrownBy(() -> RefinementRoutineFactory.create(ConfigFactory.parseMap(Map.of(
                "className", "java.lang.String"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not implement IRefinementRoutine");
    }
}
