package org.ipod.datapipeline.refinement;

import java.util.Map;

import org.ipod.datapipeline.api.refinement.IRefinementRoutine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Instantiates the configured refinement routine.
 * <p>
 * The routine block names a {@code className} implementing {@link IRefinementRoutine} with a
 * public constructor taking a {@link Config}, and an optional {@code options} block passed to
 * that constructor:
 * <pre>
 * routine {
 *   className = "org.ipod.datapipeline.refinement.LinearMotionRefinement"
 *   options { minObservations = 2 }
 * }
 * </pre>
 */
public final class RefinementRoutineFactory {

    private static final Logger log = LoggerFactory.getLogger(RefinementRoutineFactory.class);

    private RefinementRoutineFactory() {
    }

    /**
     * @param routineConfig The routine block.
     * @return A new routine instance.
     * @throws IllegalArgumentException if the class cannot be found, does not implement
     *                                  {@link IRefinementRoutine} or fails to construct.
     */
    public static IRefinementRoutine create(Config routineConfig) {
        Config finalConfig = routineConfig.withFallback(ConfigFactory.parseMap(Map.of(
                "className", LinearMotionRefinement.class.getName()
        )));
        String className = finalConfig.getString("className");
        Config options = finalConfig.hasPath("options") ? finalConfig.getConfig("options") : ConfigFactory.empty();

        try {
            Class<?> type = Class.forName(className);
            if (!IRefinementRoutine.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IRefinementRoutine");
            }
            IRefinementRoutine routine = (IRefinementRoutine) type.getConstructor(Config.class).newInstance(options);
            log.debug("Instantiated refinement routine {}", className);
            return routine;
        } catch (ClassNotFoundException e) {
            log.error("Refinement routine class not found: {}", className);
            throw new IllegalArgumentException("Refinement routine class not found: " + className, e);
        } catch (ReflectiveOperationException e) {
            // Extract root cause for clear error message (no stack trace)
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String errorMsg = String.format("Failed to instantiate refinement routine %s: %s",
                    className, cause.getMessage());
            log.error(errorMsg);
            throw new IllegalArgumentException(errorMsg, e);
        }
    }
}
