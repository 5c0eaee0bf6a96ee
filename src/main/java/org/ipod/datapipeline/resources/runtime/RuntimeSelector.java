package org.ipod.datapipeline.resources.runtime;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.ipod.datapipeline.api.runtime.IDistributedRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Decides whether a run uses a distributed runtime and starts one if so.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code mode} - {@code auto} (default): start a runtime when more than one worker is
 *       requested; {@code distributed}: always start one; {@code sequential}: never.</li>
 * </ul>
 */
public final class RuntimeSelector {

    private static final Logger log = LoggerFactory.getLogger(RuntimeSelector.class);

    /**
     * Runtime selection modes.
     */
    public enum Mode {
        AUTO,
        DISTRIBUTED,
        SEQUENTIAL
    }

    private RuntimeSelector() {
    }

    /**
     * Resolves the configured worker count.
     *
     * @param maxWorkers Requested workers, or {@code null} for all available processors.
     * @return The worker count, at least 1.
     * @throws IllegalArgumentException if {@code maxWorkers} is smaller than 1.
     */
    public static int resolveWorkers(Integer maxWorkers) {
        if (maxWorkers == null) {
            return Runtime.getRuntime().availableProcessors();
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
        return maxWorkers;
    }

    /**
     * Starts a local runtime if the configured mode asks for one.
     *
     * @param options Runtime options block.
     * @param workers Resolved worker count.
     * @return A started runtime owned by the caller, or empty to run sequentially.
     */
    public static Optional<IDistributedRuntime> initialize(Config options, int workers) {
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of("mode", "auto")));
        Mode mode = parseMode(finalConfig.getString("mode"));

        boolean distributed = switch (mode) {
            case AUTO -> workers > 1;
            case DISTRIBUTED -> true;
            case SEQUENTIAL -> false;
        };
        if (!distributed) {
            log.debug("Runtime mode {} with {} worker(s): running sequentially", mode, workers);
            return Optional.empty();
        }
        log.debug("Runtime mode {}: starting local runtime with {} worker(s)", mode, workers);
        return Optional.of(new LocalThreadPoolRuntime(workers));
    }

    static Mode parseMode(String value) {
        try {
            return Mode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown runtime mode '" + value + "', expected auto, distributed or sequential", e);
        }
    }
}
