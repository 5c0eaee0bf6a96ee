package org.ipod.datapipeline.api.refinement;

/**
 * Thrown when refining an orbit fails or when a chunk task cannot be completed.
 * <p>
 * A refinement failure is fatal for the whole run: the chunk it occurred in yields no
 * result and the orchestrator aborts. The offending orbit identifier is carried when known
 * so that callers can report it.
 * <p>
 * This is a RuntimeException because no component of the orchestration core recovers from
 * it; it always propagates to the top-level caller.
 */
public class RefinementException extends RuntimeException {

    private final String orbitId;

    /**
     * Creates a RefinementException without an associated orbit.
     *
     * @param message Description of the failure
     */
    public RefinementException(String message) {
        this(null, message, null);
    }

    /**
     * Creates a RefinementException without an associated orbit.
     *
     * @param message Description of the failure
     * @param cause   The underlying exception
     */
    public RefinementException(String message, Throwable cause) {
        this(null, message, cause);
    }

    /**
     * Creates a RefinementException for a specific orbit.
     *
     * @param orbitId The orbit being processed when the failure occurred, may be {@code null}
     * @param message Description of the failure
     * @param cause   The underlying exception, may be {@code null}
     */
    public RefinementException(String orbitId, String message, Throwable cause) {
        super(message, cause);
        this.orbitId = orbitId;
    }

    /**
     * @return The orbit being processed when the failure occurred, or {@code null} if unknown.
     */
    public String getOrbitId() {
        return orbitId;
    }
}
