package org.ipod.datapipeline.api.refinement;

/**
 * Iteratively improves an orbit fit using precovery search results.
 * <p>
 * Implementations are called once per orbit, possibly from several worker threads at the
 * same time, and must therefore be stateless or thread-safe. They must not modify the
 * candidate or the observations they are given.
 */
@FunctionalInterface
public interface IRefinementRoutine {

    /**
     * Refines one candidate orbit.
     *
     * @param request The candidate, its observations, the index handle and the parameters.
     * @return The refined orbit, its members, the precovery candidates and a search summary.
     * @throws RefinementException if the orbit cannot be refined. Any other runtime exception
     *                             is treated the same way by the caller.
     */
    RefinementOutcome refine(RefinementRequest request);
}
