package org.ipod.datapipeline.api.refinement;

import org.ipod.datapipeline.api.index.IPrecoveryIndex;
import org.ipod.datapipeline.api.model.FittedOrbit;
import org.ipod.datapipeline.api.model.OrbitDeterminationObservations;

/**
 * Everything the refinement routine receives for one orbit.
 *
 * @param candidate    The candidate orbit to refine.
 * @param observations Observations currently associated with the orbit, {@code null} when the
 *                     run has no member or no observation table. The routine then relies on
 *                     the precovery index alone.
 * @param index        Open, read-only precovery index handle.
 * @param parameters   Run-wide tolerances, thresholds and filters.
 */
public record RefinementRequest(
        FittedOrbit candidate,
        OrbitDeterminationObservations observations,
        IPrecoveryIndex index,
        RefinementParameters parameters) {

    public boolean hasObservations() {
        return observations != null;
    }
}
