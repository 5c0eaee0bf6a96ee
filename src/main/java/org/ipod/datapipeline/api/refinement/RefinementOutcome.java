package org.ipod.datapipeline.api.refinement;

import java.util.List;

import org.ipod.datapipeline.api.model.FittedOrbit;
import org.ipod.datapipeline.api.model.FittedOrbitMember;
import org.ipod.datapipeline.api.model.PrecoveryCandidate;
import org.ipod.datapipeline.api.model.SearchSummary;

/**
 * The four pieces the refinement routine produces for one orbit.
 *
 * @param orbit      The refined orbit.
 * @param members    Observations associated with the refined orbit.
 * @param candidates Precovery candidates found while searching.
 * @param summary    Summary of the searches performed.
 */
public record RefinementOutcome(
        FittedOrbit orbit,
        List<FittedOrbitMember> members,
        List<PrecoveryCandidate> candidates,
        SearchSummary summary) {

    public RefinementOutcome {
        if (orbit == null || summary == null) {
            throw new IllegalArgumentException("orbit and summary must not be null");
        }
        members = List.copyOf(members);
        candidates = List.copyOf(candidates);
    }
}
