package org.ipod.datapipeline.services;

import org.ipod.datapipeline.api.runtime.SharedInput;
import org.ipod.datapipeline.api.tables.FittedOrbitTable;
import org.ipod.datapipeline.api.tables.ObservationTable;
import org.ipod.datapipeline.api.tables.OrbitMemberTable;

/**
 * Inputs of one orchestration run. Each may be a local value or a reference already placed in
 * the runtime's object store.
 *
 * @param orbits       Candidate orbits.
 * @param members      Orbit memberships, {@code null} if unavailable.
 * @param observations Observations, {@code null} if unavailable.
 */
public record RefinementInputs(
        SharedInput<FittedOrbitTable> orbits,
        SharedInput<OrbitMemberTable> members,
        SharedInput<ObservationTable> observations) {

    public RefinementInputs {
        if (orbits == null) {
            throw new IllegalArgumentException("orbits must not be null");
        }
    }

    /**
     * Wraps local tables.
     *
     * @param orbits       Candidate orbits.
     * @param members      Orbit memberships, may be {@code null}.
     * @param observations Observations, may be {@code null}.
     * @return The inputs.
     */
    public static RefinementInputs of(FittedOrbitTable orbits, OrbitMemberTable members,
                                      ObservationTable observations) {
        return new RefinementInputs(
                SharedInput.ofValue(orbits),
                members != null ? SharedInput.ofValue(members) : null,
                observations != null ? SharedInput.ofValue(observations) : null);
    }
}
