package org.ipod.datapipeline.api.refinement;

/**
 * Thrown when an orbit identifier does not match exactly one row of the candidate orbit table.
 */
public class OrbitLookupException extends RefinementException {

    public OrbitLookupException(String orbitId, String message) {
        super(orbitId, message, null);
    }
}
