package org.ipod.datapipeline.api.model;

/**
 * Association of one observation with a refined orbit.
 *
 * @param orbitId      The orbit the observation belongs to.
 * @param obsId        The observation identifier.
 * @param residualChi2 Chi2 of the observation's residual against the fit, {@code null} if not computed.
 * @param solution     Whether the observation was used in the final fit.
 * @param outlier      Whether the observation was flagged as an outlier.
 */
public record FittedOrbitMember(String orbitId, String obsId, Double residualChi2,
                                boolean solution, boolean outlier) {
}
