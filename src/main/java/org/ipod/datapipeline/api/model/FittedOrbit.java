package org.ipod.datapipeline.api.model;

/**
 * A candidate or refined orbit.
 * <p>
 * The same shape is used for the candidate orbit table handed to a run and for the refined
 * orbits the run produces. Rows are keyed by {@code orbitId}.
 *
 * @param orbitId     Unique identifier of the orbit within a run.
 * @param objectId    Designation of the object this orbit belongs to, may be {@code null}.
 * @param epoch       Epoch of the Cartesian state.
 * @param x           Heliocentric position x (AU).
 * @param y           Heliocentric position y (AU).
 * @param z           Heliocentric position z (AU).
 * @param vx          Velocity x (AU/day).
 * @param vy          Velocity y (AU/day).
 * @param vz          Velocity z (AU/day).
 * @param arcLength   Time span covered by the fitted observations (days).
 * @param numObs      Number of observations used in the fit.
 * @param chi2        Total chi2 of the fit.
 * @param reducedChi2 Reduced chi2 of the fit.
 * @param iterations  Number of refinement iterations performed.
 * @param success     Whether the last fit succeeded.
 * @param statusCode  Routine specific status code, 0 for success.
 */
public record FittedOrbit(
        String orbitId,
        String objectId,
        Timestamp epoch,
        double x,
        double y,
        double z,
        double vx,
        double vy,
        double vz,
        double arcLength,
        int numObs,
        double chi2,
        double reducedChi2,
        int iterations,
        boolean success,
        int statusCode) {

    public FittedOrbit {
        if (orbitId == null) {
            throw new IllegalArgumentException("orbitId must not be null");
        }
    }

    /**
     * Returns a copy of this orbit carrying new fit statistics. The Cartesian state is kept.
     */
    public FittedOrbit withFit(double arcLength, int numObs, double chi2, double reducedChi2,
                               int iterations, boolean success, int statusCode) {
        return new FittedOrbit(orbitId, objectId, epoch, x, y, z, vx, vy, vz,
                arcLength, numObs, chi2, reducedChi2, iterations, success, statusCode);
    }
}
