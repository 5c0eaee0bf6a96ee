package org.ipod.datapipeline.api.model;

/**
 * Summary of the precovery searches performed while refining one orbit.
 *
 * @param orbitId        The refined orbit.
 * @param searchStartMjd Start of the widest search window (MJD), {@code null} if no search ran.
 * @param searchEndMjd   End of the widest search window (MJD), {@code null} if no search ran.
 * @param iterations     Number of search iterations.
 * @param numCandidates  Number of distinct candidates found.
 * @param numAccepted    Number of candidates accepted into the orbit.
 * @param finalTolerance Tolerance (arcsec) of the last iteration, {@code null} if no search ran.
 * @param converged      Whether the fit reached the reduced chi2 threshold.
 */
public record SearchSummary(
        String orbitId,
        Double searchStartMjd,
        Double searchEndMjd,
        int iterations,
        int numCandidates,
        int numAccepted,
        Double finalTolerance,
        boolean converged) {

    /**
     * @return A summary for an orbit for which no search was performed.
     */
    public static SearchSummary notSearched(String orbitId) {
        return new SearchSummary(orbitId, null, null, 0, 0, 0, null, false);
    }
}
