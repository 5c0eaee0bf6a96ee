package org.ipod.datapipeline.api.model;

/**
 * An indexed observation found near the predicted position of an orbit.
 *
 * @param orbitId        The orbit whose prediction produced the match.
 * @param obsId          The matched observation.
 * @param datasetId      Dataset of the matched observation.
 * @param time           Time of the matched observation.
 * @param originCode     Observatory code of the matched observation.
 * @param ra             Observed right ascension (degrees).
 * @param dec            Observed declination (degrees).
 * @param raSigmaArcsec  RA uncertainty (arcsec), may be {@code null}.
 * @param decSigmaArcsec Dec uncertainty (arcsec), may be {@code null}.
 * @param predictedRa    Predicted right ascension at the observation time (degrees).
 * @param predictedDec   Predicted declination at the observation time (degrees).
 * @param distanceArcsec Angular distance between observed and predicted positions (arcsec).
 */
public record PrecoveryCandidate(
        String orbitId,
        String obsId,
        String datasetId,
        Timestamp time,
        String originCode,
        double ra,
        double dec,
        Double raSigmaArcsec,
        Double decSigmaArcsec,
        double predictedRa,
        double predictedDec,
        double distanceArcsec) {
}
