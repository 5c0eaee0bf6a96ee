package org.ipod.datapipeline.api.model;

/**
 * A single astrometric observation.
 *
 * @param id             Unique observation identifier.
 * @param datasetId      Dataset the observation comes from, may be {@code null}.
 * @param time           Time of the observation.
 * @param originCode     Observatory code.
 * @param ra             Right ascension (degrees).
 * @param dec            Declination (degrees).
 * @param raSigmaArcsec  RA uncertainty (arcsec), {@code null} if unknown.
 * @param decSigmaArcsec Dec uncertainty (arcsec), {@code null} if unknown.
 */
public record Observation(
        String id,
        String datasetId,
        Timestamp time,
        String originCode,
        double ra,
        double dec,
        Double raSigmaArcsec,
        Double decSigmaArcsec) {

    /**
     * @return The observer that made this observation.
     */
    public Observer observer() {
        return new Observer(originCode, time);
    }
}
