package org.ipod.datapipeline.api.refinement;

/**
 * Default astrometric uncertainty for an observatory, used when an observation carries none.
 *
 * @param raSigmaArcsec  RA uncertainty (arcsec).
 * @param decSigmaArcsec Dec uncertainty (arcsec).
 */
public record AstrometricError(double raSigmaArcsec, double decSigmaArcsec) {

    public AstrometricError {
        if (raSigmaArcsec <= 0 || decSigmaArcsec <= 0) {
            throw new IllegalArgumentException("Astrometric errors must be positive");
        }
    }
}
