package org.ipod.datapipeline.refinement;

import java.util.List;
import java.util.function.ToDoubleFunction;

import org.ipod.datapipeline.api.model.Observation;

/**
 * Weighted least-squares fit of linear sky motion: RA and Dec as straight lines in time
 * around the weighted mean epoch of the observations.
 * <p>
 * RA values are unwrapped around the first observation so that arcs crossing 0/360 degrees
 * fit correctly.
 *
 * @param epochMjd Reference time of the fit.
 * @param ra       RA at the reference time (degrees, unwrapped).
 * @param raRate   RA rate (degrees/day).
 * @param dec      Dec at the reference time (degrees).
 * @param decRate  Dec rate (degrees/day).
 */
record LinearMotionFit(double epochMjd, double ra, double raRate, double dec, double decRate) {

    private static final double ARCSEC_PER_DEGREE = 3600.0;
    private static final double MIN_COS_DEC = 1e-6;

    /**
     * Fits the given observations.
     *
     * @param observations At least one observation.
     * @param raSigma      RA uncertainty per observation (arcsec).
     * @param decSigma     Dec uncertainty per observation (arcsec).
     * @return The fit. With a single epoch the rates are zero.
     */
    static LinearMotionFit fit(List<Observation> observations, ToDoubleFunction<Observation> raSigma,
                               ToDoubleFunction<Observation> decSigma) {
        if (observations.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit zero observations");
        }
        double refRa = observations.get(0).ra();

        double[] raLine = weightedLine(observations, o -> refRa + wrap180(o.ra() - refRa),
                o -> Math.max(MIN_COS_DEC, Math.cos(Math.toRadians(o.dec()))) / raSigma.applyAsDouble(o));
        double[] decLine = weightedLine(observations, Observation::dec, o -> 1.0 / decSigma.applyAsDouble(o));

        // Both lines share the epoch of the Dec weights so predictions use one reference time
        double epoch = decLine[2];
        double raAtEpoch = raLine[0] + raLine[1] * (epoch - raLine[2]);
        return new LinearMotionFit(epoch, raAtEpoch, raLine[1], decLine[0], decLine[1]);
    }

    /**
     * @param mjd Time to predict.
     * @return {@code {ra, dec}} in degrees, RA normalized to [0, 360).
     */
    double[] predict(double mjd) {
        double dt = mjd - epochMjd;
        double predictedRa = normalize360(ra + raRate * dt);
        double predictedDec = Math.max(-90.0, Math.min(90.0, dec + decRate * dt));
        return new double[] {predictedRa, predictedDec};
    }

    /**
     * Residual chi2 of one observation against this fit.
     */
    double residualChi2(Observation observation, double raSigmaArcsec, double decSigmaArcsec) {
        double[] predicted = predict(observation.time().mjd());
        double dRa = wrap180(observation.ra() - predicted[0]) * Math.cos(Math.toRadians(observation.dec()))
                * ARCSEC_PER_DEGREE;
        double dDec = (observation.dec() - predicted[1]) * ARCSEC_PER_DEGREE;
        return (dRa / raSigmaArcsec) * (dRa / raSigmaArcsec) + (dDec / decSigmaArcsec) * (dDec / decSigmaArcsec);
    }

    /**
     * Great-circle distance between two positions in arcseconds.
     */
    static double separationArcsec(double ra1, double dec1, double ra2, double dec2) {
        double phi1 = Math.toRadians(dec1);
        double phi2 = Math.toRadians(dec2);
        double dPhi = phi2 - phi1;
        double dLambda = Math.toRadians(ra2 - ra1);
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        return Math.toDegrees(2 * Math.asin(Math.min(1.0, Math.sqrt(a)))) * ARCSEC_PER_DEGREE;
    }

    static double wrap180(double degrees) {
        return ((degrees + 180.0) % 360.0 + 360.0) % 360.0 - 180.0;
    }

    static double normalize360(double degrees) {
        return ((degrees % 360.0) + 360.0) % 360.0;
    }

    /**
     * Fits {@code value = intercept + slope * (t - epoch)}.
     *
     * @return {@code {intercept, slope, epoch}}
     */
    private static double[] weightedLine(List<Observation> observations, ToDoubleFunction<Observation> value,
                                         ToDoubleFunction<Observation> inverseSigma) {
        double sumW = 0;
        double sumWt = 0;
        double sumWv = 0;
        for (Observation o : observations) {
            double w = square(inverseSigma.applyAsDouble(o));
            sumW += w;
            sumWt += w * o.time().mjd();
            sumWv += w * value.applyAsDouble(o);
        }
        double epoch = sumWt / sumW;
        double mean = sumWv / sumW;

        double sxx = 0;
        double sxy = 0;
        for (Observation o : observations) {
            double w = square(inverseSigma.applyAsDouble(o));
            double dt = o.time().mjd() - epoch;
            sxx += w * dt * dt;
            sxy += w * dt * (value.applyAsDouble(o) - mean);
        }
        double slope = sxx > 0 ? sxy / sxx : 0.0;
        return new double[] {mean, slope, epoch};
    }

    private static double square(double x) {
        return x * x;
    }
}
