package org.ipod.datapipeline.refinement;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.ipod.datapipeline.api.index.IPrecoveryIndex;
import org.ipod.datapipeline.api.model.FittedOrbit;
import org.ipod.datapipeline.api.model.FittedOrbitMember;
import org.ipod.datapipeline.api.model.Observation;
import org.ipod.datapipeline.api.model.PrecoveryCandidate;
import org.ipod.datapipeline.api.model.SearchSummary;
import org.ipod.datapipeline.api.refinement.AstrometricError;
import org.ipod.datapipeline.api.refinement.IRefinementRoutine;
import org.ipod.datapipeline.api.refinement.RefinementOutcome;
import org.ipod.datapipeline.api.refinement.RefinementParameters;
import org.ipod.datapipeline.api.refinement.RefinementRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Refinement routine that models an orbit's sky track as linear motion in RA and Dec.
 * <p>
 * Starting from the orbit's own observations, each iteration widens the search window by
 * {@code deltaTime} on both sides of the current arc, queries the precovery index, accepts
 * detections within the current tolerance of the predicted track and refits. Residuals are
 * then screened: observations above {@code outlierChi2} are flagged, flagged observations
 * below {@code reconsiderChi2} are re-admitted. The search stops once the reduced chi2 is at
 * or below {@code rchi2Threshold}, otherwise the tolerance grows by {@code toleranceStep}
 * up to {@code maxTolerance}.
 * <p>
 * The Cartesian state of the orbit is passed through unchanged; only the fit statistics are
 * updated.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code minObservations} - observations needed before a fit is attempted (default 2)</li>
 *   <li>{@code defaultSigmaArcsec} - uncertainty used when neither the observation nor the
 *       astrometric error table provides one (default 1.0)</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> Stateless after construction and safe to share between
 * worker threads.
 */
public class LinearMotionRefinement implements IRefinementRoutine {

    private static final Logger log = LoggerFactory.getLogger(LinearMotionRefinement.class);

    static final int STATUS_CONVERGED = 0;
    static final int STATUS_NOT_CONVERGED = 1;
    static final int STATUS_TOO_FEW_OBSERVATIONS = 2;

    private static final double EPSILON = 1e-9;

    private final int minObservations;
    private final double defaultSigmaArcsec;

    public LinearMotionRefinement() {
        this(ConfigFactory.empty());
    }

    public LinearMotionRefinement(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "minObservations", 2,
                "defaultSigmaArcsec", 1.0
        ));
        Config finalConfig = options.withFallback(defaults);
        try {
            this.minObservations = finalConfig.getInt("minObservations");
            this.defaultSigmaArcsec = finalConfig.getDouble("defaultSigmaArcsec");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid LinearMotionRefinement configuration", e);
        }
        if (minObservations < 2) {
            throw new IllegalArgumentException("minObservations must be at least 2, got " + minObservations);
        }
        if (defaultSigmaArcsec <= 0) {
            throw new IllegalArgumentException("defaultSigmaArcsec must be positive");
        }
    }

    @Override
    public RefinementOutcome refine(RefinementRequest request) {
        FittedOrbit candidate = request.candidate();
        RefinementParameters params = request.parameters();
        String orbitId = candidate.orbitId();
        Set<String> excluded = params.outliersFor(orbitId);

        Map<String, Observation> accepted = new LinkedHashMap<>();
        if (request.hasObservations()) {
            for (Observation obs : request.observations().observations()) {
                if (!excluded.contains(obs.id())) {
                    accepted.put(obs.id(), obs);
                }
            }
        }
        if (accepted.size() < minObservations) {
            log.debug("Orbit {} has {} usable observations, need {}; not refined", orbitId, accepted.size(), minObservations);
            return new RefinementOutcome(
                    candidate.withFit(candidate.arcLength(), accepted.size(), candidate.chi2(), candidate.reducedChi2(),
                            0, false, STATUS_TOO_FEW_OBSERVATIONS),
                    List.of(),
                    List.of(),
                    SearchSummary.notSearched(orbitId));
        }

        Set<String> outliers = new HashSet<>();
        Map<String, PrecoveryCandidate> found = new LinkedHashMap<>();
        LinearMotionFit fit = fit(accepted.values(), outliers, params);
        Statistics stats = statistics(fit, accepted.values(), outliers, params);

        double tolerance = params.minTolerance();
        double searchStart = Double.NaN;
        double searchEnd = Double.NaN;
        double finalTolerance = tolerance;
        int iterations = 0;
        int examined = 0;
        boolean converged = false;

        while (tolerance <= params.maxTolerance() + EPSILON) {
            iterations++;
            finalTolerance = tolerance;
            searchStart = stats.arcStart() - params.deltaTime();
            searchEnd = stats.arcEnd() + params.deltaTime();
            if (params.minMjd() != null) {
                searchStart = Math.max(searchStart, params.minMjd());
            }
            if (params.maxMjd() != null) {
                searchEnd = Math.min(searchEnd, params.maxMjd());
            }

            if (searchStart <= searchEnd) {
                examined += search(request.index(), fit, orbitId, searchStart, searchEnd, tolerance, params,
                        excluded, accepted, found);
            }

            fit = fit(accepted.values(), outliers, params);
            screenOutliers(fit, accepted.values(), outliers, params);
            fit = fit(accepted.values(), outliers, params);
            stats = statistics(fit, accepted.values(), outliers, params);

            if (stats.reducedChi2() <= params.rchi2Threshold()) {
                converged = true;
                break;
            }
            tolerance += params.toleranceStep();
        }

        FittedOrbit refined = candidate.withFit(stats.arcEnd() - stats.arcStart(), stats.numObs(), stats.chi2(),
                stats.reducedChi2(), iterations, converged, converged ? STATUS_CONVERGED : STATUS_NOT_CONVERGED);

        List<FittedOrbitMember> members = new ArrayList<>(accepted.size());
        for (Observation obs : accepted.values()) {
            boolean outlier = outliers.contains(obs.id());
            members.add(new FittedOrbitMember(orbitId, obs.id(), stats.residuals().get(obs.id()), !outlier, outlier));
        }

        SearchSummary summary = new SearchSummary(orbitId, searchStart, searchEnd, iterations, examined,
                found.size(), finalTolerance, converged);
        log.debug("Orbit {}: {} iterations, {} precovery candidates, rchi2={}, converged={}",
                orbitId, iterations, found.size(), stats.reducedChi2(), converged);
        return new RefinementOutcome(refined, members, new ArrayList<>(found.values()), summary);
    }

    private int search(IPrecoveryIndex index, LinearMotionFit fit, String orbitId, double start, double end,
                       double toleranceArcsec, RefinementParameters params, Set<String> excluded,
                       Map<String, Observation> accepted, Map<String, PrecoveryCandidate> found) {
        double[] atStart = fit.predict(start);
        double[] atEnd = fit.predict(end);
        double padding = toleranceArcsec / 3600.0;
        double minDec = Math.max(-90.0, Math.min(atStart[1], atEnd[1]) - padding);
        double maxDec = Math.min(90.0, Math.max(atStart[1], atEnd[1]) + padding);

        int examined = 0;
        for (Observation obs : index.findObservations(start, end, minDec, maxDec, params.datasets())) {
            if (excluded.contains(obs.id()) || accepted.containsKey(obs.id())) {
                continue;
            }
            examined++;
            double[] predicted = fit.predict(obs.time().mjd());
            double distance = LinearMotionFit.separationArcsec(obs.ra(), obs.dec(), predicted[0], predicted[1]);
            if (distance <= toleranceArcsec) {
                accepted.put(obs.id(), obs);
                found.put(obs.id(), new PrecoveryCandidate(orbitId, obs.id(), obs.datasetId(), obs.time(),
                        obs.originCode(), obs.ra(), obs.dec(), obs.raSigmaArcsec(), obs.decSigmaArcsec(),
                        predicted[0], predicted[1], distance));
            }
        }
        return examined;
    }

    /**
     * Flags residuals above {@code outlierChi2}, worst first, while keeping enough
     * observations for a fit, and re-admits flagged observations below {@code reconsiderChi2}.
     */
    private void screenOutliers(LinearMotionFit fit, Iterable<Observation> observations, Set<String> outliers,
                                RefinementParameters params) {
        List<Observation> ordered = new ArrayList<>();
        Map<String, Double> residuals = new LinkedHashMap<>();
        for (Observation obs : observations) {
            ordered.add(obs);
            residuals.put(obs.id(), residualChi2(fit, obs, params));
        }
        ordered.sort(Comparator.comparingDouble((Observation o) -> residuals.get(o.id())).reversed());

        int inliers = ordered.size() - outliers.size();
        for (Observation obs : ordered) {
            double chi2 = residuals.get(obs.id());
            if (outliers.contains(obs.id())) {
                if (chi2 < params.reconsiderChi2()) {
                    outliers.remove(obs.id());
                    inliers++;
                }
            } else if (chi2 > params.outlierChi2() && inliers > minObservations) {
                outliers.add(obs.id());
                inliers--;
            }
        }
    }

    private LinearMotionFit fit(Iterable<Observation> observations, Set<String> outliers, RefinementParameters params) {
        List<Observation> inliers = new ArrayList<>();
        for (Observation obs : observations) {
            if (!outliers.contains(obs.id())) {
                inliers.add(obs);
            }
        }
        return LinearMotionFit.fit(inliers, o -> raSigma(o, params), o -> decSigma(o, params));
    }

    private Statistics statistics(LinearMotionFit fit, Iterable<Observation> observations, Set<String> outliers,
                                  RefinementParameters params) {
        Map<String, Double> residuals = new LinkedHashMap<>();
        double chi2 = 0;
        int numObs = 0;
        double arcStart = Double.POSITIVE_INFINITY;
        double arcEnd = Double.NEGATIVE_INFINITY;
        for (Observation obs : observations) {
            double residual = residualChi2(fit, obs, params);
            residuals.put(obs.id(), residual);
            if (!outliers.contains(obs.id())) {
                chi2 += residual;
                numObs++;
                arcStart = Math.min(arcStart, obs.time().mjd());
                arcEnd = Math.max(arcEnd, obs.time().mjd());
            }
        }
        int dof = 2 * numObs - 4;
        double reducedChi2 = dof > 0 ? chi2 / dof : 0.0;
        return new Statistics(residuals, chi2, reducedChi2, numObs, arcStart, arcEnd);
    }

    private double residualChi2(LinearMotionFit fit, Observation obs, RefinementParameters params) {
        return fit.residualChi2(obs, raSigma(obs, params), decSigma(obs, params));
    }

    private double raSigma(Observation obs, RefinementParameters params) {
        if (obs.raSigmaArcsec() != null && obs.raSigmaArcsec() > 0) {
            return obs.raSigmaArcsec();
        }
        AstrometricError error = params.astrometricErrors().get(obs.originCode());
        return error != null ? error.raSigmaArcsec() : defaultSigmaArcsec;
    }

    private double decSigma(Observation obs, RefinementParameters params) {
        if (obs.decSigmaArcsec() != null && obs.decSigmaArcsec() > 0) {
            return obs.decSigmaArcsec();
        }
        AstrometricError error = params.astrometricErrors().get(obs.originCode());
        return error != null ? error.decSigmaArcsec() : defaultSigmaArcsec;
    }

    private record Statistics(Map<String, Double> residuals, double chi2, double reducedChi2, int numObs,
                              double arcStart, double arcEnd) {
    }
}
