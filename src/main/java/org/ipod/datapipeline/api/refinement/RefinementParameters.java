package org.ipod.datapipeline.api.refinement;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;

/**
 * Tolerances, thresholds and filters handed to the refinement routine for every orbit of a run.
 *
 * @param minTolerance      Initial search tolerance (arcsec).
 * @param maxTolerance      Largest search tolerance (arcsec).
 * @param toleranceStep     Tolerance increment between iterations (arcsec).
 * @param deltaTime         Amount the search window grows on each side per iteration (days).
 * @param rchi2Threshold    Reduced chi2 at or below which a fit is accepted.
 * @param outlierChi2       Residual chi2 above which an observation is flagged as outlier.
 * @param reconsiderChi2    Residual chi2 below which a flagged outlier is re-admitted.
 * @param minMjd            Earliest time searched, {@code null} for unbounded.
 * @param maxMjd            Latest time searched, {@code null} for unbounded.
 * @param astrometricErrors Default uncertainties per observatory code.
 * @param datasets          Datasets to search, empty for all.
 * @param orbitOutliers     Observations to exclude up front, per orbit identifier.
 */
public record RefinementParameters(
        double minTolerance,
        double maxTolerance,
        double toleranceStep,
        double deltaTime,
        double rchi2Threshold,
        double outlierChi2,
        double reconsiderChi2,
        Double minMjd,
        Double maxMjd,
        Map<String, AstrometricError> astrometricErrors,
        Set<String> datasets,
        Map<String, Set<String>> orbitOutliers) {

    public RefinementParameters {
        if (minTolerance <= 0) {
            throw new IllegalArgumentException("minTolerance must be positive");
        }
        if (maxTolerance < minTolerance) {
            throw new IllegalArgumentException("maxTolerance must not be smaller than minTolerance");
        }
        if (toleranceStep <= 0) {
            throw new IllegalArgumentException("toleranceStep must be positive");
        }
        if (deltaTime < 0) {
            throw new IllegalArgumentException("deltaTime cannot be negative");
        }
        if (minMjd != null && maxMjd != null && minMjd > maxMjd) {
            throw new IllegalArgumentException("minMjd must not be after maxMjd");
        }
        astrometricErrors = Collections.unmodifiableMap(new LinkedHashMap<>(astrometricErrors));
        datasets = Collections.unmodifiableSet(new LinkedHashSet<>(datasets));
        Map<String, Set<String>> outliers = new HashMap<>();
        orbitOutliers.forEach((orbitId, obsIds) -> outliers.put(orbitId, Set.copyOf(obsIds)));
        orbitOutliers = Collections.unmodifiableMap(outliers);
    }

    /**
     * @return Parameters with every default applied.
     */
    public static RefinementParameters defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Reads parameters from a configuration block, falling back to the defaults for every
     * missing path.
     * <p>
     * Recognized options: {@code minTolerance} (1.0), {@code maxTolerance} (10.0),
     * {@code toleranceStep} (5.0), {@code deltaTime} (15.0), {@code rchi2Threshold} (3.0),
     * {@code outlierChi2} (9.0), {@code reconsiderChi2} (8.0), {@code minMjd} and
     * {@code maxMjd} (unset or {@code null} for unbounded), {@code astrometricErrors}
     * (object of observatory code to {@code [raSigma, decSigma]}), {@code datasets}
     * (list of dataset identifiers) and {@code orbitOutliers} (object of orbit identifier to
     * the observation identifiers excluded from that orbit).
     *
     * @param options The configuration block.
     * @return The parameters.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public static RefinementParameters fromConfig(Config options) {
        Config defaults = ConfigFactory.parseMap(Map.of(
                "minTolerance", 1.0,
                "maxTolerance", 10.0,
                "toleranceStep", 5.0,
                "deltaTime", 15.0,
                "rchi2Threshold", 3.0,
                "outlierChi2", 9.0,
                "reconsiderChi2", 8.0
        ));
        Config finalConfig = options.withFallback(defaults);

        try {
            Map<String, AstrometricError> errors = new LinkedHashMap<>();
            if (finalConfig.hasPath("astrometricErrors")) {
                Config errorConfig = finalConfig.getConfig("astrometricErrors");
                for (String code : errorConfig.root().keySet()) {
                    List<Double> sigmas = errorConfig.getDoubleList(ConfigUtil.joinPath(code));
                    if (sigmas.size() != 2) {
                        throw new IllegalArgumentException("astrometricErrors." + code + " must be [raSigma, decSigma]");
                    }
                    errors.put(code, new AstrometricError(sigmas.get(0), sigmas.get(1)));
                }
            }
            Map<String, Set<String>> orbitOutliers = new HashMap<>();
            if (finalConfig.hasPath("orbitOutliers")) {
                Config outlierConfig = finalConfig.getConfig("orbitOutliers");
                for (String orbitId : outlierConfig.root().keySet()) {
                    orbitOutliers.put(orbitId, new LinkedHashSet<>(outlierConfig.getStringList(ConfigUtil.joinPath(orbitId))));
                }
            }
            Set<String> datasets = finalConfig.hasPath("datasets")
                    ? new LinkedHashSet<>(finalConfig.getStringList("datasets"))
                    : Set.of();

            return new RefinementParameters(
                    finalConfig.getDouble("minTolerance"),
                    finalConfig.getDouble("maxTolerance"),
                    finalConfig.getDouble("toleranceStep"),
                    finalConfig.getDouble("deltaTime"),
                    finalConfig.getDouble("rchi2Threshold"),
                    finalConfig.getDouble("outlierChi2"),
                    finalConfig.getDouble("reconsiderChi2"),
                    optionalDouble(finalConfig, "minMjd"),
                    optionalDouble(finalConfig, "maxMjd"),
                    errors,
                    datasets,
                    orbitOutliers);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid refinement configuration", e);
        }
    }

    /**
     * Returns a copy of these parameters with the given per-orbit outlier exclusions.
     */
    public RefinementParameters withOrbitOutliers(Map<String, Set<String>> outliers) {
        return new RefinementParameters(minTolerance, maxTolerance, toleranceStep, deltaTime,
                rchi2Threshold, outlierChi2, reconsiderChi2, minMjd, maxMjd,
                astrometricErrors, datasets, outliers);
    }

    /**
     * @param orbitId An orbit identifier.
     * @return Observations excluded from that orbit, empty if none.
     */
    public Set<String> outliersFor(String orbitId) {
        return orbitOutliers.getOrDefault(orbitId, Set.of());
    }

    private static Double optionalDouble(Config config, String path) {
        if (!config.hasPathOrNull(path) || config.getIsNull(path)) {
            return null;
        }
        return config.getDouble(path);
    }
}
