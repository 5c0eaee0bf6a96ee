package org.ipod.datapipeline.api.tables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.ipod.datapipeline.api.model.FittedOrbit;
import org.ipod.datapipeline.api.refinement.OrbitLookupException;

/**
 * Immutable, ordered table of orbits keyed by orbit identifier.
 * <p>
 * The table is shared read-only by every worker of a run. Duplicate identifiers are
 * accepted at construction time but make {@link #select(String)} fail for that identifier.
 */
public final class FittedOrbitTable {

    private static final FittedOrbitTable EMPTY = new FittedOrbitTable(List.of());

    private final List<FittedOrbit> rows;
    private final Map<String, List<FittedOrbit>> byId;

    public FittedOrbitTable(List<FittedOrbit> rows) {
        this.rows = List.copyOf(rows);
        Map<String, List<FittedOrbit>> index = new HashMap<>();
        for (FittedOrbit row : this.rows) {
            index.computeIfAbsent(row.orbitId(), k -> new ArrayList<>(1)).add(row);
        }
        this.byId = Collections.unmodifiableMap(index);
    }

    public static FittedOrbitTable empty() {
        return EMPTY;
    }

    /**
     * @return Orbit identifiers in table order.
     */
    public List<String> orbitIds() {
        return rows.stream().map(FittedOrbit::orbitId).toList();
    }

    /**
     * Selects the single row for an orbit identifier.
     *
     * @param orbitId The identifier to look up.
     * @return The matching row.
     * @throws OrbitLookupException if no row or more than one row matches.
     */
    public FittedOrbit select(String orbitId) {
        List<FittedOrbit> matches = byId.getOrDefault(orbitId, List.of());
        if (matches.size() != 1) {
            throw new OrbitLookupException(orbitId, String.format(
                    "Expected exactly one orbit with id '%s', found %d", orbitId, matches.size()));
        }
        return matches.get(0);
    }

    public List<FittedOrbit> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
