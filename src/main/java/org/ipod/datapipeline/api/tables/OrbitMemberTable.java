package org.ipod.datapipeline.api.tables;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.ipod.datapipeline.api.model.FittedOrbitMember;

/**
 * Immutable table of orbit memberships: which observations currently support which orbit.
 */
public final class OrbitMemberTable {

    private final List<FittedOrbitMember> rows;
    private final Map<String, List<String>> obsIdsByOrbit;

    public OrbitMemberTable(List<FittedOrbitMember> rows) {
        this.rows = List.copyOf(rows);
        Map<String, List<String>> index = new LinkedHashMap<>();
        for (FittedOrbitMember row : this.rows) {
            index.computeIfAbsent(row.orbitId(), k -> new ArrayList<>()).add(row.obsId());
        }
        this.obsIdsByOrbit = Collections.unmodifiableMap(index);
    }

    /**
     * @param orbitId The orbit to look up.
     * @return Identifiers of the observations supporting the orbit, empty if it has none.
     */
    public List<String> obsIdsFor(String orbitId) {
        return Collections.unmodifiableList(obsIdsByOrbit.getOrDefault(orbitId, List.of()));
    }

    public List<FittedOrbitMember> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }
}
