package org.ipod.datapipeline.api.tables;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.ipod.datapipeline.api.model.Observation;

/**
 * Immutable pool of observations keyed by observation identifier.
 */
public final class ObservationTable {

    private final List<Observation> rows;
    private final Map<String, Observation> byId;

    public ObservationTable(List<Observation> rows) {
        this.rows = List.copyOf(rows);
        Map<String, Observation> index = new LinkedHashMap<>();
        for (Observation row : this.rows) {
            if (index.putIfAbsent(row.id(), row) != null) {
                throw new IllegalArgumentException("Duplicate observation id: " + row.id());
            }
        }
        this.byId = Collections.unmodifiableMap(index);
    }

    /**
     * Selects the observations whose identifier is in the given collection.
     * Identifiers without a matching observation are ignored.
     *
     * @param ids Observation identifiers.
     * @return Matching observations, each at most once, in the order of {@code ids}.
     */
    public List<Observation> select(Collection<String> ids) {
        Set<String> seen = new HashSet<>();
        List<Observation> selected = new ArrayList<>(ids.size());
        for (String id : ids) {
            Observation row = byId.get(id);
            if (row != null && seen.add(id)) {
                selected.add(row);
            }
        }
        return selected;
    }

    public Observation get(String id) {
        return byId.get(id);
    }

    public List<Observation> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }
}
