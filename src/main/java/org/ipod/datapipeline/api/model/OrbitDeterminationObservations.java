package org.ipod.datapipeline.api.model;

import java.util.Comparator;
import java.util.List;

/**
 * Observations paired one-to-one with the observers that made them, both in time order.
 * <p>
 * Index {@code i} of {@link #observers()} belongs to index {@code i} of {@link #observations()}.
 */
public record OrbitDeterminationObservations(List<Observation> observations, List<Observer> observers) {

    /** Sort order for observations: time days, time nanos, origin code. */
    public static final Comparator<Observation> OBSERVATION_ORDER = Comparator
            .comparingLong((Observation o) -> o.time().days())
            .thenComparingLong(o -> o.time().nanos())
            .thenComparing(Observation::originCode);

    /** Sort order for observers: time days, time nanos, code. */
    public static final Comparator<Observer> OBSERVER_ORDER = Comparator
            .comparingLong((Observer o) -> o.time().days())
            .thenComparingLong(o -> o.time().nanos())
            .thenComparing(Observer::code);

    public OrbitDeterminationObservations {
        if (observations.size() != observers.size()) {
            throw new IllegalArgumentException(String.format(
                    "Observations (%d) and observers (%d) must be paired one-to-one",
                    observations.size(), observers.size()));
        }
        observations = List.copyOf(observations);
        observers = List.copyOf(observers);
    }

    /**
     * Sorts the given observations, derives one observer per observation and pairs them.
     *
     * @param observations Observations in any order.
     * @return The paired, time ordered set.
     */
    public static OrbitDeterminationObservations fromObservations(List<Observation> observations) {
        List<Observation> sorted = observations.stream().sorted(OBSERVATION_ORDER).toList();
        List<Observer> observers = sorted.stream().map(Observation::observer).sorted(OBSERVER_ORDER).toList();
        return new OrbitDeterminationObservations(sorted, observers);
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }
}
